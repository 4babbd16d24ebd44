package io.intellixity.vecta.query;

public interface FilterVisitor<R> {
  R visit(FilterCondition condition);
  R visit(FilterGroup group);
  R visit(RangeFilter range);
  R visit(GeoFilter geo);
}
