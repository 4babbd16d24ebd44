package io.intellixity.vecta.query;

/**
 * Node of a filter tree: {@link FilterCondition}, {@link FilterGroup}, {@link RangeFilter} or {@link GeoFilter}.
 */
public interface FilterItem {
  <R> R accept(FilterVisitor<R> visitor);
}
