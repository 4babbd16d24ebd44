package io.intellixity.vecta.query;

import java.util.Objects;

/** Numeric range on a field. At least one bound is present; each bound has its own exclusivity. */
public record RangeFilter(MetadataField field, Param min, Param max,
                          boolean minExclusive, boolean maxExclusive) implements FilterItem {
  public RangeFilter {
    Objects.requireNonNull(field, "field");
    if (min == null && max == null) {
      throw new IllegalArgumentException("range on '" + field.name() + "' requires at least one bound");
    }
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
