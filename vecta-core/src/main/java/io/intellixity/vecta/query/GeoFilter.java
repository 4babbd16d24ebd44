package io.intellixity.vecta.query;

import java.util.Objects;

/** Within-radius-of-point filter. Renderers always emit lat, lon, radius in that order. */
public record GeoFilter(MetadataField field, GeoPoint center, Param radius) implements FilterItem {
  public GeoFilter {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(center, "center");
    Objects.requireNonNull(radius, "radius");
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
