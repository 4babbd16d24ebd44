package io.intellixity.vecta.query;

import java.util.Objects;

public record GeoPoint(Param lat, Param lon) {
  public GeoPoint {
    Objects.requireNonNull(lat, "lat");
    Objects.requireNonNull(lon, "lon");
  }
}
