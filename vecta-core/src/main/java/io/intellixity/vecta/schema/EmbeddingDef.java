package io.intellixity.vecta.schema;

import io.intellixity.vecta.query.DistanceMetric;

import java.util.Objects;

public record EmbeddingDef(String name, int dimensions, DistanceMetric metric) {
  public EmbeddingDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(metric, "metric");
    if (dimensions <= 0) throw new IllegalArgumentException("embedding '" + name + "' dimensions must be positive: " + dimensions);
  }
}
