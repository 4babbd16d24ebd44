package io.intellixity.vecta.schema;

import java.util.Objects;

public record MetadataDef(String name, MetadataType type) {
  public MetadataDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
