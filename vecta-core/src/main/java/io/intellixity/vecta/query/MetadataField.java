package io.intellixity.vecta.query;

import java.util.Objects;

/** Named metadata (payload/property) field, optionally scoped to a collection. */
public record MetadataField(String name, String collection) {
  public MetadataField {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("metadata field name must not be blank");
  }

  public static MetadataField of(String name) { return new MetadataField(name, null); }
  public static MetadataField of(String collection, String name) { return new MetadataField(name, collection); }
}
