package io.intellixity.vecta.query;

import java.util.Objects;

/** Named embedding (vector) field, optionally scoped to a collection. */
public record EmbeddingField(String name, String collection) {
  public EmbeddingField {
    Objects.requireNonNull(name, "name");
  }

  public static EmbeddingField of(String name) { return new EmbeddingField(name, null); }
  public static EmbeddingField of(String collection, String name) { return new EmbeddingField(name, collection); }
}
