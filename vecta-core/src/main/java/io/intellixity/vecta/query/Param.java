package io.intellixity.vecta.query;

import java.util.Objects;

/**
 * Named placeholder for a value bound by the caller at execution time.
 * <p>
 * A Param has no value slot: rendered documents only ever carry the placeholder token.
 */
public record Param(String name) {
  public Param {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("param name must not be blank");
  }

  public static Param of(String name) { return new Param(name); }
}
