package io.intellixity.vecta.query;

import java.util.Objects;

/** Target collection (index/class) of a query. */
public record CollectionRef(String name) {
  public CollectionRef {
    Objects.requireNonNull(name, "name");
  }

  public static CollectionRef of(String name) { return new CollectionRef(name); }
}
