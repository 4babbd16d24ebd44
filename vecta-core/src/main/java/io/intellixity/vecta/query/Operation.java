package io.intellixity.vecta.query;

/** Vector database operation carried by a {@link VectorQuery}. */
public enum Operation {
  SEARCH,
  UPSERT,
  DELETE,
  FETCH,
  UPDATE
}
