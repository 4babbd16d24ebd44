package io.intellixity.vecta.query;

/** Similarity metric of an embedding field. */
public enum DistanceMetric {
  COSINE,
  EUCLIDEAN,
  DOT_PRODUCT,
  MANHATTAN
}
