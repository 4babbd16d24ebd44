package io.intellixity.vecta.query;

/** Complexity ceilings applied by validation. */
public record QueryLimits(int maxFilterDepth, int maxBatchSize, int maxTopK, int maxMetadataFields, int maxIds) {
  public static final QueryLimits DEFAULTS = new QueryLimits(5, 100, 10_000, 50, 1_000);

  public QueryLimits {
    if (maxFilterDepth < 1 || maxBatchSize < 1 || maxTopK < 1 || maxMetadataFields < 0 || maxIds < 1) {
      throw new IllegalArgumentException("query limits must be positive: " + maxFilterDepth + "/" + maxBatchSize
          + "/" + maxTopK + "/" + maxMetadataFields + "/" + maxIds);
    }
  }

  public QueryLimits withMaxFilterDepth(int v) { return new QueryLimits(v, maxBatchSize, maxTopK, maxMetadataFields, maxIds); }
  public QueryLimits withMaxBatchSize(int v) { return new QueryLimits(maxFilterDepth, v, maxTopK, maxMetadataFields, maxIds); }
  public QueryLimits withMaxTopK(int v) { return new QueryLimits(maxFilterDepth, maxBatchSize, v, maxMetadataFields, maxIds); }
  public QueryLimits withMaxMetadataFields(int v) { return new QueryLimits(maxFilterDepth, maxBatchSize, maxTopK, v, maxIds); }
  public QueryLimits withMaxIds(int v) { return new QueryLimits(maxFilterDepth, maxBatchSize, maxTopK, maxMetadataFields, v); }
}
