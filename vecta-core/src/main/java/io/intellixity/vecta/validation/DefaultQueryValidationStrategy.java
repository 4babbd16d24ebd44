package io.intellixity.vecta.validation;

import io.intellixity.vecta.query.*;

import java.util.Objects;

/**
 * Default, backend-agnostic query validation.
 * <p>
 * Validates:
 * <ul>
 *   <li>target collection name</li>
 *   <li>per-operation required fields and size limits</li>
 *   <li>filter structure: nesting depth and group arity</li>
 * </ul>
 * The first violation wins; nothing is aggregated.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  public static final DefaultQueryValidationStrategy DEFAULT = new DefaultQueryValidationStrategy(QueryLimits.DEFAULTS);

  private final QueryLimits limits;

  public DefaultQueryValidationStrategy() {
    this(QueryLimits.DEFAULTS);
  }

  public DefaultQueryValidationStrategy(QueryLimits limits) {
    this.limits = Objects.requireNonNull(limits, "limits");
  }

  public QueryLimits limits() { return limits; }

  @Override
  public void validate(VectorQuery q) {
    Objects.requireNonNull(q, "query");
    if (q.target() == null || q.target().name() == null || q.target().name().isBlank()) {
      throw new QueryValidationException("target collection is required");
    }

    switch (q.operation()) {
      case SEARCH -> validateSearch(q);
      case UPSERT -> validateUpsert(q);
      case DELETE -> validateDelete(q);
      case FETCH -> validateFetch(q);
      case UPDATE -> validateUpdate(q);
    }
  }

  private void validateSearch(VectorQuery q) {
    if (q.queryVector() == null) throw new QueryValidationException("SEARCH requires a query vector");
    PaginationValue topK = q.topK();
    if (topK == null) throw new QueryValidationException("SEARCH requires topK");
    if (topK.isStatic()) {
      int k = topK.staticValue();
      if (k <= 0) throw new QueryValidationException("topK must be positive: " + k);
      if (k > limits.maxTopK()) {
        throw new QueryValidationException("topK exceeds maximum: " + k + " > " + limits.maxTopK());
      }
    }
    if (q.metadataFields().size() > limits.maxMetadataFields()) {
      throw new QueryValidationException(
          "metadata fields exceed maximum: " + q.metadataFields().size() + " > " + limits.maxMetadataFields());
    }
    if (q.filter() != null) validateFilter(q.filter(), 0);
  }

  private void validateUpsert(VectorQuery q) {
    if (q.vectors().isEmpty()) throw new QueryValidationException("UPSERT requires at least one vector");
    if (q.vectors().size() > limits.maxBatchSize()) {
      throw new QueryValidationException(
          "batch size exceeds maximum: " + q.vectors().size() + " > " + limits.maxBatchSize());
    }
  }

  private void validateDelete(VectorQuery q) {
    if (q.ids().isEmpty() && q.filter() == null) {
      throw new QueryValidationException("DELETE requires either ids or a filter");
    }
    if (q.filter() != null) {
      if (!q.deleteAll()) throw new QueryValidationException("DELETE by filter requires deleteAll flag");
      validateFilter(q.filter(), 0);
    }
    requireIdsWithinLimit(q);
  }

  private void validateFetch(VectorQuery q) {
    if (q.ids().isEmpty()) throw new QueryValidationException("FETCH requires at least one id");
    requireIdsWithinLimit(q);
  }

  private void validateUpdate(VectorQuery q) {
    if (q.ids().isEmpty()) throw new QueryValidationException("UPDATE requires at least one id");
    if (q.updates().isEmpty()) throw new QueryValidationException("UPDATE requires at least one field to update");
    requireIdsWithinLimit(q);
  }

  private void requireIdsWithinLimit(VectorQuery q) {
    if (q.ids().size() > limits.maxIds()) {
      throw new QueryValidationException("too many ids: " + q.ids().size() + " > " + limits.maxIds());
    }
  }

  /** Depth grows by one per group; the bound check doubles as the cycle guard. */
  private void validateFilter(FilterItem el, int depth) {
    if (el instanceof FilterGroup g) {
      int d = depth + 1;
      if (d > limits.maxFilterDepth()) {
        throw new QueryValidationException("filter nesting too deep: " + d + " > " + limits.maxFilterDepth());
      }
      int n = g.children().size();
      if (g.logic() == Logic.NOT && n != 1) {
        throw new QueryValidationException("NOT requires exactly one child: " + n);
      }
      if (n == 0) throw new QueryValidationException(g.logic() + " requires at least one child");
      for (FilterItem c : g.children()) validateFilter(c, d);
      return;
    }
    if (el instanceof FilterCondition || el instanceof RangeFilter || el instanceof GeoFilter) return;

    throw new QueryValidationException("Unsupported FilterItem: " + el.getClass().getName());
  }
}
