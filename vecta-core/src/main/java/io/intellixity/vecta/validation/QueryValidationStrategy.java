package io.intellixity.vecta.validation;

import io.intellixity.vecta.query.QueryValidationException;
import io.intellixity.vecta.query.VectorQuery;

import java.util.Objects;

/**
 * SPI hook to validate queries before dialect rendering.
 * <p>
 * Implementations throw {@link QueryValidationException} for the first rule violated; returning normally
 * means the query is acceptable. Dialects chain their backend-specific checks after the default strategy
 * with {@link #andThen(QueryValidationStrategy)}.
 */
@FunctionalInterface
public interface QueryValidationStrategy {
  void validate(VectorQuery query);

  default QueryValidationStrategy andThen(QueryValidationStrategy next) {
    Objects.requireNonNull(next, "next");
    return q -> {
      validate(q);
      next.validate(q);
    };
  }
}
