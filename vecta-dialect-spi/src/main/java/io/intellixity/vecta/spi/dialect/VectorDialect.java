package io.intellixity.vecta.spi.dialect;

import io.intellixity.vecta.query.DistanceMetric;
import io.intellixity.vecta.query.FilterOperator;
import io.intellixity.vecta.query.Operation;
import io.intellixity.vecta.query.VectorQuery;
import io.intellixity.vecta.spi.render.RenderResult;

/**
 * Backend-specific renderer: validates a {@link VectorQuery} and emits the backend's JSON request document
 * plus the ordered names of the params the caller must bind.
 * <p>
 * The {@code supports*} predicates are static lookup tables that do not depend on any query instance.
 */
public interface VectorDialect {
  String id();

  /**
   * @throws io.intellixity.vecta.query.QueryValidationException when the query fails validation
   * @throws io.intellixity.vecta.spi.render.RenderException when the query cannot be expressed or serialized
   */
  RenderResult render(VectorQuery query);

  boolean supportsOperation(Operation operation);

  boolean supportsFilterOperator(FilterOperator operator);

  boolean supportsMetric(DistanceMetric metric);
}
