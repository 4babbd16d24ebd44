package io.intellixity.vecta.spi.dialect;

import io.intellixity.vecta.query.FilterOperator;
import io.intellixity.vecta.spi.render.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps universal filter operators to a dialect's native tokens.
 * <p>
 * {@link #supports} is true exactly for the mapped operators. {@link #resolve} applies the configured
 * {@link OperatorFallback} to everything else.
 */
public final class OperatorTable<T> {
  private static final Logger log = LoggerFactory.getLogger(OperatorTable.class);

  private final String dialectId;
  private final Map<FilterOperator, T> mapped;
  private final FilterOperator defaultOperator;

  public OperatorTable(String dialectId, Map<FilterOperator, T> mapped, FilterOperator defaultOperator) {
    this.dialectId = Objects.requireNonNull(dialectId, "dialectId");
    this.mapped = Collections.unmodifiableMap(new EnumMap<>(mapped));
    this.defaultOperator = Objects.requireNonNull(defaultOperator, "defaultOperator");
    if (!this.mapped.containsKey(defaultOperator)) {
      throw new IllegalArgumentException("default operator " + defaultOperator + " is not mapped for " + dialectId);
    }
  }

  public boolean supports(FilterOperator op) {
    return op != null && mapped.containsKey(op);
  }

  /** Returns the operator to render: {@code op} itself when mapped, otherwise per the fallback policy. */
  public FilterOperator resolve(FilterOperator op, OperatorFallback fallback) {
    if (supports(op)) return op;
    if (fallback == OperatorFallback.REJECT) {
      throw new RenderException("operator " + op + " is not supported by dialect " + dialectId);
    }
    log.debug("vecta.operator_fallback dialect={} op={} fallback={}", dialectId, op, defaultOperator);
    return defaultOperator;
  }

  public T token(FilterOperator op) {
    T t = mapped.get(op);
    if (t == null) throw new RenderException("operator " + op + " is not mapped for dialect " + dialectId);
    return t;
  }
}
