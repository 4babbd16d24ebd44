package io.intellixity.vecta.spi.dialect;

/** What a dialect does with a filter operator its table does not map. */
public enum OperatorFallback {
  /** Render with the dialect's default (equality) operator. */
  FALLBACK_TO_DEFAULT,
  /** Fail the render. */
  REJECT
}
