package io.intellixity.vecta.query;

/**
 * Raised when a {@link VectorQuery} is structurally invalid or exceeds the configured limits.
 * <p>
 * Thrown by backend-agnostic validation, by the builder on operation misuse, and by dialects that add
 * their own pre-render checks.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
