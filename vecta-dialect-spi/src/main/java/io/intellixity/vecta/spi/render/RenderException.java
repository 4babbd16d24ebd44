package io.intellixity.vecta.spi.render;

/** Raised when a valid query cannot be rendered by a dialect or its document cannot be serialized. */
public final class RenderException extends RuntimeException {
  public RenderException(String message) {
    super(message);
  }

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
