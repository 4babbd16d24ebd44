package io.intellixity.vecta.spi.dialect;

/** Discovers {@link VectorDialect} implementations, keyed by dialect id. */
public interface DialectProvider {
  String dialectId();

  VectorDialect create(DialectOptions options);
}
