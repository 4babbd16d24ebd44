package io.intellixity.vecta.weaviate;

import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.DialectProvider;
import io.intellixity.vecta.spi.dialect.VectorDialect;

public final class WeaviateDialectProvider implements DialectProvider {
  @Override public String dialectId() { return WeaviateDialect.ID; }

  @Override
  public VectorDialect create(DialectOptions options) {
    return new WeaviateDialect(options);
  }
}
