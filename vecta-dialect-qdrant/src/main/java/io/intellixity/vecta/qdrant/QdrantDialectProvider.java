package io.intellixity.vecta.qdrant;

import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.DialectProvider;
import io.intellixity.vecta.spi.dialect.VectorDialect;

public final class QdrantDialectProvider implements DialectProvider {
  @Override public String dialectId() { return QdrantDialect.ID; }

  @Override
  public VectorDialect create(DialectOptions options) {
    return new QdrantDialect(options);
  }
}
