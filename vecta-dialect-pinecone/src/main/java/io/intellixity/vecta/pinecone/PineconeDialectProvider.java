package io.intellixity.vecta.pinecone;

import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.DialectProvider;
import io.intellixity.vecta.spi.dialect.VectorDialect;

public final class PineconeDialectProvider implements DialectProvider {
  @Override public String dialectId() { return PineconeDialect.ID; }

  @Override
  public VectorDialect create(DialectOptions options) {
    return new PineconeDialect(options);
  }
}
