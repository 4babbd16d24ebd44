package io.intellixity.vecta.milvus;

import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.DialectProvider;
import io.intellixity.vecta.spi.dialect.VectorDialect;

public final class MilvusDialectProvider implements DialectProvider {
  @Override public String dialectId() { return MilvusDialect.ID; }

  @Override
  public VectorDialect create(DialectOptions options) {
    return new MilvusDialect(options);
  }
}
