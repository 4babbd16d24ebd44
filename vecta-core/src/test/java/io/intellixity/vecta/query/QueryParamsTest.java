package io.intellixity.vecta.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.vecta.query.VectorFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryParamsTest {
  @Test
  void collectsSearchParamsInWalkOrderWithDuplicates() {
    VectorQuery q = VectorQuery.search("docs")
        .queryVector(Param.of("qv"))
        .topK(Param.of("k"))
        .minScore(Param.of("min"))
        .filter(or(eq("a", "x"), range("price", "x", "hi"), geo("loc", "lat", "lon", "r")))
        .namespace(Param.of("ns"))
        .build();

    List<String> names = QueryParams.referenced(q).stream().map(Param::name).toList();
    assertEquals(List.of("qv", "k", "min", "x", "x", "hi", "lat", "lon", "r", "ns"), names);
  }

  @Test
  void collectsUpsertRecordParams() {
    VectorQuery q = VectorQuery.upsert("docs")
        .vector(VectorRecord.builder(Param.of("id"), VectorValue.literal(0.1f))
            .metadata(MetadataField.of("cat"), Param.of("c"))
            .sparseVector(SparseVectorValue.of(Param.of("sp")))
            .build())
        .build();

    List<String> names = QueryParams.referenced(q).stream().map(Param::name).toList();
    assertEquals(List.of("id", "c", "sp"), names);
  }
}
