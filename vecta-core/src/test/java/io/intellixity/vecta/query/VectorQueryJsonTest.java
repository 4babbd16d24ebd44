package io.intellixity.vecta.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.vecta.query.VectorFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class VectorQueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void writesCanonicalFilterForm() throws Exception {
    VectorQuery q = VectorQuery.search("docs").queryVector(Param.of("qv")).topK(3)
        .filter(and(eq("category", "cat"), not(exists("archived"))))
        .build();

    JsonNode n = JSON.readTree(JSON.writeValueAsString(q));
    assertEquals("SEARCH", n.get("operation").asText());
    assertEquals("docs", n.get("target").asText());
    assertEquals("qv", n.at("/queryVector/param").asText());
    assertEquals(3, n.get("topK").intValue());
    assertEquals("category", n.at("/filter/and/0/eq/field").asText());
    assertEquals("cat", n.at("/filter/and/0/eq/value/param").asText());
    assertEquals("archived", n.at("/filter/and/1/not/exists/field").asText());
  }

  @Test
  void readsWhatItWrites() throws Exception {
    VectorQuery q = VectorQuery.upsert("docs")
        .vector(VectorRecord.builder(Param.of("id1"), VectorValue.literal(0.5f, 0.25f))
            .metadata(MetadataField.of("docs", "cat"), Param.of("c1"))
            .sparseVector(SparseVectorValue.literal(List.of(1, 7), List.of(0.5f, 1.0f)))
            .build())
        .namespace(Param.of("ns"))
        .build();

    VectorQuery back = JSON.readValue(JSON.writeValueAsString(q), VectorQuery.class);
    assertEquals(q, back);
  }

  @Test
  void parsesRangeAndGeo() throws Exception {
    String s = """
        {
          "operation": "DELETE",
          "target": "places",
          "deleteAll": true,
          "filter": { "or": [
            { "range": { "field": "price", "min": { "param": "lo" }, "minExclusive": true } },
            { "geo": { "field": "loc", "lat": { "param": "la" }, "lon": { "param": "lo2" }, "radius": { "$param": "r" } } }
          ] }
        }
        """;
    VectorQuery q = JSON.readValue(s, VectorQuery.class);
    FilterGroup g = assertInstanceOf(FilterGroup.class, q.filter());
    RangeFilter r = assertInstanceOf(RangeFilter.class, g.children().get(0));
    assertTrue(r.minExclusive());
    assertNull(r.max());
    GeoFilter geo = assertInstanceOf(GeoFilter.class, g.children().get(1));
    assertEquals("r", geo.radius().name());
    assertTrue(q.deleteAll());
  }

  @Test
  void rejectsUnknownFilterElement() {
    String s = """
        { "operation": "SEARCH", "target": "docs", "filter": { "like": { "field": "a" } } }
        """;
    assertThrows(Exception.class, () -> JSON.readValue(s, VectorQuery.class));
  }
}
