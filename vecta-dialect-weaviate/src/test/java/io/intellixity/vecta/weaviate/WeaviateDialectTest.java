package io.intellixity.vecta.weaviate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.OperatorFallback;
import io.intellixity.vecta.spi.render.RenderException;
import io.intellixity.vecta.spi.render.RenderResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.vecta.query.VectorFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class WeaviateDialectTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private final WeaviateDialect dialect = new WeaviateDialect();

  private static JsonNode doc(RenderResult r) throws Exception {
    return JSON.readTree(r.document());
  }

  private static VectorQuery.Builder search() {
    return VectorQuery.search("documents").queryVector(Param.of("query_vec")).topK(10);
  }

  @Test
  void classNameUpperCasesFirstLetter() {
    assertEquals("Documents", WeaviateDialect.className("documents"));
    assertEquals("X", WeaviateDialect.className("x"));
    assertEquals("", WeaviateDialect.className(""));
  }

  @Test
  void rendersSearch() {
    RenderResult r = dialect.render(search().filter(eq("category", "cat")).build());
    assertEquals("{\"class\":\"Documents\",\"nearVector\":{\"vector\":\":query_vec\"},\"limit\":10,"
        + "\"where\":{\"path\":[\"category\"],\"operator\":\"Equal\",\"valueString\":\":cat\"},"
        + "\"additional\":[\"distance\",\"certainty\"]}", r.document());
    assertEquals(List.of("query_vec", "cat"), r.requiredParams());
  }

  @Test
  void rendersSearchOptions() throws Exception {
    RenderResult r = dialect.render(search().minScore(Param.of("min")).queryEmbedding(EmbeddingField.of("content"))
        .includeVectors(true).metadataFields("title").namespace(Param.of("tenant")).build());
    JsonNode n = doc(r);
    assertEquals(":min", n.at("/nearVector/certainty").asText());
    assertEquals("content", n.at("/nearVector/targetVectors/0").asText());
    assertEquals("title", n.at("/properties/0").asText());
    assertEquals(":tenant", n.get("tenant").asText());
    assertEquals("vector", n.at("/additional/0").asText());
    assertEquals(List.of("query_vec", "min", "tenant"), r.requiredParams());
  }

  @Test
  void rendersNestedGroups() throws Exception {
    RenderResult r = dialect.render(search().filter(and(eq("category", "c"), or(gt("price", "min"), not(exists("x"))))).build());
    JsonNode w = doc(r).get("where");
    assertEquals("And", w.get("operator").asText());
    assertEquals("Or", w.at("/operands/1/operator").asText());
    assertEquals(":min", w.at("/operands/1/operands/0/valueNumber").asText());
    assertEquals("Not", w.at("/operands/1/operands/1/operator").asText());
    JsonNode isNull = w.at("/operands/1/operands/1/operands/0");
    assertEquals("IsNull", isNull.get("operator").asText());
    assertFalse(isNull.get("valueBoolean").booleanValue());
    assertEquals(List.of("query_vec", "c", "min"), r.requiredParams());
  }

  @Test
  void rendersRanges() throws Exception {
    JsonNode single = doc(dialect.render(search().filter(rangeExclusive("price", "lo", null)).build())).get("where");
    assertEquals("GreaterThan", single.get("operator").asText());
    assertEquals(":lo", single.get("valueNumber").asText());

    JsonNode both = doc(dialect.render(search().filter(range("price", "lo", "hi")).build())).get("where");
    assertEquals("And", both.get("operator").asText());
    assertEquals("LessThanEqual", both.at("/operands/1/operator").asText());
  }

  @Test
  void rendersGeoRange() throws Exception {
    RenderResult r = dialect.render(search().filter(geo("location", "lat", "lon", "radius")).build());
    JsonNode w = doc(r).get("where");
    assertEquals("WithinGeoRange", w.get("operator").asText());
    assertEquals(":lat", w.at("/valueGeoRange/geoCoordinates/latitude").asText());
    assertEquals(":radius", w.at("/valueGeoRange/distance/max").asText());
    assertEquals(List.of("query_vec", "lat", "lon", "radius"), r.requiredParams());
  }

  @Test
  void rendersUpsert() throws Exception {
    RenderResult r = dialect.render(VectorQuery.upsert("documents")
        .vector(VectorRecord.builder(Param.of("id1"), VectorValue.literal(0.5f))
            .metadata(MetadataField.of("title"), Param.of("t1")).build())
        .namespace(Param.of("tenant"))
        .build());
    JsonNode n = doc(r);
    assertEquals("Documents", n.at("/objects/0/class").asText());
    assertEquals(":t1", n.at("/objects/0/properties/title").asText());
    assertEquals(List.of("id1", "t1", "tenant"), r.requiredParams());
  }

  @Test
  void rendersDeleteFetchUpdate() throws Exception {
    assertEquals("{\"class\":\"Documents\",\"ids\":[\":a\"]}",
        dialect.render(VectorQuery.delete("documents").ids("a").build()).document());

    JsonNode byFilter = doc(dialect.render(VectorQuery.delete("documents").filter(ne("a", "x")).deleteAll(true).build()));
    assertEquals("NotEqual", byFilter.at("/where/operator").asText());

    assertEquals("{\"class\":\"Documents\",\"ids\":[\":a\"],\"additional\":[\"vector\"]}",
        dialect.render(VectorQuery.fetch("documents").ids("a").build()).document());

    assertEquals("{\"class\":\"Documents\",\"id\":\":a\",\"properties\":{\"title\":\":t\"}}",
        dialect.render(VectorQuery.update("documents").ids("a").set("title", "t").build()).document());
  }

  @Test
  void dialectChecks() {
    assertThrows(QueryValidationException.class,
        () -> dialect.render(VectorQuery.update("documents").ids("a", "b").set("x", "y").build()));
    assertThrows(QueryValidationException.class, () -> dialect.render(VectorQuery.upsert("documents")
        .vector(VectorRecord.builder(Param.of("id"), VectorValue.of(Param.of("v")))
            .sparseVector(SparseVectorValue.of(Param.of("sp"))).build())
        .build()));
  }

  @Test
  void deleteRejectsIdsCombinedWithFilter() {
    VectorQuery q = VectorQuery.delete("documents").ids("id1").filter(eq("category", "c")).deleteAll(true).build();
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> dialect.render(q));
    assertEquals("weaviate DELETE takes either ids or a filter, not both", ex.getMessage());
  }

  @Test
  void unmappedOperatorFallsBackToEqual() {
    for (FilterItem f : List.of(in("tag", "v"), notIn("tag", "v"), startsWith("tag", "v"), endsWith("tag", "v"))) {
      RenderResult r = dialect.render(search().filter(f).build());
      assertTrue(r.document().contains(
          "\"where\":{\"path\":[\"tag\"],\"operator\":\"Equal\",\"valueString\":\":v\"}"), r.document());
      assertEquals(List.of("query_vec", "v"), r.requiredParams());
    }
  }

  @Test
  void rejectPolicyFailsOnUnmappedOperator() {
    WeaviateDialect strict = new WeaviateDialect(DialectOptions.DEFAULTS.withOperatorFallback(OperatorFallback.REJECT));
    RenderException ex = assertThrows(RenderException.class, () -> strict.render(search().filter(in("tag", "v")).build()));
    assertEquals("operator IN is not supported by dialect weaviate", ex.getMessage());
    assertDoesNotThrow(() -> strict.render(search().filter(eq("tag", "v")).build()));
  }

  @Test
  void capabilityTables() {
    assertTrue(dialect.supportsFilterOperator(FilterOperator.ARRAY_CONTAINS_ALL));
    assertTrue(dialect.supportsFilterOperator(FilterOperator.MATCHES));
    assertFalse(dialect.supportsFilterOperator(FilterOperator.IN));
    assertTrue(dialect.supportsMetric(DistanceMetric.MANHATTAN));
  }
}
