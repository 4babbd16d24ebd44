package io.intellixity.vecta.pinecone;

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

final class PineconeDialectTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private final PineconeDialect dialect = new PineconeDialect();

  private static JsonNode doc(RenderResult r) throws Exception {
    return JSON.readTree(r.document());
  }

  private static VectorQuery.Builder search() {
    return VectorQuery.search("documents").queryVector(Param.of("query_vec")).topK(10);
  }

  @Test
  void rendersSearchWithFilter() {
    RenderResult r = dialect.render(search().filter(eq("category", "cat")).build());
    assertEquals("{\"topK\":10,\"includeValues\":false,\"includeMetadata\":true,\"vector\":\":query_vec\","
        + "\"filter\":{\"category\":{\"$eq\":\":cat\"}}}", r.document());
    assertEquals(List.of("query_vec", "cat"), r.requiredParams());
  }

  @Test
  void rendersParamTopKAndNamespace() throws Exception {
    RenderResult r = dialect.render(VectorQuery.search("documents").queryVector(VectorValue.literal(0.5f, 1.0f))
        .topK(Param.of("k")).namespace(Param.of("ns")).build());
    JsonNode n = doc(r);
    assertEquals(":k", n.get("topK").asText());
    assertEquals(0.5, n.get("vector").get(0).doubleValue(), 1e-6);
    assertEquals(":ns", n.get("namespace").asText());
    assertEquals(List.of("k", "ns"), r.requiredParams());
  }

  @Test
  void rendersNestedGroups() throws Exception {
    RenderResult r = dialect.render(search().filter(and(eq("category", "c"), or(gt("price", "min"), lt("price", "max")))).build());
    JsonNode f = doc(r).get("filter");
    assertEquals(":c", f.at("/$and/0/category/$eq").asText());
    assertEquals(":min", f.at("/$and/1/$or/0/price/$gt").asText());
    assertEquals(":max", f.at("/$and/1/$or/1/price/$lt").asText());
    assertEquals(List.of("query_vec", "c", "min", "max"), r.requiredParams());
  }

  @Test
  void pushesNotDownWithDeMorgan() throws Exception {
    RenderResult r = dialect.render(search().filter(not(and(eq("a", "x"), gt("b", "y"), in("c", "z")))).build());
    JsonNode f = doc(r).get("filter");
    assertEquals(":x", f.at("/$or/0/a/$ne").asText());
    assertEquals(":y", f.at("/$or/1/b/$lte").asText());
    assertEquals(":z", f.at("/$or/2/c/$nin").asText());
  }

  @Test
  void doubleNegationCancels() throws Exception {
    JsonNode f = doc(dialect.render(search().filter(not(not(exists("a")))).build())).get("filter");
    assertTrue(f.at("/a/$exists").booleanValue());
  }

  @Test
  void rendersExclusiveMinOnlyRange() throws Exception {
    RenderResult r = dialect.render(search().filter(rangeExclusive("price", "lo", null)).build());
    JsonNode f = doc(r).get("filter");
    assertEquals(":lo", f.at("/price/$gt").asText());
    assertFalse(f.get("price").has("$lte"));
    assertEquals(List.of("query_vec", "lo"), r.requiredParams());
  }

  @Test
  void negatedRangeBecomesDisjunctionOfComplements() throws Exception {
    JsonNode f = doc(dialect.render(search().filter(not(range("price", "lo", "hi"))).build())).get("filter");
    assertEquals(":lo", f.at("/$or/0/price/$lt").asText());
    assertEquals(":hi", f.at("/$or/1/price/$gt").asText());
  }

  @Test
  void unmappedOperatorFallsBackToEq() throws Exception {
    JsonNode f = doc(dialect.render(search().filter(contains("title", "t")).build())).get("filter");
    assertEquals(":t", f.at("/title/$eq").asText());
  }

  @Test
  void rejectPolicyFailsOnUnmappedOperator() {
    PineconeDialect strict = new PineconeDialect(DialectOptions.DEFAULTS.withOperatorFallback(OperatorFallback.REJECT));
    assertThrows(RenderException.class, () -> strict.render(search().filter(contains("title", "t")).build()));
  }

  @Test
  void rendersUpsert() throws Exception {
    VectorQuery q = VectorQuery.upsert("documents")
        .vector(VectorRecord.builder(Param.of("id1"), VectorValue.of(Param.of("v1")))
            .metadata(MetadataField.of("category"), Param.of("c1"))
            .sparseVector(SparseVectorValue.literal(List.of(1, 5), List.of(0.5f, 0.25f)))
            .build())
        .vector(VectorRecord.builder(Param.of("id2"), VectorValue.of(Param.of("v2")))
            .sparseVector(SparseVectorValue.of(Param.of("sp2")))
            .build())
        .build();
    RenderResult r = dialect.render(q);
    JsonNode v = doc(r).get("vectors");
    assertEquals(":id1", v.at("/0/id").asText());
    assertEquals(":c1", v.at("/0/metadata/category").asText());
    assertEquals(5, v.at("/0/sparseValues/indices/1").intValue());
    assertEquals(":sp2", v.at("/1/sparseValues").asText());
    assertEquals(List.of("id1", "v1", "c1", "id2", "v2", "sp2"), r.requiredParams());
  }

  @Test
  void rendersDeleteByIdsAndByFilter() throws Exception {
    RenderResult byIds = dialect.render(VectorQuery.delete("documents").ids("id1", "id2").build());
    assertEquals("{\"ids\":[\":id1\",\":id2\"]}", byIds.document());
    assertEquals(List.of("id1", "id2"), byIds.requiredParams());

    JsonNode byFilter = doc(dialect.render(VectorQuery.delete("documents").filter(eq("a", "x")).deleteAll(true).build()));
    assertFalse(byFilter.get("deleteAll").booleanValue());
    assertEquals(":x", byFilter.at("/filter/a/$eq").asText());
  }

  @Test
  void rendersFetchAndUpdate() {
    assertEquals("{\"ids\":[\":a\"],\"namespace\":\":ns\"}",
        dialect.render(VectorQuery.fetch("documents").ids("a").namespace(Param.of("ns")).build()).document());

    RenderResult u = dialect.render(VectorQuery.update("documents").ids("id").set("category", "c").build());
    assertEquals("{\"id\":\":id\",\"setMetadata\":{\"category\":\":c\"}}", u.document());
  }

  @Test
  void dialectChecks() {
    QueryValidationException multi = assertThrows(QueryValidationException.class,
        () -> dialect.render(VectorQuery.update("documents").ids("a", "b").set("x", "y").build()));
    assertTrue(multi.getMessage().contains("exactly one id"));
    assertThrows(QueryValidationException.class,
        () -> dialect.render(search().filter(and(geo("loc", "lat", "lon", "r"))).build()));
    assertThrows(QueryValidationException.class, () -> dialect.render(search().minScore(Param.of("s")).build()));
  }

  @Test
  void deleteRejectsIdsCombinedWithFilter() {
    VectorQuery q = VectorQuery.delete("documents").ids("id1").filter(eq("category", "c")).deleteAll(true).build();
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> dialect.render(q));
    assertEquals("pinecone DELETE takes either ids or a filter, not both", ex.getMessage());
  }

  @Test
  void capabilityTables() {
    assertTrue(dialect.supportsFilterOperator(FilterOperator.NOT_IN));
    assertTrue(dialect.supportsFilterOperator(FilterOperator.EXISTS));
    assertFalse(dialect.supportsFilterOperator(FilterOperator.CONTAINS));
    assertTrue(dialect.supportsMetric(DistanceMetric.DOT_PRODUCT));
    assertFalse(dialect.supportsMetric(DistanceMetric.MANHATTAN));
    for (Operation op : Operation.values()) assertTrue(dialect.supportsOperation(op));
  }
}
