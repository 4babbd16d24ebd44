package io.intellixity.vecta.validation;

import io.intellixity.vecta.query.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.vecta.query.VectorFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class DefaultQueryValidationStrategyTest {
  private final DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();

  private static VectorQuery.Builder search() {
    return VectorQuery.search("docs").queryVector(Param.of("qv")).topK(10);
  }

  private static FilterItem nested(int depth) {
    FilterItem f = eq("a", "p");
    for (int i = 0; i < depth; i++) f = and(f);
    return f;
  }

  private String failure(VectorQuery q) {
    return assertThrows(QueryValidationException.class, () -> v.validate(q)).getMessage();
  }

  @Test
  void acceptsMinimalSearchRepeatedly() {
    VectorQuery q = search().buildWithoutValidation();
    v.validate(q);
    v.validate(q);
  }

  @Test
  void requiresTargetName() {
    VectorQuery q = VectorQuery.builder(Operation.FETCH, CollectionRef.of(" ")).ids("a").buildWithoutValidation();
    assertEquals("target collection is required", failure(q));
  }

  @Test
  void searchTopKBounds() {
    assertEquals("SEARCH requires topK",
        failure(VectorQuery.search("docs").queryVector(Param.of("qv")).buildWithoutValidation()));
    assertEquals("topK must be positive: 0", failure(search().topK(0).buildWithoutValidation()));
    assertEquals("topK exceeds maximum: 10001 > 10000", failure(search().topK(10_001).buildWithoutValidation()));
    v.validate(search().topK(10_000).buildWithoutValidation());
    v.validate(search().topK(Param.of("k")).buildWithoutValidation());
  }

  @Test
  void searchMetadataFieldLimit() {
    VectorQuery.Builder b = search();
    for (int i = 0; i < 51; i++) b.metadataFields("f" + i);
    assertEquals("metadata fields exceed maximum: 51 > 50", failure(b.buildWithoutValidation()));
  }

  @Test
  void filterDepthFiveOkSixFails() {
    v.validate(search().filter(nested(5)).buildWithoutValidation());
    assertEquals("filter nesting too deep: 6 > 5", failure(search().filter(nested(6)).buildWithoutValidation()));
  }

  @Test
  void configuredDepthLimitIsHonoured() {
    DefaultQueryValidationStrategy strict = new DefaultQueryValidationStrategy(QueryLimits.DEFAULTS.withMaxFilterDepth(1));
    strict.validate(search().filter(nested(1)).buildWithoutValidation());
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> strict.validate(search().filter(nested(2)).buildWithoutValidation()));
    assertEquals("filter nesting too deep: 2 > 1", ex.getMessage());
  }

  @Test
  void groupArity() {
    FilterGroup badNot = new FilterGroup(Logic.NOT, List.of(eq("a", "p"), eq("b", "q")));
    assertEquals("NOT requires exactly one child: 2", failure(search().filter(badNot).buildWithoutValidation()));
    FilterGroup emptyOr = new FilterGroup(Logic.OR, List.of());
    assertEquals("OR requires at least one child", failure(search().filter(emptyOr).buildWithoutValidation()));
  }

  @Test
  void upsertBatchLimit() {
    assertEquals("UPSERT requires at least one vector", failure(VectorQuery.upsert("docs").buildWithoutValidation()));
    List<VectorRecord> records = new ArrayList<>();
    for (int i = 0; i < 101; i++) {
      records.add(VectorRecord.builder(Param.of("id" + i), VectorValue.of(Param.of("v" + i))).build());
    }
    assertEquals("batch size exceeds maximum: 101 > 100",
        failure(VectorQuery.upsert("docs").vectors(records).buildWithoutValidation()));
    v.validate(VectorQuery.upsert("docs").vectors(records.subList(0, 100)).buildWithoutValidation());
  }

  @Test
  void deleteRules() {
    assertEquals("DELETE requires either ids or a filter", failure(VectorQuery.delete("docs").buildWithoutValidation()));
    assertEquals("DELETE by filter requires deleteAll flag",
        failure(VectorQuery.delete("docs").filter(eq("a", "p")).buildWithoutValidation()));
    v.validate(VectorQuery.delete("docs").filter(eq("a", "p")).deleteAll(true).buildWithoutValidation());
    v.validate(VectorQuery.delete("docs").ids("a", "b").buildWithoutValidation());
  }

  @Test
  void idLimits() {
    VectorQuery.Builder b = VectorQuery.fetch("docs");
    for (int i = 0; i < 1001; i++) b.ids("id" + i);
    assertEquals("too many ids: 1001 > 1000", failure(b.buildWithoutValidation()));
    assertEquals("FETCH requires at least one id", failure(VectorQuery.fetch("docs").buildWithoutValidation()));
  }

  @Test
  void updateRules() {
    assertEquals("UPDATE requires at least one id",
        failure(VectorQuery.update("docs").set("a", "p").buildWithoutValidation()));
    assertEquals("UPDATE requires at least one field to update",
        failure(VectorQuery.update("docs").ids("x").buildWithoutValidation()));
  }

  @Test
  void andThenRunsBothInOrder() {
    List<String> seen = new ArrayList<>();
    QueryValidationStrategy chained = ((QueryValidationStrategy) q -> seen.add("first")).andThen(q -> seen.add("second"));
    chained.validate(search().buildWithoutValidation());
    assertEquals(List.of("first", "second"), seen);

    QueryValidationStrategy failing = v.andThen(q -> fail("must not run"));
    assertThrows(QueryValidationException.class,
        () -> failing.validate(VectorQuery.fetch("docs").buildWithoutValidation()));
  }
}
