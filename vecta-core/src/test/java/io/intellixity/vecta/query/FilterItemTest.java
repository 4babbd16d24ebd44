package io.intellixity.vecta.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FilterItemTest {
  @Test
  void existenceOperatorsTakeNoValue() {
    assertThrows(IllegalArgumentException.class,
        () -> new FilterCondition(MetadataField.of("a"), FilterOperator.EXISTS, Param.of("p")));
    assertDoesNotThrow(() -> new FilterCondition(MetadataField.of("a"), FilterOperator.NOT_EXISTS, null));
  }

  @Test
  void comparisonOperatorsRequireValue() {
    assertThrows(IllegalArgumentException.class,
        () -> new FilterCondition(MetadataField.of("a"), FilterOperator.EQ, null));
  }

  @Test
  void rangeRequiresAtLeastOneBound() {
    assertThrows(IllegalArgumentException.class, () -> VectorFilters.range("price", null, null));
    RangeFilter r = VectorFilters.rangeExclusive("price", "lo", null);
    assertTrue(r.minExclusive());
    assertNull(r.max());
  }

  @Test
  void notWrapsExactlyOneChild() {
    FilterGroup g = VectorFilters.not(VectorFilters.exists("a"));
    assertEquals(Logic.NOT, g.logic());
    assertEquals(1, g.children().size());
  }

  @Test
  void literalVectorRejectsNonFiniteComponents() {
    assertThrows(IllegalArgumentException.class, () -> VectorValue.literal(0.1f, Float.NaN));
    assertThrows(IllegalArgumentException.class, () -> new VectorValue(null, null));
    assertThrows(IllegalArgumentException.class, () -> new VectorValue(List.of(1f), Param.of("v")));
  }

  @Test
  void sparseVectorRequiresMatchingLengths() {
    assertThrows(IllegalArgumentException.class, () -> SparseVectorValue.literal(List.of(1, 2), List.of(0.5f)));
    assertThrows(IllegalArgumentException.class, () -> SparseVectorValue.literal(List.of(-1), List.of(0.5f)));
    assertEquals(List.of(3), SparseVectorValue.literal(List.of(3), List.of(0.5f)).indices());
  }

  @Test
  void fieldHandlesCompareByNameAndCollection() {
    assertEquals(MetadataField.of("docs", "a"), new MetadataField("a", "docs"));
    assertNotEquals(MetadataField.of("docs", "a"), MetadataField.of("a"));
  }
}
