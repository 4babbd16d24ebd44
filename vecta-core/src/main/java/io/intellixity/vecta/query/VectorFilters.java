package io.intellixity.vecta.query;

import java.util.Arrays;
import java.util.List;

/** Small helpers to build filter trees without verbose constructors. */
public final class VectorFilters {
  private VectorFilters() {}

  public static FilterCondition eq(String field, String param) { return cond(field, FilterOperator.EQ, param); }
  public static FilterCondition ne(String field, String param) { return cond(field, FilterOperator.NE, param); }
  public static FilterCondition gt(String field, String param) { return cond(field, FilterOperator.GT, param); }
  public static FilterCondition ge(String field, String param) { return cond(field, FilterOperator.GE, param); }
  public static FilterCondition lt(String field, String param) { return cond(field, FilterOperator.LT, param); }
  public static FilterCondition le(String field, String param) { return cond(field, FilterOperator.LE, param); }
  public static FilterCondition in(String field, String param) { return cond(field, FilterOperator.IN, param); }
  public static FilterCondition notIn(String field, String param) { return cond(field, FilterOperator.NOT_IN, param); }
  public static FilterCondition contains(String field, String param) { return cond(field, FilterOperator.CONTAINS, param); }
  public static FilterCondition startsWith(String field, String param) { return cond(field, FilterOperator.STARTS_WITH, param); }
  public static FilterCondition endsWith(String field, String param) { return cond(field, FilterOperator.ENDS_WITH, param); }
  public static FilterCondition matches(String field, String param) { return cond(field, FilterOperator.MATCHES, param); }
  public static FilterCondition arrayContains(String field, String param) { return cond(field, FilterOperator.ARRAY_CONTAINS, param); }
  public static FilterCondition arrayContainsAny(String field, String param) { return cond(field, FilterOperator.ARRAY_CONTAINS_ANY, param); }
  public static FilterCondition arrayContainsAll(String field, String param) { return cond(field, FilterOperator.ARRAY_CONTAINS_ALL, param); }

  public static FilterCondition exists(String field) {
    return new FilterCondition(MetadataField.of(field), FilterOperator.EXISTS, null);
  }

  public static FilterCondition notExists(String field) {
    return new FilterCondition(MetadataField.of(field), FilterOperator.NOT_EXISTS, null);
  }

  public static FilterCondition condition(MetadataField field, FilterOperator op, Param value) {
    return new FilterCondition(field, op, value);
  }

  public static FilterGroup and(FilterItem... items) { return new FilterGroup(Logic.AND, Arrays.asList(items)); }
  public static FilterGroup or(FilterItem... items) { return new FilterGroup(Logic.OR, Arrays.asList(items)); }
  public static FilterGroup and(List<? extends FilterItem> items) { return new FilterGroup(Logic.AND, List.copyOf(items)); }
  public static FilterGroup or(List<? extends FilterItem> items) { return new FilterGroup(Logic.OR, List.copyOf(items)); }

  public static FilterGroup not(FilterItem item) {
    if (item == null) throw new IllegalArgumentException("not requires exactly one child");
    return new FilterGroup(Logic.NOT, List.of(item));
  }

  /** Inclusive range; either bound may be null, but not both. */
  public static RangeFilter range(String field, String minParam, String maxParam) {
    return new RangeFilter(MetadataField.of(field), param(minParam), param(maxParam), false, false);
  }

  public static RangeFilter rangeExclusive(String field, String minParam, String maxParam) {
    return new RangeFilter(MetadataField.of(field), param(minParam), param(maxParam), true, true);
  }

  public static GeoFilter geo(String field, String latParam, String lonParam, String radiusParam) {
    return new GeoFilter(MetadataField.of(field), new GeoPoint(Param.of(latParam), Param.of(lonParam)), Param.of(radiusParam));
  }

  private static FilterCondition cond(String field, FilterOperator op, String param) {
    return new FilterCondition(MetadataField.of(field), op, Param.of(param));
  }

  private static Param param(String name) {
    return name == null ? null : Param.of(name);
  }
}
