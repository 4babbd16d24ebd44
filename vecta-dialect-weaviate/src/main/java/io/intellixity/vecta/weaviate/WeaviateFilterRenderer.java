package io.intellixity.vecta.weaviate;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.OperatorFallback;
import io.intellixity.vecta.spi.dialect.OperatorTable;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderException;

import java.util.*;

/** Renders {@link FilterItem} trees to Weaviate {@code where} filters ({@code path}/{@code operator}/{@code value*}). */
final class WeaviateFilterRenderer {
  /** Native operator plus the typed value key its operand goes under. */
  record WhereOperator(String operator, String valueKey) {}

  static final OperatorTable<WhereOperator> OPERATORS = new OperatorTable<>(WeaviateDialect.ID, operators(), FilterOperator.EQ);

  private WeaviateFilterRenderer() {}

  private static Map<FilterOperator, WhereOperator> operators() {
    Map<FilterOperator, WhereOperator> m = new EnumMap<>(FilterOperator.class);
    m.put(FilterOperator.EQ, new WhereOperator("Equal", "valueString"));
    m.put(FilterOperator.NE, new WhereOperator("NotEqual", "valueString"));
    m.put(FilterOperator.GT, new WhereOperator("GreaterThan", "valueNumber"));
    m.put(FilterOperator.GE, new WhereOperator("GreaterThanEqual", "valueNumber"));
    m.put(FilterOperator.LT, new WhereOperator("LessThan", "valueNumber"));
    m.put(FilterOperator.LE, new WhereOperator("LessThanEqual", "valueNumber"));
    m.put(FilterOperator.CONTAINS, new WhereOperator("ContainsAny", "valueStringArray"));
    m.put(FilterOperator.MATCHES, new WhereOperator("Like", "valueText"));
    m.put(FilterOperator.EXISTS, new WhereOperator("IsNull", "valueBoolean"));
    m.put(FilterOperator.NOT_EXISTS, new WhereOperator("IsNull", "valueBoolean"));
    m.put(FilterOperator.ARRAY_CONTAINS, new WhereOperator("ContainsAny", "valueStringArray"));
    m.put(FilterOperator.ARRAY_CONTAINS_ANY, new WhereOperator("ContainsAny", "valueStringArray"));
    m.put(FilterOperator.ARRAY_CONTAINS_ALL, new WhereOperator("ContainsAll", "valueStringArray"));
    return m;
  }

  static Map<String, Object> render(FilterItem el, RenderContext ctx, OperatorFallback fallback) {
    if (el instanceof FilterGroup g) {
      String op = switch (g.logic()) {
        case AND -> "And";
        case OR -> "Or";
        case NOT -> "Not";
      };
      List<Object> operands = new ArrayList<>(g.children().size());
      for (FilterItem child : g.children()) operands.add(render(child, ctx, fallback));
      return group(op, operands);
    }

    if (el instanceof FilterCondition c) {
      FilterOperator op = OPERATORS.resolve(c.operator(), fallback);
      WhereOperator w = OPERATORS.token(op);
      // IsNull carries the boolean itself rather than a bound value
      Object value = switch (op) {
        case EXISTS -> false;
        case NOT_EXISTS -> true;
        default -> ctx.add(c.value());
      };
      return leaf(c.field(), w.operator(), w.valueKey(), value);
    }

    if (el instanceof RangeFilter r) {
      List<Object> operands = new ArrayList<>(2);
      if (r.min() != null) {
        operands.add(leaf(r.field(), r.minExclusive() ? "GreaterThan" : "GreaterThanEqual", "valueNumber", ctx.add(r.min())));
      }
      if (r.max() != null) {
        operands.add(leaf(r.field(), r.maxExclusive() ? "LessThan" : "LessThanEqual", "valueNumber", ctx.add(r.max())));
      }
      if (operands.size() == 1) {
        @SuppressWarnings("unchecked")
        Map<String, Object> only = (Map<String, Object>) operands.get(0);
        return only;
      }
      return group("And", operands);
    }

    if (el instanceof GeoFilter geo) {
      Map<String, Object> coords = new LinkedHashMap<>();
      coords.put("latitude", ctx.add(geo.center().lat()));
      coords.put("longitude", ctx.add(geo.center().lon()));
      Map<String, Object> distance = new LinkedHashMap<>();
      distance.put("max", ctx.add(geo.radius()));
      Map<String, Object> range = new LinkedHashMap<>();
      range.put("geoCoordinates", coords);
      range.put("distance", distance);
      return leaf(geo.field(), "WithinGeoRange", "valueGeoRange", range);
    }

    throw new RenderException("Unsupported FilterItem: " + el.getClass().getName());
  }

  private static Map<String, Object> leaf(MetadataField field, String operator, String valueKey, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("path", List.of(field.name()));
    m.put("operator", operator);
    m.put(valueKey, value);
    return m;
  }

  private static Map<String, Object> group(String operator, List<Object> operands) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("operator", operator);
    m.put("operands", operands);
    return m;
  }
}
