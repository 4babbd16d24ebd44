package io.intellixity.vecta.qdrant;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.OperatorFallback;
import io.intellixity.vecta.spi.dialect.OperatorTable;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderException;

import java.util.*;

/**
 * Renders {@link FilterItem} trees to Qdrant's clause-based filter.
 * <p>
 * Every node renders to a filter object ({@code must}/{@code should}/{@code must_not}), so groups nest
 * their children as sub-filters.
 */
final class QdrantFilterRenderer {
  static final String MUST = "must";
  static final String SHOULD = "should";
  static final String MUST_NOT = "must_not";

  /** Token is the key under {@code match} or {@code range}. */
  static final OperatorTable<String> OPERATORS = new OperatorTable<>(QdrantDialect.ID, operators(), FilterOperator.EQ);

  private QdrantFilterRenderer() {}

  private static Map<FilterOperator, String> operators() {
    Map<FilterOperator, String> m = new EnumMap<>(FilterOperator.class);
    m.put(FilterOperator.EQ, "value");
    m.put(FilterOperator.NE, "value");
    m.put(FilterOperator.GT, "gt");
    m.put(FilterOperator.GE, "gte");
    m.put(FilterOperator.LT, "lt");
    m.put(FilterOperator.LE, "lte");
    m.put(FilterOperator.IN, "any");
    m.put(FilterOperator.NOT_IN, "except");
    m.put(FilterOperator.CONTAINS, "text");
    m.put(FilterOperator.EXISTS, "is_empty");
    m.put(FilterOperator.NOT_EXISTS, "is_empty");
    m.put(FilterOperator.ARRAY_CONTAINS, "value");
    m.put(FilterOperator.ARRAY_CONTAINS_ANY, "any");
    return m;
  }

  static Map<String, Object> render(FilterItem el, RenderContext ctx, OperatorFallback fallback) {
    if (el instanceof FilterGroup g) {
      String clause = switch (g.logic()) {
        case AND -> MUST;
        case OR -> SHOULD;
        case NOT -> MUST_NOT;
      };
      List<Object> parts = new ArrayList<>(g.children().size());
      for (FilterItem child : g.children()) parts.add(render(child, ctx, fallback));
      return clause(clause, parts);
    }

    if (el instanceof FilterCondition c) {
      return condition(c, ctx, fallback);
    }

    if (el instanceof RangeFilter r) {
      Map<String, Object> bounds = new LinkedHashMap<>();
      if (r.min() != null) bounds.put(r.minExclusive() ? "gt" : "gte", ctx.add(r.min()));
      if (r.max() != null) bounds.put(r.maxExclusive() ? "lt" : "lte", ctx.add(r.max()));
      return clause(MUST, List.of(keyed(r.field(), "range", bounds)));
    }

    if (el instanceof GeoFilter geo) {
      Map<String, Object> center = new LinkedHashMap<>();
      center.put("lat", ctx.add(geo.center().lat()));
      center.put("lon", ctx.add(geo.center().lon()));
      Map<String, Object> radius = new LinkedHashMap<>();
      radius.put("center", center);
      radius.put("radius", ctx.add(geo.radius()));
      return clause(MUST, List.of(keyed(geo.field(), "geo_radius", radius)));
    }

    throw new RenderException("Unsupported FilterItem: " + el.getClass().getName());
  }

  private static Map<String, Object> condition(FilterCondition c, RenderContext ctx, OperatorFallback fallback) {
    FilterOperator op = OPERATORS.resolve(c.operator(), fallback);
    String token = OPERATORS.token(op);
    return switch (op) {
      case EXISTS -> clause(MUST_NOT, List.of(isEmpty(c.field())));
      case NOT_EXISTS -> clause(MUST, List.of(isEmpty(c.field())));
      case NE -> clause(MUST_NOT, List.of(keyed(c.field(), "match", single(token, ctx.add(c.value())))));
      case GT, GE, LT, LE -> clause(MUST, List.of(keyed(c.field(), "range", single(token, ctx.add(c.value())))));
      default -> clause(MUST, List.of(keyed(c.field(), "match", single(token, ctx.add(c.value())))));
    };
  }

  private static Map<String, Object> isEmpty(MetadataField field) {
    return single("is_empty", single("key", field.name()));
  }

  private static Map<String, Object> keyed(MetadataField field, String kind, Object body) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("key", field.name());
    m.put(kind, body);
    return m;
  }

  private static Map<String, Object> clause(String clause, List<?> conditions) {
    return single(clause, conditions);
  }

  private static Map<String, Object> single(String k, Object v) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k, v);
    return m;
  }
}
