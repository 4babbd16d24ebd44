package io.intellixity.vecta.milvus;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.OperatorFallback;
import io.intellixity.vecta.spi.dialect.OperatorTable;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link FilterItem} trees to Milvus boolean expressions.
 * <p>
 * Tokens are format strings over (field, placeholder); existence checks take the field only.
 */
final class MilvusFilterRenderer {
  static final OperatorTable<String> OPERATORS = new OperatorTable<>(MilvusDialect.ID, operators(), FilterOperator.EQ);

  private MilvusFilterRenderer() {}

  private static Map<FilterOperator, String> operators() {
    Map<FilterOperator, String> m = new EnumMap<>(FilterOperator.class);
    m.put(FilterOperator.EQ, "%s == %s");
    m.put(FilterOperator.NE, "%s != %s");
    m.put(FilterOperator.GT, "%s > %s");
    m.put(FilterOperator.GE, "%s >= %s");
    m.put(FilterOperator.LT, "%s < %s");
    m.put(FilterOperator.LE, "%s <= %s");
    m.put(FilterOperator.IN, "%s in %s");
    m.put(FilterOperator.NOT_IN, "%s not in %s");
    // Caller binds the LIKE pattern (%x%, x%, %x)
    m.put(FilterOperator.CONTAINS, "%s like %s");
    m.put(FilterOperator.STARTS_WITH, "%s like %s");
    m.put(FilterOperator.ENDS_WITH, "%s like %s");
    m.put(FilterOperator.EXISTS, "%s is not null");
    m.put(FilterOperator.NOT_EXISTS, "%s is null");
    m.put(FilterOperator.ARRAY_CONTAINS, "array_contains(%s, %s)");
    m.put(FilterOperator.ARRAY_CONTAINS_ANY, "array_contains_any(%s, %s)");
    m.put(FilterOperator.ARRAY_CONTAINS_ALL, "array_contains_all(%s, %s)");
    return m;
  }

  static String render(FilterItem el, RenderContext ctx, OperatorFallback fallback) {
    if (el instanceof FilterGroup g) {
      if (g.logic() == Logic.NOT) {
        if (g.children().size() != 1) throw new RenderException("NOT requires exactly one child: " + g.children().size());
        return "not (" + render(g.children().get(0), ctx, fallback) + ")";
      }
      List<String> parts = new ArrayList<>(g.children().size());
      for (FilterItem child : g.children()) parts.add(render(child, ctx, fallback));
      return "(" + String.join(g.logic() == Logic.OR ? " or " : " and ", parts) + ")";
    }

    if (el instanceof FilterCondition c) {
      FilterOperator op = OPERATORS.resolve(c.operator(), fallback);
      String token = OPERATORS.token(op);
      if (op.isValueless()) return String.format(token, c.field().name());
      return String.format(token, c.field().name(), ctx.add(c.value()));
    }

    if (el instanceof RangeFilter r) {
      String field = r.field().name();
      List<String> parts = new ArrayList<>(2);
      if (r.min() != null) parts.add(field + (r.minExclusive() ? " > " : " >= ") + ctx.add(r.min()));
      if (r.max() != null) parts.add(field + (r.maxExclusive() ? " < " : " <= ") + ctx.add(r.max()));
      return "(" + String.join(" and ", parts) + ")";
    }

    if (el instanceof GeoFilter) {
      throw new RenderException("geo filters are not supported by dialect " + MilvusDialect.ID);
    }

    throw new RenderException("Unsupported FilterItem: " + el.getClass().getName());
  }
}
