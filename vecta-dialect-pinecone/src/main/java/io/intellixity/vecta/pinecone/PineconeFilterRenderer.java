package io.intellixity.vecta.pinecone;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.OperatorFallback;
import io.intellixity.vecta.spi.dialect.OperatorTable;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderException;
import org.bson.Document;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link FilterItem} trees to Pinecone's Mongo-style metadata filter ({@link Document}).
 * <p>
 * Pinecone has no {@code $not} container, so NOT groups are pushed down with De Morgan: operators are
 * inverted and AND/OR swap.
 */
final class PineconeFilterRenderer {
  static final OperatorTable<String> OPERATORS = new OperatorTable<>(PineconeDialect.ID, operators(), FilterOperator.EQ);

  private PineconeFilterRenderer() {}

  private static Map<FilterOperator, String> operators() {
    Map<FilterOperator, String> m = new EnumMap<>(FilterOperator.class);
    m.put(FilterOperator.EQ, "$eq");
    m.put(FilterOperator.NE, "$ne");
    m.put(FilterOperator.GT, "$gt");
    m.put(FilterOperator.GE, "$gte");
    m.put(FilterOperator.LT, "$lt");
    m.put(FilterOperator.LE, "$lte");
    m.put(FilterOperator.IN, "$in");
    m.put(FilterOperator.NOT_IN, "$nin");
    m.put(FilterOperator.EXISTS, "$exists");
    m.put(FilterOperator.NOT_EXISTS, "$exists");
    return m;
  }

  static Document render(FilterItem el, RenderContext ctx, OperatorFallback fallback) {
    return render(el, ctx, fallback, false);
  }

  private static Document render(FilterItem el, RenderContext ctx, OperatorFallback fallback, boolean negate) {
    if (el instanceof FilterGroup g) {
      if (g.logic() == Logic.NOT) {
        if (g.children().size() != 1) throw new RenderException("NOT requires exactly one child: " + g.children().size());
        return render(g.children().get(0), ctx, fallback, !negate);
      }
      Logic logic = g.logic();
      if (negate) logic = (logic == Logic.OR) ? Logic.AND : Logic.OR;

      List<Document> parts = new ArrayList<>();
      for (FilterItem child : g.children()) parts.add(render(child, ctx, fallback, negate));
      if (parts.size() == 1) return parts.get(0);
      return new Document((logic == Logic.OR) ? "$or" : "$and", parts);
    }

    if (el instanceof FilterCondition c) {
      FilterOperator op = OPERATORS.resolve(c.operator(), fallback);
      if (negate) op = invert(op);
      String path = c.field().name();
      return switch (op) {
        case EXISTS -> new Document(path, new Document("$exists", true));
        case NOT_EXISTS -> new Document(path, new Document("$exists", false));
        default -> new Document(path, new Document(OPERATORS.token(op), ctx.add(c.value())));
      };
    }

    if (el instanceof RangeFilter r) {
      return negate ? negatedRange(r, ctx) : range(r, ctx);
    }

    if (el instanceof GeoFilter) {
      throw new RenderException("geo filters are not supported by dialect " + PineconeDialect.ID);
    }

    throw new RenderException("Unsupported FilterItem: " + el.getClass().getName());
  }

  private static Document range(RangeFilter r, RenderContext ctx) {
    Document bounds = new Document();
    if (r.min() != null) bounds.append(r.minExclusive() ? "$gt" : "$gte", ctx.add(r.min()));
    if (r.max() != null) bounds.append(r.maxExclusive() ? "$lt" : "$lte", ctx.add(r.max()));
    return new Document(r.field().name(), bounds);
  }

  // not(min <= x <= max) == (x < min) or (x > max)
  private static Document negatedRange(RangeFilter r, RenderContext ctx) {
    String path = r.field().name();
    List<Document> parts = new ArrayList<>(2);
    if (r.min() != null) {
      parts.add(new Document(path, new Document(r.minExclusive() ? "$lte" : "$lt", ctx.add(r.min()))));
    }
    if (r.max() != null) {
      parts.add(new Document(path, new Document(r.maxExclusive() ? "$gte" : "$gt", ctx.add(r.max()))));
    }
    if (parts.size() == 1) return parts.get(0);
    return new Document("$or", parts);
  }

  private static FilterOperator invert(FilterOperator op) {
    return switch (op) {
      case EQ -> FilterOperator.NE;
      case NE -> FilterOperator.EQ;
      case GT -> FilterOperator.LE;
      case LE -> FilterOperator.GT;
      case GE -> FilterOperator.LT;
      case LT -> FilterOperator.GE;
      case IN -> FilterOperator.NOT_IN;
      case NOT_IN -> FilterOperator.IN;
      case EXISTS -> FilterOperator.NOT_EXISTS;
      case NOT_EXISTS -> FilterOperator.EXISTS;
      default -> throw new RenderException("operator " + op + " cannot be negated by dialect " + PineconeDialect.ID);
    };
  }
}
