package io.intellixity.vecta.pinecone;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.VectorDialect;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderResult;
import io.intellixity.vecta.spi.render.ResultPackager;
import io.intellixity.vecta.validation.DefaultQueryValidationStrategy;
import io.intellixity.vecta.validation.QueryValidationStrategy;
import org.bson.Document;

import java.util.*;

/**
 * Pinecone dialect: renders the data-plane request bodies ({@code /query}, {@code /vectors/upsert},
 * {@code /vectors/delete}, {@code /vectors/fetch}, {@code /vectors/update}).
 */
public final class PineconeDialect implements VectorDialect {
  public static final String ID = "pinecone";

  private static final Set<DistanceMetric> METRICS =
      EnumSet.of(DistanceMetric.COSINE, DistanceMetric.EUCLIDEAN, DistanceMetric.DOT_PRODUCT);

  private final DialectOptions options;
  private final QueryValidationStrategy validation;

  public PineconeDialect() {
    this(DialectOptions.DEFAULTS);
  }

  public PineconeDialect(DialectOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.validation = new DefaultQueryValidationStrategy(options.limits()).andThen(PineconeDialect::validateForPinecone);
  }

  @Override public String id() { return ID; }

  @Override
  public RenderResult render(VectorQuery q) {
    validation.validate(q);
    RenderContext ctx = new RenderContext();
    Document doc = switch (q.operation()) {
      case SEARCH -> search(q, ctx);
      case UPSERT -> upsert(q, ctx);
      case DELETE -> delete(q, ctx);
      case FETCH -> fetch(q, ctx);
      case UPDATE -> update(q, ctx);
    };
    return ResultPackager.pack(ID, q.operation(), doc, ctx);
  }

  private Document search(VectorQuery q, RenderContext ctx) {
    Document doc = new Document();
    PaginationValue topK = q.topK();
    doc.append("topK", topK.isStatic() ? topK.staticValue() : ctx.add(topK.param()));
    doc.append("includeValues", q.includeVectors());
    doc.append("includeMetadata", q.includeMetadata());
    doc.append("vector", vector(q.queryVector(), ctx));
    if (q.filter() != null) doc.append("filter", PineconeFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    namespace(q, doc, ctx);
    return doc;
  }

  private Document upsert(VectorQuery q, RenderContext ctx) {
    List<Document> vectors = new ArrayList<>(q.vectors().size());
    for (VectorRecord r : q.vectors()) {
      Document v = new Document("id", ctx.add(r.id()));
      v.append("values", vector(r.vector(), ctx));
      if (!r.metadata().isEmpty()) v.append("metadata", metadata(r.metadata(), ctx));
      SparseVectorValue s = r.sparseVector();
      if (s != null) {
        v.append("sparseValues", s.isParam()
            ? ctx.add(s.param())
            : new Document("indices", s.indices()).append("values", s.values()));
      }
      vectors.add(v);
    }
    Document doc = new Document("vectors", vectors);
    namespace(q, doc, ctx);
    return doc;
  }

  private Document delete(VectorQuery q, RenderContext ctx) {
    Document doc = new Document();
    if (!q.ids().isEmpty()) doc.append("ids", ids(q.ids(), ctx));
    if (q.filter() != null) {
      doc.append("filter", PineconeFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
      // deleteAll=true would ignore the filter and wipe the namespace
      doc.append("deleteAll", false);
    }
    namespace(q, doc, ctx);
    return doc;
  }

  private Document fetch(VectorQuery q, RenderContext ctx) {
    Document doc = new Document("ids", ids(q.ids(), ctx));
    namespace(q, doc, ctx);
    return doc;
  }

  private Document update(VectorQuery q, RenderContext ctx) {
    Document doc = new Document("id", ctx.add(q.ids().get(0)));
    doc.append("setMetadata", metadata(q.updates(), ctx));
    namespace(q, doc, ctx);
    return doc;
  }

  private static Object vector(VectorValue v, RenderContext ctx) {
    return v.isParam() ? ctx.add(v.param()) : v.literal();
  }

  private static List<String> ids(List<Param> ids, RenderContext ctx) {
    List<String> out = new ArrayList<>(ids.size());
    for (Param p : ids) out.add(ctx.add(p));
    return out;
  }

  private static Document metadata(Map<MetadataField, Param> fields, RenderContext ctx) {
    Document out = new Document();
    for (Map.Entry<MetadataField, Param> e : fields.entrySet()) out.append(e.getKey().name(), ctx.add(e.getValue()));
    return out;
  }

  private static void namespace(VectorQuery q, Document doc, RenderContext ctx) {
    if (q.namespace() != null) doc.append("namespace", ctx.add(q.namespace()));
  }

  private static void validateForPinecone(VectorQuery q) {
    if (q.operation() == Operation.DELETE && !q.ids().isEmpty() && q.filter() != null) {
      throw new QueryValidationException("pinecone DELETE takes either ids or a filter, not both");
    }
    if (q.operation() == Operation.UPDATE && q.ids().size() != 1) {
      throw new QueryValidationException("pinecone UPDATE requires exactly one id: " + q.ids().size());
    }
    if (q.minScore() != null) {
      throw new QueryValidationException("pinecone does not support minScore");
    }
    if (q.filter() != null && containsGeo(q.filter())) {
      throw new QueryValidationException("pinecone does not support geo filters");
    }
  }

  private static boolean containsGeo(FilterItem f) {
    if (f instanceof GeoFilter) return true;
    if (f instanceof FilterGroup g) {
      for (FilterItem c : g.children()) {
        if (containsGeo(c)) return true;
      }
    }
    return false;
  }

  @Override
  public boolean supportsOperation(Operation operation) {
    return operation != null;
  }

  @Override
  public boolean supportsFilterOperator(FilterOperator operator) {
    return PineconeFilterRenderer.OPERATORS.supports(operator);
  }

  @Override
  public boolean supportsMetric(DistanceMetric metric) {
    return METRICS.contains(metric);
  }
}
