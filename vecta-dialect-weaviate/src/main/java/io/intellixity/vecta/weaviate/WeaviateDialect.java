package io.intellixity.vecta.weaviate;

import io.intellixity.vecta.query.*;
import io.intellixity.vecta.spi.dialect.DialectOptions;
import io.intellixity.vecta.spi.dialect.VectorDialect;
import io.intellixity.vecta.spi.render.RenderContext;
import io.intellixity.vecta.spi.render.RenderResult;
import io.intellixity.vecta.spi.render.ResultPackager;
import io.intellixity.vecta.validation.DefaultQueryValidationStrategy;
import io.intellixity.vecta.validation.QueryValidationStrategy;

import java.util.*;

/**
 * Weaviate dialect. Collections map to classes (first letter upper-cased); the namespace maps to the
 * tenant; {@code minScore} maps to {@code nearVector.certainty}.
 */
public final class WeaviateDialect implements VectorDialect {
  public static final String ID = "weaviate";

  private final DialectOptions options;
  private final QueryValidationStrategy validation;

  public WeaviateDialect() {
    this(DialectOptions.DEFAULTS);
  }

  public WeaviateDialect(DialectOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.validation = new DefaultQueryValidationStrategy(options.limits()).andThen(WeaviateDialect::validateForWeaviate);
  }

  @Override public String id() { return ID; }

  @Override
  public RenderResult render(VectorQuery q) {
    validation.validate(q);
    RenderContext ctx = new RenderContext();
    Map<String, Object> doc = switch (q.operation()) {
      case SEARCH -> search(q, ctx);
      case UPSERT -> upsert(q, ctx);
      case DELETE -> delete(q, ctx);
      case FETCH -> fetch(q, ctx);
      case UPDATE -> update(q, ctx);
    };
    return ResultPackager.pack(ID, q.operation(), doc, ctx);
  }

  static String className(String collection) {
    if (collection.isEmpty()) return collection;
    return Character.toUpperCase(collection.charAt(0)) + collection.substring(1);
  }

  private Map<String, Object> search(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("class", className(q.target().name()));

    Map<String, Object> near = new LinkedHashMap<>();
    near.put("vector", vector(q.queryVector(), ctx));
    if (q.minScore() != null) near.put("certainty", ctx.add(q.minScore()));
    if (q.queryEmbedding() != null) near.put("targetVectors", List.of(q.queryEmbedding().name()));
    doc.put("nearVector", near);

    PaginationValue topK = q.topK();
    doc.put("limit", topK.isStatic() ? topK.staticValue() : ctx.add(topK.param()));
    properties(q, doc);
    if (q.filter() != null) doc.put("where", WeaviateFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    tenant(q, doc, ctx);
    doc.put("additional", q.includeVectors()
        ? List.of("vector", "distance", "certainty")
        : List.of("distance", "certainty"));
    return doc;
  }

  private Map<String, Object> upsert(VectorQuery q, RenderContext ctx) {
    String cls = className(q.target().name());
    List<Map<String, Object>> objects = new ArrayList<>(q.vectors().size());
    for (VectorRecord r : q.vectors()) {
      Map<String, Object> obj = new LinkedHashMap<>();
      obj.put("class", cls);
      obj.put("id", ctx.add(r.id()));
      obj.put("vector", vector(r.vector(), ctx));
      if (!r.metadata().isEmpty()) obj.put("properties", values(r.metadata(), ctx));
      objects.add(obj);
    }
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("objects", objects);
    tenant(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> delete(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("class", className(q.target().name()));
    if (!q.ids().isEmpty()) doc.put("ids", ids(q.ids(), ctx));
    if (q.filter() != null) doc.put("where", WeaviateFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    tenant(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> fetch(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("class", className(q.target().name()));
    doc.put("ids", ids(q.ids(), ctx));
    properties(q, doc);
    if (q.includeVectors()) doc.put("additional", List.of("vector"));
    tenant(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> update(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("class", className(q.target().name()));
    doc.put("id", ctx.add(q.ids().get(0)));
    doc.put("properties", values(q.updates(), ctx));
    tenant(q, doc, ctx);
    return doc;
  }

  private static void properties(VectorQuery q, Map<String, Object> doc) {
    if (!q.includeMetadata() || q.metadataFields().isEmpty()) return;
    List<String> names = new ArrayList<>(q.metadataFields().size());
    for (MetadataField f : q.metadataFields()) names.add(f.name());
    doc.put("properties", names);
  }

  private static Object vector(VectorValue v, RenderContext ctx) {
    return v.isParam() ? ctx.add(v.param()) : v.literal();
  }

  private static List<String> ids(List<Param> ids, RenderContext ctx) {
    List<String> out = new ArrayList<>(ids.size());
    for (Param p : ids) out.add(ctx.add(p));
    return out;
  }

  private static Map<String, Object> values(Map<MetadataField, Param> fields, RenderContext ctx) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<MetadataField, Param> e : fields.entrySet()) out.put(e.getKey().name(), ctx.add(e.getValue()));
    return out;
  }

  private static void tenant(VectorQuery q, Map<String, Object> doc, RenderContext ctx) {
    if (q.namespace() != null) doc.put("tenant", ctx.add(q.namespace()));
  }

  private static void validateForWeaviate(VectorQuery q) {
    if (q.operation() == Operation.DELETE && !q.ids().isEmpty() && q.filter() != null) {
      throw new QueryValidationException("weaviate DELETE takes either ids or a filter, not both");
    }
    if (q.operation() == Operation.UPDATE && q.ids().size() != 1) {
      throw new QueryValidationException("weaviate UPDATE requires exactly one id: " + q.ids().size());
    }
    for (VectorRecord r : q.vectors()) {
      if (r.sparseVector() != null) throw new QueryValidationException("weaviate does not support sparse vectors");
    }
  }

  @Override
  public boolean supportsOperation(Operation operation) {
    return operation != null;
  }

  @Override
  public boolean supportsFilterOperator(FilterOperator operator) {
    return WeaviateFilterRenderer.OPERATORS.supports(operator);
  }

  @Override
  public boolean supportsMetric(DistanceMetric metric) {
    return metric != null;
  }
}
