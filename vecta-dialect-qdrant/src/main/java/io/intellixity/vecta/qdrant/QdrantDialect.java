package io.intellixity.vecta.qdrant;

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
 * Qdrant dialect: renders bodies for the points API (query, upsert, delete, retrieve, set payload).
 * <p>
 * Options:
 * <ul>
 *   <li>{@value #DEFAULT_VECTOR_NAME}: named vector used when a query has no embedding field</li>
 *   <li>{@value #SPARSE_VECTOR_NAME}: name under which sparse vectors are upserted (default {@code sparse})</li>
 * </ul>
 * A namespace renders as {@code shard_key}.
 */
public final class QdrantDialect implements VectorDialect {
  public static final String ID = "qdrant";
  public static final String DEFAULT_VECTOR_NAME = "defaultVectorName";
  public static final String SPARSE_VECTOR_NAME = "sparseVectorName";

  private final DialectOptions options;
  private final QueryValidationStrategy validation;
  private final String defaultVectorName;
  private final String sparseVectorName;

  public QdrantDialect() {
    this(DialectOptions.DEFAULTS);
  }

  public QdrantDialect(DialectOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.validation = new DefaultQueryValidationStrategy(options.limits()).andThen(QdrantDialect::validateForQdrant);
    this.defaultVectorName = options.property(DEFAULT_VECTOR_NAME, "");
    this.sparseVectorName = options.property(SPARSE_VECTOR_NAME, "sparse");
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

  private Map<String, Object> search(VectorQuery q, RenderContext ctx) {
    Map<String, Object> query = new LinkedHashMap<>();
    query.put("vector", vector(q.queryVector(), ctx));
    String name = q.queryEmbedding() != null ? q.queryEmbedding().name() : defaultVectorName;
    if (!name.isEmpty()) query.put("name", name);

    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("query", query);
    PaginationValue topK = q.topK();
    doc.put("limit", topK.isStatic() ? topK.staticValue() : ctx.add(topK.param()));
    if (q.minScore() != null) doc.put("score_threshold", ctx.add(q.minScore()));
    doc.put("with_payload", payloadSelector(q));
    doc.put("with_vector", q.includeVectors());
    if (q.filter() != null) doc.put("filter", QdrantFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    shardKey(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> upsert(VectorQuery q, RenderContext ctx) {
    List<Map<String, Object>> points = new ArrayList<>(q.vectors().size());
    for (VectorRecord r : q.vectors()) {
      Map<String, Object> point = new LinkedHashMap<>();
      point.put("id", ctx.add(r.id()));
      Object dense = vector(r.vector(), ctx);
      SparseVectorValue s = r.sparseVector();
      if (s == null) {
        point.put("vector", dense);
      } else {
        Map<String, Object> named = new LinkedHashMap<>();
        named.put(defaultVectorName, dense);
        named.put(sparseVectorName, sparse(s, ctx));
        point.put("vector", named);
      }
      if (!r.metadata().isEmpty()) point.put("payload", payload(r.metadata(), ctx));
      points.add(point);
    }
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("points", points);
    shardKey(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> delete(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    if (!q.ids().isEmpty()) doc.put("points", ids(q.ids(), ctx));
    if (q.filter() != null) doc.put("filter", QdrantFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    shardKey(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> fetch(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("ids", ids(q.ids(), ctx));
    doc.put("with_payload", payloadSelector(q));
    doc.put("with_vector", q.includeVectors());
    shardKey(q, doc, ctx);
    return doc;
  }

  private Map<String, Object> update(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("points", ids(q.ids(), ctx));
    doc.put("payload", payload(q.updates(), ctx));
    shardKey(q, doc, ctx);
    return doc;
  }

  /** {@code true}/{@code false}, or the selected field names when metadata is requested with a selection. */
  private static Object payloadSelector(VectorQuery q) {
    if (!q.includeMetadata() || q.metadataFields().isEmpty()) return q.includeMetadata();
    List<String> names = new ArrayList<>(q.metadataFields().size());
    for (MetadataField f : q.metadataFields()) names.add(f.name());
    return names;
  }

  private static Object vector(VectorValue v, RenderContext ctx) {
    return v.isParam() ? ctx.add(v.param()) : v.literal();
  }

  private static Object sparse(SparseVectorValue s, RenderContext ctx) {
    if (s.isParam()) return ctx.add(s.param());
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("indices", s.indices());
    m.put("values", s.values());
    return m;
  }

  private static List<String> ids(List<Param> ids, RenderContext ctx) {
    List<String> out = new ArrayList<>(ids.size());
    for (Param p : ids) out.add(ctx.add(p));
    return out;
  }

  private static Map<String, Object> payload(Map<MetadataField, Param> fields, RenderContext ctx) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<MetadataField, Param> e : fields.entrySet()) out.put(e.getKey().name(), ctx.add(e.getValue()));
    return out;
  }

  private static void shardKey(VectorQuery q, Map<String, Object> doc, RenderContext ctx) {
    if (q.namespace() != null) doc.put("shard_key", ctx.add(q.namespace()));
  }

  // the points selector holds either an id list or a filter
  private static void validateForQdrant(VectorQuery q) {
    if (q.operation() == Operation.DELETE && !q.ids().isEmpty() && q.filter() != null) {
      throw new QueryValidationException("qdrant DELETE takes either ids or a filter, not both");
    }
  }

  @Override
  public boolean supportsOperation(Operation operation) {
    return operation != null;
  }

  @Override
  public boolean supportsFilterOperator(FilterOperator operator) {
    return QdrantFilterRenderer.OPERATORS.supports(operator);
  }

  @Override
  public boolean supportsMetric(DistanceMetric metric) {
    return metric != null;
  }
}
