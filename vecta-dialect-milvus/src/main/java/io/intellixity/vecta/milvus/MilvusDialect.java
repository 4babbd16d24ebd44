package io.intellixity.vecta.milvus;

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
 * Milvus dialect: renders RESTful v2 entity request bodies. Filters are boolean expression strings with
 * placeholders inline; the namespace selects partitions; {@code minScore} renders as the range-search
 * {@code radius}.
 * <p>
 * Options: {@value #VECTOR_FIELD} (default {@code embedding}), {@value #ID_FIELD} (default {@code id}),
 * {@value #SPARSE_FIELD} (default {@code sparse_vector}).
 */
public final class MilvusDialect implements VectorDialect {
  public static final String ID = "milvus";
  public static final String VECTOR_FIELD = "vectorField";
  public static final String ID_FIELD = "idField";
  public static final String SPARSE_FIELD = "sparseField";

  private static final Set<DistanceMetric> METRICS =
      EnumSet.of(DistanceMetric.COSINE, DistanceMetric.EUCLIDEAN, DistanceMetric.DOT_PRODUCT);

  private final DialectOptions options;
  private final QueryValidationStrategy validation;
  private final String vectorField;
  private final String idField;
  private final String sparseField;

  public MilvusDialect() {
    this(DialectOptions.DEFAULTS);
  }

  public MilvusDialect(DialectOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.validation = new DefaultQueryValidationStrategy(options.limits()).andThen(MilvusDialect::validateForMilvus);
    this.vectorField = options.property(VECTOR_FIELD, "embedding");
    this.idField = options.property(ID_FIELD, "id");
    this.sparseField = options.property(SPARSE_FIELD, "sparse_vector");
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
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("collection_name", q.target().name());
    doc.put("anns_field", q.queryEmbedding() != null ? q.queryEmbedding().name() : vectorField);
    VectorValue v = q.queryVector();
    doc.put("data", v.isParam() ? ctx.add(v.param()) : List.of(v.literal()));
    PaginationValue topK = q.topK();
    doc.put("limit", topK.isStatic() ? topK.staticValue() : ctx.add(topK.param()));
    if (q.minScore() != null) {
      doc.put("search_params", Map.of("params", Map.of("radius", ctx.add(q.minScore()))));
    }
    if (q.includeMetadata() && !q.metadataFields().isEmpty()) doc.put("output_fields", names(q.metadataFields()));
    if (q.filter() != null) doc.put("filter", MilvusFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    if (q.namespace() != null) doc.put("partition_names", List.of(ctx.add(q.namespace())));
    return doc;
  }

  private Map<String, Object> upsert(VectorQuery q, RenderContext ctx) {
    List<Map<String, Object>> rows = new ArrayList<>(q.vectors().size());
    for (VectorRecord r : q.vectors()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(idField, ctx.add(r.id()));
      row.put(vectorField, r.vector().isParam() ? ctx.add(r.vector().param()) : r.vector().literal());
      for (Map.Entry<MetadataField, Param> e : r.metadata().entrySet()) row.put(e.getKey().name(), ctx.add(e.getValue()));
      SparseVectorValue s = r.sparseVector();
      if (s != null) row.put(sparseField, s.isParam() ? ctx.add(s.param()) : sparse(s));
      rows.add(row);
    }
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("collection_name", q.target().name());
    doc.put("data", rows);
    if (q.namespace() != null) doc.put("partition_name", ctx.add(q.namespace()));
    return doc;
  }

  private Map<String, Object> delete(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("collection_name", q.target().name());
    List<String> exprs = new ArrayList<>(2);
    if (!q.ids().isEmpty()) exprs.add(idExpression(q.ids(), ctx));
    if (q.filter() != null) exprs.add(MilvusFilterRenderer.render(q.filter(), ctx, options.operatorFallback()));
    doc.put("filter", String.join(" and ", exprs));
    if (q.namespace() != null) doc.put("partition_name", ctx.add(q.namespace()));
    return doc;
  }

  private Map<String, Object> fetch(VectorQuery q, RenderContext ctx) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("collection_name", q.target().name());
    doc.put("filter", idExpression(q.ids(), ctx));
    List<String> output = new ArrayList<>();
    if (q.includeMetadata()) {
      if (q.metadataFields().isEmpty()) output.add("*");
      else output.addAll(names(q.metadataFields()));
    }
    if (q.includeVectors()) output.add(vectorField);
    if (!output.isEmpty()) doc.put("output_fields", output);
    if (q.namespace() != null) doc.put("partition_names", List.of(ctx.add(q.namespace())));
    return doc;
  }

  // Milvus has no partial update; each id becomes an upsert row carrying every updated field
  private Map<String, Object> update(VectorQuery q, RenderContext ctx) {
    List<Map<String, Object>> rows = new ArrayList<>(q.ids().size());
    for (Param id : q.ids()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(idField, ctx.add(id));
      for (Map.Entry<MetadataField, Param> e : q.updates().entrySet()) row.put(e.getKey().name(), ctx.add(e.getValue()));
      rows.add(row);
    }
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("collection_name", q.target().name());
    doc.put("data", rows);
    if (q.namespace() != null) doc.put("partition_name", ctx.add(q.namespace()));
    return doc;
  }

  private String idExpression(List<Param> ids, RenderContext ctx) {
    List<String> placeholders = new ArrayList<>(ids.size());
    for (Param p : ids) placeholders.add(ctx.add(p));
    return idField + " in [" + String.join(", ", placeholders) + "]";
  }

  /** Milvus sparse rows are index-to-value maps. */
  private static Map<String, Float> sparse(SparseVectorValue s) {
    Map<String, Float> out = new LinkedHashMap<>();
    for (int i = 0; i < s.indices().size(); i++) out.put(String.valueOf(s.indices().get(i)), s.values().get(i));
    return out;
  }

  private static List<String> names(List<MetadataField> fields) {
    List<String> out = new ArrayList<>(fields.size());
    for (MetadataField f : fields) out.add(f.name());
    return out;
  }

  private static void validateForMilvus(VectorQuery q) {
    if (q.filter() != null && containsGeo(q.filter())) {
      throw new QueryValidationException("milvus does not support geo filters");
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
    return MilvusFilterRenderer.OPERATORS.supports(operator);
  }

  @Override
  public boolean supportsMetric(DistanceMetric metric) {
    return METRICS.contains(metric);
  }
}
