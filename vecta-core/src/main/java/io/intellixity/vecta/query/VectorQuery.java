package io.intellixity.vecta.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.vecta.validation.DefaultQueryValidationStrategy;

import java.util.*;

/**
 * Root of the vector query IR.
 * <p>
 * Instances are immutable: collections are ordered, unmodifiable copies so that every dialect sees the
 * same walk order. Build with {@link #search(String)}, {@link #upsert(String)}, {@link #delete(String)},
 * {@link #fetch(String)} or {@link #update(String)}.
 */
@JsonSerialize(using = VectorQueryJsonSerializer.class)
@JsonDeserialize(using = VectorQueryJsonDeserializer.class)
public final class VectorQuery {
  private final Operation operation;
  private final CollectionRef target;
  private final VectorValue queryVector;
  private final EmbeddingField queryEmbedding;
  private final PaginationValue topK;
  private final Param minScore;
  private final boolean includeVectors;
  private final boolean includeMetadata;
  private final FilterItem filter;
  private final List<MetadataField> metadataFields;
  private final List<VectorRecord> vectors;
  private final Map<MetadataField, Param> updates;
  private final List<Param> ids;
  private final boolean deleteAll;
  private final Param namespace;

  private VectorQuery(Builder b) {
    this.operation = b.operation;
    this.target = b.target;
    this.queryVector = b.queryVector;
    this.queryEmbedding = b.queryEmbedding;
    this.topK = b.topK;
    this.minScore = b.minScore;
    this.includeVectors = b.includeVectors;
    this.includeMetadata = b.includeMetadata;
    this.filter = b.filter;
    this.metadataFields = List.copyOf(b.metadataFields);
    this.vectors = List.copyOf(b.vectors);
    this.updates = Collections.unmodifiableMap(new LinkedHashMap<>(b.updates));
    this.ids = List.copyOf(b.ids);
    this.deleteAll = b.deleteAll;
    this.namespace = b.namespace;
  }

  public Operation operation() { return operation; }
  public CollectionRef target() { return target; }
  public VectorValue queryVector() { return queryVector; }
  public EmbeddingField queryEmbedding() { return queryEmbedding; }
  public PaginationValue topK() { return topK; }
  public Param minScore() { return minScore; }
  public boolean includeVectors() { return includeVectors; }
  public boolean includeMetadata() { return includeMetadata; }
  public FilterItem filter() { return filter; }
  public List<MetadataField> metadataFields() { return metadataFields; }
  public List<VectorRecord> vectors() { return vectors; }
  public Map<MetadataField, Param> updates() { return updates; }
  public List<Param> ids() { return ids; }
  public boolean deleteAll() { return deleteAll; }
  public Param namespace() { return namespace; }

  public static Builder search(String collection) { return new Builder(Operation.SEARCH, CollectionRef.of(collection)); }
  public static Builder upsert(String collection) { return new Builder(Operation.UPSERT, CollectionRef.of(collection)); }
  public static Builder delete(String collection) { return new Builder(Operation.DELETE, CollectionRef.of(collection)); }
  public static Builder fetch(String collection) { return new Builder(Operation.FETCH, CollectionRef.of(collection)); }
  public static Builder update(String collection) { return new Builder(Operation.UPDATE, CollectionRef.of(collection)); }

  public static Builder builder(Operation operation, CollectionRef target) { return new Builder(operation, target); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VectorQuery q)) return false;
    return includeVectors == q.includeVectors && includeMetadata == q.includeMetadata && deleteAll == q.deleteAll
        && operation == q.operation && Objects.equals(target, q.target)
        && Objects.equals(queryVector, q.queryVector) && Objects.equals(queryEmbedding, q.queryEmbedding)
        && Objects.equals(topK, q.topK) && Objects.equals(minScore, q.minScore)
        && Objects.equals(filter, q.filter) && metadataFields.equals(q.metadataFields)
        && vectors.equals(q.vectors) && updates.equals(q.updates) && ids.equals(q.ids)
        && Objects.equals(namespace, q.namespace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operation, target, queryVector, queryEmbedding, topK, minScore, includeVectors,
        includeMetadata, filter, metadataFields, vectors, updates, ids, deleteAll, namespace);
  }

  @Override
  public String toString() {
    return "VectorQuery{" + operation + " " + (target == null ? null : target.name()) + "}";
  }

  /**
   * Incremental builder. Setters that do not apply to the builder's operation fail immediately with
   * {@link QueryValidationException}.
   */
  public static final class Builder {
    private final Operation operation;
    private final CollectionRef target;
    private VectorValue queryVector;
    private EmbeddingField queryEmbedding;
    private PaginationValue topK;
    private Param minScore;
    private boolean includeVectors;
    private boolean includeMetadata;
    private FilterItem filter;
    private final List<MetadataField> metadataFields = new ArrayList<>();
    private final List<VectorRecord> vectors = new ArrayList<>();
    private final Map<MetadataField, Param> updates = new LinkedHashMap<>();
    private final List<Param> ids = new ArrayList<>();
    private boolean deleteAll;
    private Param namespace;

    private Builder(Operation operation, CollectionRef target) {
      this.operation = Objects.requireNonNull(operation, "operation");
      this.target = Objects.requireNonNull(target, "target");
      this.includeMetadata = operation == Operation.SEARCH || operation == Operation.FETCH;
      this.includeVectors = operation == Operation.FETCH;
    }

    public Builder queryVector(VectorValue v) { require("queryVector", Operation.SEARCH); this.queryVector = v; return this; }
    public Builder queryVector(Param p) { return queryVector(VectorValue.of(p)); }
    public Builder queryEmbedding(EmbeddingField f) { require("queryEmbedding", Operation.SEARCH); this.queryEmbedding = f; return this; }
    public Builder topK(int k) { require("topK", Operation.SEARCH); this.topK = PaginationValue.of(k); return this; }
    public Builder topK(Param p) { require("topK", Operation.SEARCH); this.topK = PaginationValue.of(p); return this; }
    public Builder minScore(Param p) { require("minScore", Operation.SEARCH); this.minScore = p; return this; }

    public Builder includeVectors(boolean v) {
      require("includeVectors", Operation.SEARCH, Operation.FETCH);
      this.includeVectors = v;
      return this;
    }

    public Builder includeMetadata(boolean v) {
      require("includeMetadata", Operation.SEARCH, Operation.FETCH);
      this.includeMetadata = v;
      return this;
    }

    /** Sets the filter; a second call ANDs it with the existing one. */
    public Builder filter(FilterItem f) {
      require("filter", Operation.SEARCH, Operation.DELETE);
      Objects.requireNonNull(f, "filter");
      this.filter = (this.filter == null) ? f : VectorFilters.and(this.filter, f);
      return this;
    }

    public Builder metadataFields(MetadataField... fields) {
      require("metadataFields", Operation.SEARCH, Operation.FETCH);
      this.metadataFields.addAll(Arrays.asList(fields));
      return this;
    }

    public Builder metadataFields(String... names) {
      require("metadataFields", Operation.SEARCH, Operation.FETCH);
      for (String n : names) this.metadataFields.add(MetadataField.of(n));
      return this;
    }

    public Builder vector(VectorRecord r) {
      require("vectors", Operation.UPSERT);
      this.vectors.add(Objects.requireNonNull(r, "record"));
      return this;
    }

    public Builder vectors(List<VectorRecord> records) {
      require("vectors", Operation.UPSERT);
      for (VectorRecord r : records) this.vectors.add(Objects.requireNonNull(r, "record"));
      return this;
    }

    public Builder set(MetadataField field, Param value) {
      require("updates", Operation.UPDATE);
      this.updates.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder set(String field, String param) { return set(MetadataField.of(field), Param.of(param)); }

    public Builder ids(Param... ids) {
      require("ids", Operation.DELETE, Operation.FETCH, Operation.UPDATE);
      for (Param p : ids) this.ids.add(Objects.requireNonNull(p, "id"));
      return this;
    }

    public Builder ids(String... params) {
      require("ids", Operation.DELETE, Operation.FETCH, Operation.UPDATE);
      for (String p : params) this.ids.add(Param.of(p));
      return this;
    }

    public Builder deleteAll(boolean v) { require("deleteAll", Operation.DELETE); this.deleteAll = v; return this; }

    public Builder namespace(Param p) { this.namespace = p; return this; }

    /** Builds and validates with the default limits. */
    public VectorQuery build() {
      VectorQuery q = new VectorQuery(this);
      DefaultQueryValidationStrategy.DEFAULT.validate(q);
      return q;
    }

    /** Builds without validation; dialects still validate before rendering. */
    public VectorQuery buildWithoutValidation() {
      return new VectorQuery(this);
    }

    private void require(String setter, Operation... allowed) {
      for (Operation op : allowed) {
        if (op == operation) return;
      }
      throw new QueryValidationException(setter + " is not applicable to " + operation);
    }
  }
}
