package io.intellixity.vecta.schema;

import io.intellixity.vecta.query.*;

import java.util.*;

/**
 * Schema-checked reference factory.
 * <p>
 * {@link #collection}, {@link #embedding}, {@link #metadata} and {@link #param} return IR handles only for
 * names the schema declares (or, for params, names that pass {@link Identifiers#isValid}); anything else
 * raises {@link QueryValidationException}.
 */
public final class VectorSchema {
  private final Map<String, CollectionSchema> collections;

  public VectorSchema(Collection<CollectionSchema> collections) {
    Objects.requireNonNull(collections, "collections");
    Map<String, CollectionSchema> m = new LinkedHashMap<>();
    for (CollectionSchema c : collections) m.put(c.name(), c);
    this.collections = Collections.unmodifiableMap(m);
  }

  public static VectorSchema of(CollectionSchema... collections) {
    return new VectorSchema(Arrays.asList(collections));
  }

  public CollectionRef collection(String name) {
    schemaOf(name);
    return CollectionRef.of(name);
  }

  public EmbeddingField embedding(String collection, String name) {
    embeddingDef(collection, name);
    return EmbeddingField.of(collection, name);
  }

  public MetadataField metadata(String collection, String name) {
    CollectionSchema c = schemaOf(collection);
    if (!c.metadata().containsKey(name)) {
      throw new QueryValidationException("metadata field '" + name + "' not found in collection '" + collection + "'");
    }
    return MetadataField.of(collection, name);
  }

  public Param param(String name) {
    if (!Identifiers.isValid(name)) throw new QueryValidationException("invalid parameter name: " + name);
    return Param.of(name);
  }

  public int dimensions(String collection, String embedding) {
    return embeddingDef(collection, embedding).dimensions();
  }

  public DistanceMetric metric(String collection, String embedding) {
    return embeddingDef(collection, embedding).metric();
  }

  public List<String> collections() { return List.copyOf(collections.keySet()); }

  public List<String> embeddings(String collection) { return List.copyOf(schemaOf(collection).embeddings().keySet()); }

  public List<String> metadataFields(String collection) { return List.copyOf(schemaOf(collection).metadata().keySet()); }

  private EmbeddingDef embeddingDef(String collection, String name) {
    EmbeddingDef e = schemaOf(collection).embeddings().get(name);
    if (e == null) {
      throw new QueryValidationException("embedding '" + name + "' not found in collection '" + collection + "'");
    }
    return e;
  }

  private CollectionSchema schemaOf(String name) {
    CollectionSchema c = collections.get(name);
    if (c == null) throw new QueryValidationException("collection '" + name + "' not found in schema");
    return c;
  }
}
