package io.intellixity.vecta.schema;

import java.util.*;

/** Declared embeddings and metadata fields of one collection, keyed by name in declaration order. */
public record CollectionSchema(String name, Map<String, EmbeddingDef> embeddings, Map<String, MetadataDef> metadata) {
  public CollectionSchema {
    Objects.requireNonNull(name, "name");
    embeddings = Collections.unmodifiableMap(new LinkedHashMap<>(embeddings == null ? Map.of() : embeddings));
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
  }

  public static Builder builder(String name) { return new Builder(name); }

  public static final class Builder {
    private final String name;
    private final Map<String, EmbeddingDef> embeddings = new LinkedHashMap<>();
    private final Map<String, MetadataDef> metadata = new LinkedHashMap<>();

    private Builder(String name) { this.name = name; }

    public Builder embedding(EmbeddingDef e) { embeddings.put(e.name(), e); return this; }
    public Builder metadata(MetadataDef m) { metadata.put(m.name(), m); return this; }
    public Builder metadata(String name, MetadataType type) { return metadata(new MetadataDef(name, type)); }

    public CollectionSchema build() { return new CollectionSchema(name, embeddings, metadata); }
  }
}
