package io.intellixity.vecta.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One point/object for UPSERT. Metadata keeps insertion order. */
public record VectorRecord(Param id, VectorValue vector, Map<MetadataField, Param> metadata,
                           SparseVectorValue sparseVector) {
  public VectorRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(vector, "vector");
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
  }

  public static Builder builder(Param id, VectorValue vector) { return new Builder(id, vector); }

  public static final class Builder {
    private final Param id;
    private final VectorValue vector;
    private final Map<MetadataField, Param> metadata = new LinkedHashMap<>();
    private SparseVectorValue sparseVector;

    private Builder(Param id, VectorValue vector) {
      this.id = id;
      this.vector = vector;
    }

    public Builder metadata(MetadataField field, Param value) {
      metadata.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder sparseVector(SparseVectorValue sparseVector) { this.sparseVector = sparseVector; return this; }

    public VectorRecord build() { return new VectorRecord(id, vector, metadata, sparseVector); }
  }
}
