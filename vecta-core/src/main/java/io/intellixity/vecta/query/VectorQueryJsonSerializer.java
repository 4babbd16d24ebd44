package io.intellixity.vecta.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Canonical JSON serializer for {@link VectorQuery}. */
public final class VectorQueryJsonSerializer extends JsonSerializer<VectorQuery> {
  @Override
  public void serialize(VectorQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("operation", q.operation().name());
    g.writeStringField("target", q.target().name());

    if (q.queryVector() != null) {
      g.writeFieldName("queryVector");
      writeVector(q.queryVector(), g);
    }
    if (q.queryEmbedding() != null) {
      g.writeFieldName("queryEmbedding");
      writeNamed(q.queryEmbedding().name(), q.queryEmbedding().collection(), g);
    }
    if (q.topK() != null) {
      g.writeFieldName("topK");
      if (q.topK().isStatic()) g.writeNumber(q.topK().staticValue());
      else writeParam(q.topK().param(), g);
    }
    if (q.minScore() != null) {
      g.writeFieldName("minScore");
      writeParam(q.minScore(), g);
    }
    if (q.operation() == Operation.SEARCH || q.operation() == Operation.FETCH) {
      g.writeBooleanField("includeVectors", q.includeVectors());
      g.writeBooleanField("includeMetadata", q.includeMetadata());
    }
    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeFilter(q.filter(), g);
    }
    if (!q.metadataFields().isEmpty()) {
      g.writeArrayFieldStart("metadataFields");
      for (MetadataField f : q.metadataFields()) writeField(f, g);
      g.writeEndArray();
    }
    if (!q.vectors().isEmpty()) {
      g.writeArrayFieldStart("vectors");
      for (VectorRecord r : q.vectors()) writeRecord(r, g);
      g.writeEndArray();
    }
    if (!q.updates().isEmpty()) {
      g.writeArrayFieldStart("updates");
      writeEntries(q.updates(), g);
      g.writeEndArray();
    }
    if (!q.ids().isEmpty()) {
      g.writeArrayFieldStart("ids");
      for (Param p : q.ids()) writeParam(p, g);
      g.writeEndArray();
    }
    if (q.deleteAll()) g.writeBooleanField("deleteAll", true);
    if (q.namespace() != null) {
      g.writeFieldName("namespace");
      writeParam(q.namespace(), g);
    }
    g.writeEndObject();
  }

  private static void writeRecord(VectorRecord r, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeFieldName("id");
    writeParam(r.id(), g);
    g.writeFieldName("vector");
    writeVector(r.vector(), g);
    if (!r.metadata().isEmpty()) {
      g.writeArrayFieldStart("metadata");
      writeEntries(r.metadata(), g);
      g.writeEndArray();
    }
    SparseVectorValue s = r.sparseVector();
    if (s != null) {
      g.writeFieldName("sparseVector");
      if (s.isParam()) {
        writeParam(s.param(), g);
      } else {
        g.writeStartObject();
        g.writeArrayFieldStart("indices");
        for (Integer i : s.indices()) g.writeNumber(i);
        g.writeEndArray();
        g.writeArrayFieldStart("values");
        for (Float f : s.values()) g.writeNumber(f);
        g.writeEndArray();
        g.writeEndObject();
      }
    }
    g.writeEndObject();
  }

  private static void writeEntries(Map<MetadataField, Param> entries, JsonGenerator g) throws IOException {
    for (Map.Entry<MetadataField, Param> e : entries.entrySet()) {
      g.writeStartObject();
      g.writeFieldName("field");
      writeField(e.getKey(), g);
      g.writeFieldName("value");
      writeParam(e.getValue(), g);
      g.writeEndObject();
    }
  }

  private static void writeFilter(FilterItem el, JsonGenerator g) throws IOException {
    if (el instanceof FilterGroup fg) {
      g.writeStartObject();
      if (fg.logic() == Logic.NOT && fg.children().size() == 1) {
        g.writeFieldName("not");
        writeFilter(fg.children().get(0), g);
      } else {
        g.writeArrayFieldStart(fg.logic().name().toLowerCase());
        for (FilterItem child : fg.children()) writeFilter(child, g);
        g.writeEndArray();
      }
      g.writeEndObject();
      return;
    }

    if (el instanceof FilterCondition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().name().toLowerCase());
      g.writeFieldName("field");
      writeField(c.field(), g);
      if (c.value() != null) {
        g.writeFieldName("value");
        writeParam(c.value(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (el instanceof RangeFilter r) {
      g.writeStartObject();
      g.writeObjectFieldStart("range");
      g.writeFieldName("field");
      writeField(r.field(), g);
      if (r.min() != null) {
        g.writeFieldName("min");
        writeParam(r.min(), g);
        if (r.minExclusive()) g.writeBooleanField("minExclusive", true);
      }
      if (r.max() != null) {
        g.writeFieldName("max");
        writeParam(r.max(), g);
        if (r.maxExclusive()) g.writeBooleanField("maxExclusive", true);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (el instanceof GeoFilter geo) {
      g.writeStartObject();
      g.writeObjectFieldStart("geo");
      g.writeFieldName("field");
      writeField(geo.field(), g);
      g.writeFieldName("lat");
      writeParam(geo.center().lat(), g);
      g.writeFieldName("lon");
      writeParam(geo.center().lon(), g);
      g.writeFieldName("radius");
      writeParam(geo.radius(), g);
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported filter item: " + el.getClass().getName());
  }

  private static void writeVector(VectorValue v, JsonGenerator g) throws IOException {
    if (v.isParam()) {
      writeParam(v.param(), g);
      return;
    }
    g.writeStartArray();
    for (Float f : v.literal()) g.writeNumber(f);
    g.writeEndArray();
  }

  private static void writeField(MetadataField f, JsonGenerator g) throws IOException {
    writeNamed(f.name(), f.collection(), g);
  }

  /** Unqualified names are plain strings; qualified ones carry their collection. */
  private static void writeNamed(String name, String collection, JsonGenerator g) throws IOException {
    if (collection == null) {
      g.writeString(name);
      return;
    }
    g.writeStartObject();
    g.writeStringField("name", name);
    g.writeStringField("collection", collection);
    g.writeEndObject();
  }

  private static void writeParam(Param p, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("param", p.name());
    g.writeEndObject();
  }
}
