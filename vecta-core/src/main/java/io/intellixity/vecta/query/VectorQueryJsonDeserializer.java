package io.intellixity.vecta.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link VectorQuery}.
 * <p>
 * The result is not validated; pass it through a validation strategy or a dialect before use.
 */
public final class VectorQueryJsonDeserializer extends JsonDeserializer<VectorQuery> {
  @Override
  public VectorQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("VectorQuery JSON must be an object");

    String op = textOrNull(root.get("operation"));
    if (op == null) throw new IllegalArgumentException("VectorQuery JSON requires operation");
    String target = textOrNull(root.get("target"));
    VectorQuery.Builder b = VectorQuery.builder(Operation.valueOf(op.toUpperCase()),
        CollectionRef.of(target == null ? "" : target));

    JsonNode qv = root.get("queryVector");
    if (qv != null && !qv.isNull()) b.queryVector(parseVector(qv));

    JsonNode qe = root.get("queryEmbedding");
    if (qe != null && !qe.isNull()) {
      if (qe.isObject()) b.queryEmbedding(EmbeddingField.of(textOrNull(qe.get("collection")), textOrNull(qe.get("name"))));
      else b.queryEmbedding(EmbeddingField.of(qe.asText()));
    }

    JsonNode topK = root.get("topK");
    if (topK != null && !topK.isNull()) {
      if (topK.isNumber()) b.topK(topK.intValue());
      else b.topK(parseParam(topK));
    }

    JsonNode minScore = root.get("minScore");
    if (minScore != null && !minScore.isNull()) b.minScore(parseParam(minScore));

    JsonNode iv = root.get("includeVectors");
    if (iv != null && iv.isBoolean()) b.includeVectors(iv.booleanValue());
    JsonNode im = root.get("includeMetadata");
    if (im != null && im.isBoolean()) b.includeMetadata(im.booleanValue());

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) b.filter(parseFilter(filter));

    JsonNode mf = root.get("metadataFields");
    if (mf != null && mf.isArray()) {
      List<MetadataField> out = new ArrayList<>();
      for (JsonNode x : mf) out.add(parseField(x));
      b.metadataFields(out.toArray(new MetadataField[0]));
    }

    JsonNode vectors = root.get("vectors");
    if (vectors != null && vectors.isArray()) {
      for (JsonNode v : vectors) b.vector(parseRecord(v));
    }

    JsonNode updates = root.get("updates");
    if (updates != null && updates.isArray()) {
      for (Map.Entry<MetadataField, Param> e : parseEntries(updates).entrySet()) b.set(e.getKey(), e.getValue());
    }

    JsonNode ids = root.get("ids");
    if (ids != null && ids.isArray()) {
      for (JsonNode x : ids) b.ids(parseParam(x));
    }

    JsonNode deleteAll = root.get("deleteAll");
    if (deleteAll != null && deleteAll.asBoolean(false)) b.deleteAll(true);

    JsonNode ns = root.get("namespace");
    if (ns != null && !ns.isNull()) b.namespace(parseParam(ns));

    return b.buildWithoutValidation();
  }

  private static VectorRecord parseRecord(JsonNode n) {
    if (!n.isObject()) throw new IllegalArgumentException("vector record must be an object");
    VectorRecord.Builder rb = VectorRecord.builder(parseParam(n.get("id")), parseVector(n.get("vector")));
    JsonNode md = n.get("metadata");
    if (md != null && md.isArray()) {
      for (Map.Entry<MetadataField, Param> e : parseEntries(md).entrySet()) rb.metadata(e.getKey(), e.getValue());
    }
    JsonNode sparse = n.get("sparseVector");
    if (sparse != null && !sparse.isNull()) {
      if (sparse.has("param")) {
        rb.sparseVector(SparseVectorValue.of(parseParam(sparse)));
      } else {
        List<Integer> indices = new ArrayList<>();
        for (JsonNode i : sparse.path("indices")) indices.add(i.intValue());
        List<Float> values = new ArrayList<>();
        for (JsonNode f : sparse.path("values")) values.add(f.floatValue());
        rb.sparseVector(SparseVectorValue.literal(indices, values));
      }
    }
    return rb.build();
  }

  private static Map<MetadataField, Param> parseEntries(JsonNode arr) {
    Map<MetadataField, Param> out = new LinkedHashMap<>();
    for (JsonNode e : arr) {
      out.put(parseField(e.get("field")), parseParam(e.get("value")));
    }
    return out;
  }

  private static FilterItem parseFilter(JsonNode n) {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("filter element must be an object: " + n);

    // Group forms: { "and": [ ... ] } / { "or": [ ... ] } / { "not": <element> }
    if (n.has("and")) return new FilterGroup(Logic.AND, parseChildren(n.get("and")));
    if (n.has("or")) return new FilterGroup(Logic.OR, parseChildren(n.get("or")));
    if (n.has("not")) {
      JsonNode child = n.get("not");
      if (child.isArray()) return new FilterGroup(Logic.NOT, parseChildren(child));
      return new FilterGroup(Logic.NOT, List.of(parseFilter(child)));
    }

    if (n.has("range")) {
      JsonNode body = n.get("range");
      return new RangeFilter(parseField(body.get("field")), optParam(body.get("min")), optParam(body.get("max")),
          body.path("minExclusive").asBoolean(false), body.path("maxExclusive").asBoolean(false));
    }

    if (n.has("geo")) {
      JsonNode body = n.get("geo");
      return new GeoFilter(parseField(body.get("field")),
          new GeoPoint(parseParam(body.get("lat")), parseParam(body.get("lon"))), parseParam(body.get("radius")));
    }

    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      FilterOperator op = tryOp(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return new FilterCondition(parseField(body.get("field")), op, optParam(body.get("value")));
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<FilterItem> parseChildren(JsonNode arr) {
    if (arr == null || !arr.isArray()) return List.of();
    List<FilterItem> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseFilter(x));
    return out;
  }

  private static VectorValue parseVector(JsonNode n) {
    if (n == null || n.isNull()) throw new IllegalArgumentException("vector is required");
    if (n.isArray()) {
      List<Float> out = new ArrayList<>(n.size());
      for (JsonNode x : n) out.add(x.floatValue());
      return VectorValue.literal(out);
    }
    return VectorValue.of(parseParam(n));
  }

  private static MetadataField parseField(JsonNode n) {
    if (n == null || n.isNull()) throw new IllegalArgumentException("field is required");
    if (n.isObject()) return MetadataField.of(textOrNull(n.get("collection")), textOrNull(n.get("name")));
    return MetadataField.of(n.asText());
  }

  private static Param optParam(JsonNode n) {
    return (n == null || n.isNull()) ? null : parseParam(n);
  }

  // Param: {"param":"x"} or {"$param":"x"}
  private static Param parseParam(JsonNode n) {
    if (n != null && n.isObject()) {
      JsonNode p = n.get("param");
      if (p == null) p = n.get("$param");
      if (p != null && p.isTextual()) return Param.of(p.asText());
    }
    throw new IllegalArgumentException("expected {\"param\": name} but got: " + n);
  }

  private static FilterOperator tryOp(String key) {
    if (key == null) return null;
    try {
      return FilterOperator.valueOf(key.toUpperCase());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
