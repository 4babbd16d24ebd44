package io.intellixity.vecta.spi.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vecta.query.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Serializes a dialect's in-memory document and pairs it with the accumulated params. */
public final class ResultPackager {
  private static final Logger log = LoggerFactory.getLogger(ResultPackager.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private ResultPackager() {}

  public static RenderResult pack(String dialectId, Operation op, Map<String, ?> document, RenderContext ctx) {
    String json;
    try {
      json = JSON.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new RenderException("failed to serialize " + op + " document for dialect " + dialectId, e);
    }
    RenderResult out = new RenderResult(json, ctx.requiredParams());
    log.debug("vecta.render dialect={} op={} paramCount={}", dialectId, op, out.requiredParams().size());
    return out;
  }
}
