package io.intellixity.vecta.spi.render;

import java.util.List;
import java.util.Objects;

/** Serialized request document plus the param names, in occurrence order, the caller must bind. */
public record RenderResult(String document, List<String> requiredParams) {
  public RenderResult {
    Objects.requireNonNull(document, "document");
    requiredParams = List.copyOf(requiredParams == null ? List.of() : requiredParams);
  }
}
