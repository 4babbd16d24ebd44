package io.intellixity.vecta.spi.dialect;

import io.intellixity.vecta.query.QueryLimits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-dialect configuration.
 * <p>
 * {@code properties} carries dialect-specific settings (for example a default vector field name); each
 * dialect documents the keys it reads.
 */
public record DialectOptions(OperatorFallback operatorFallback, QueryLimits limits, Map<String, String> properties) {
  public static final DialectOptions DEFAULTS =
      new DialectOptions(OperatorFallback.FALLBACK_TO_DEFAULT, QueryLimits.DEFAULTS, Map.of());

  public DialectOptions {
    Objects.requireNonNull(operatorFallback, "operatorFallback");
    Objects.requireNonNull(limits, "limits");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties == null ? Map.of() : properties));
  }

  public String property(String key, String def) {
    String v = properties.get(key);
    return (v == null || v.isBlank()) ? def : v.trim();
  }

  public DialectOptions withOperatorFallback(OperatorFallback f) { return new DialectOptions(f, limits, properties); }
  public DialectOptions withLimits(QueryLimits l) { return new DialectOptions(operatorFallback, l, properties); }

  public DialectOptions withProperty(String key, String value) {
    Map<String, String> m = new LinkedHashMap<>(properties);
    m.put(key, value);
    return new DialectOptions(operatorFallback, limits, m);
  }
}
