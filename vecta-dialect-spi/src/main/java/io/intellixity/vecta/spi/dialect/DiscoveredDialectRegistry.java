package io.intellixity.vecta.spi.dialect;

import io.intellixity.vecta.util.VectaFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/vecta.factories).
 * <p>
 * The first provider registered for an id wins; later duplicates are ignored.
 */
public final class DiscoveredDialectRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredDialectRegistry.class);

  private final Map<String, DialectProvider> providers;

  public DiscoveredDialectRegistry() {
    this(VectaFactoriesLoader.load(DialectProvider.class));
  }

  DiscoveredDialectRegistry(List<DialectProvider> providers) {
    Map<String, DialectProvider> m = new LinkedHashMap<>();
    for (DialectProvider p : providers) {
      if (p == null) continue;
      String id = normalize(p.dialectId());
      if (id.isEmpty()) throw new IllegalArgumentException("DialectProvider " + p.getClass().getName() + " has no dialect id");
      m.putIfAbsent(id, p);
    }
    this.providers = Collections.unmodifiableMap(m);
    log.debug("vecta.dialects discovered={}", this.providers.keySet());
  }

  public Set<String> dialectIds() { return providers.keySet(); }

  public VectorDialect dialect(String id) {
    return dialect(id, DialectOptions.DEFAULTS);
  }

  public VectorDialect dialect(String id, DialectOptions options) {
    DialectProvider p = providers.get(normalize(id));
    if (p == null) throw new IllegalArgumentException("No dialect registered for id=" + id + ", known=" + providers.keySet());
    return p.create(options == null ? DialectOptions.DEFAULTS : options);
  }

  private static String normalize(String id) {
    return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
  }
}
