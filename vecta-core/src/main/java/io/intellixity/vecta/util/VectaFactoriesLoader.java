package io.intellixity.vecta.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Discovers plugin implementations listed in {@value #RESOURCE} files on the classpath.
 * <p>
 * Every file found is read as a Properties file keyed by the plugin interface name; the value is a
 * comma-separated list of implementation class names, each with a public no-arg constructor:
 *
 * <pre>
 * io.intellixity.vecta.spi.dialect.DialectProvider=com.acme.MyDialectProvider,com.acme.OtherProvider
 * </pre>
 *
 * Names keep classpath order. A name listed again, in the same file or another, is skipped and logged.
 */
public final class VectaFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(VectaFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/vecta.factories";

  private VectaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    ClassLoader loader = cl != null ? cl : VectaFactoriesLoader.class.getClassLoader();
    List<String> names = implementationNames(spiType, loader);
    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, spiType, loader));
    log.debug("vecta.factories spi={} loaded={}", spiType.getName(), names);
    return out;
  }

  /** Implementation class names registered for {@code spiType}, without instantiating them. */
  public static List<String> implementationNames(Class<?> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    Objects.requireNonNull(cl, "classLoader");
    Map<String, URL> seen = new LinkedHashMap<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(spiType.getName());
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        String name = part.trim();
        if (name.isEmpty()) continue;
        URL first = seen.putIfAbsent(name, url);
        if (first != null) {
          log.debug("vecta.factories duplicate spi={} impl={} first={} again={}", spiType.getName(), name, first, url);
        }
      }
    }
    return List.copyOf(seen.keySet());
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("cannot enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String name, Class<T> spiType, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " lists unknown class " + name + " for " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(type)) {
      throw new IllegalStateException(RESOURCE + " lists " + name + " which does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("cannot instantiate " + name + " for " + spiType.getName(), e);
    }
  }
}
