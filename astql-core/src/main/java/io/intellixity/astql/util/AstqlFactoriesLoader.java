package io.intellixity.astql.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style discovery for astql extension points.
 * <p>
 * Every {@code META-INF/astql.factories} resource on the classpath is read as a Java properties file keyed by the
 * fully qualified extension interface:
 *
 * <pre>
 * io.intellixity.astql.spi.Renderer=com.acme.CqlRenderer,com.acme.EsRenderer
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored and duplicates across resources are dropped (first wins).
 * Implementations need a public no-arg constructor.
 */
public final class AstqlFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(AstqlFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/astql.factories";

  private AstqlFactoriesLoader() {}

  public static <T> List<T> load(Class<T> extensionType) {
    return load(extensionType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> extensionType, ClassLoader cl) {
    Objects.requireNonNull(extensionType, "extensionType");
    if (cl == null) cl = AstqlFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(extensionType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, extensionType, cl));
    if (log.isDebugEnabled()) {
      log.debug("astql.factories type={} impls={}", extensionType.getName(), implNames);
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> extensionType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Listed in " + RESOURCE + " but not on classpath: " + implName, e);
    }
    if (!extensionType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + extensionType.getName());
    }
    try {
      return extensionType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + extensionType.getName(), e);
    }
  }
}
