package io.intellixity.astql.spi;

import io.intellixity.astql.query.QueryAst;
import io.intellixity.astql.util.AstqlFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Renderer registry built via discovery ({@code META-INF/astql.factories}).
 * <p>
 * Ids are matched after trimming. When two renderers claim the same id the first one discovered wins and the
 * other is logged and ignored.
 */
public final class DiscoveredRendererRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredRendererRegistry.class);

  private final Map<String, Renderer<?>> byId;

  public DiscoveredRendererRegistry() {
    this(discover());
  }

  DiscoveredRendererRegistry(Collection<? extends Renderer<?>> renderers) {
    Map<String, Renderer<?>> m = new LinkedHashMap<>();
    for (Renderer<?> r : renderers) {
      if (r == null) continue;
      String id = normalize(r.id());
      if (id.isEmpty()) throw new IllegalArgumentException("Renderer " + r.getClass().getName() + " has no id");
      Renderer<?> prev = m.putIfAbsent(id, r);
      if (prev != null) {
        log.warn("astql.spi duplicate renderer id={} kept={} ignored={}",
            id, prev.getClass().getName(), r.getClass().getName());
      }
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  public Set<String> ids() { return byId.keySet(); }

  public Optional<Renderer<?>> find(String id) {
    return Optional.ofNullable(byId.get(normalize(id)));
  }

  public Renderer<?> get(String id) {
    Renderer<?> r = byId.get(normalize(id));
    if (r == null) throw new IllegalArgumentException("No renderer registered for id=" + id + ", known=" + byId.keySet());
    return r;
  }

  /** Shorthand for {@code get(id).render(ast)}. */
  public NativeStatement render(String id, QueryAst ast) {
    return get(id).render(ast);
  }

  private static List<Renderer<?>> discover() {
    List<Renderer<?>> out = new ArrayList<>();
    for (Renderer<?> r : AstqlFactoriesLoader.load(Renderer.class)) out.add(r);
    return out;
  }

  private static String normalize(String id) {
    return (id == null) ? "" : id.trim();
  }
}
