package io.intellixity.astql.spi;

import io.intellixity.astql.query.QueryAst;

/**
 * Translates a {@link QueryAst} into one backend's native statement.
 * <p>
 * Implementations must be stateless with respect to rendering (same AST, same output) and safe to call from many
 * threads. They validate the AST before rendering and report problems as {@link RenderException} or
 * {@link io.intellixity.astql.query.QueryValidationException}; they never execute anything.
 * <p>
 * Register implementations under this interface's name in {@code META-INF/astql.factories} to make them visible to
 * {@link DiscoveredRendererRegistry}.
 */
public interface Renderer<S extends NativeStatement> {
  /** Stable provider id, e.g. {@code "sql"}; also the provider name hints are matched against. */
  String id();

  S render(QueryAst ast);
}
