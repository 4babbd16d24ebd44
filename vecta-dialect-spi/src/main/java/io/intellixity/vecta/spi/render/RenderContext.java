package io.intellixity.vecta.spi.render;

import io.intellixity.vecta.query.Param;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-render accumulator of param occurrences.
 * <p>
 * Every {@link #add(Param)} records the name, duplicates included, in call order. Not thread-safe: create
 * one per render.
 */
public final class RenderContext {
  public static final String PLACEHOLDER_PREFIX = ":";

  private final List<String> params = new ArrayList<>();

  /** Records the param and returns its placeholder token. */
  public String add(Param p) {
    params.add(p.name());
    return PLACEHOLDER_PREFIX + p.name();
  }

  public List<String> requiredParams() { return List.copyOf(params); }

  public int size() { return params.size(); }
}
