package io.intellixity.vecta.query;

import java.util.List;
import java.util.Objects;

/**
 * Boolean group of filter items.
 * <p>
 * The tree shape does not restrict arity; validation requires exactly one child for NOT and at least
 * one for AND/OR.
 */
public record FilterGroup(Logic logic, List<FilterItem> children) implements FilterItem {
  public FilterGroup {
    Objects.requireNonNull(logic, "logic");
    children = List.copyOf(children == null ? List.of() : children);
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
