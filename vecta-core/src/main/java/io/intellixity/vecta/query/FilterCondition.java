package io.intellixity.vecta.query;

import java.util.Objects;

/** Leaf comparison. {@code value} is null exactly when the operator is valueless (EXISTS / NOT_EXISTS). */
public record FilterCondition(MetadataField field, FilterOperator operator, Param value) implements FilterItem {
  public FilterCondition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    if (operator.isValueless() && value != null) {
      throw new IllegalArgumentException(operator + " takes no value");
    }
    if (!operator.isValueless() && value == null) {
      throw new IllegalArgumentException(operator + " requires a value param");
    }
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
