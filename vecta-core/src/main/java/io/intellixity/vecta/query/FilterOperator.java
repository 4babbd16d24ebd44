package io.intellixity.vecta.query;

/** Universal filter operators. Dialects map these onto their native vocabulary. */
public enum FilterOperator {
  EQ(false),
  NE(false),
  GT(false),
  GE(false),
  LT(false),
  LE(false),

  IN(false),
  NOT_IN(false),

  CONTAINS(false),
  STARTS_WITH(false),
  ENDS_WITH(false),
  MATCHES(false),

  // Existence checks carry no value
  EXISTS(true),
  NOT_EXISTS(true),

  ARRAY_CONTAINS(false),
  ARRAY_CONTAINS_ANY(false),
  ARRAY_CONTAINS_ALL(false);

  private final boolean valueless;

  FilterOperator(boolean valueless) {
    this.valueless = valueless;
  }

  public boolean isValueless() {
    return valueless;
  }
}
