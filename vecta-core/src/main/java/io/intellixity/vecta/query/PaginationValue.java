package io.intellixity.vecta.query;

/** Top-K / limit: a static count or a {@link Param}. */
public record PaginationValue(Integer staticValue, Param param) {
  public PaginationValue {
    if ((staticValue == null) == (param == null)) {
      throw new IllegalArgumentException("PaginationValue requires exactly one of static value or param");
    }
  }

  public boolean isStatic() { return staticValue != null; }

  public static PaginationValue of(int value) { return new PaginationValue(value, null); }
  public static PaginationValue of(Param param) { return new PaginationValue(null, param); }
}
