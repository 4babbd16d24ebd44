package io.intellixity.vecta.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Dense vector: either literal components or a {@link Param} reference. */
public record VectorValue(List<Float> literal, Param param) {
  public VectorValue {
    if ((literal == null) == (param == null)) {
      throw new IllegalArgumentException("VectorValue requires exactly one of literal or param");
    }
    if (literal != null) {
      List<Float> copy = new ArrayList<>(literal.size());
      for (Float f : literal) {
        if (f == null || !Float.isFinite(f)) throw new IllegalArgumentException("vector component must be finite: " + f);
        copy.add(f);
      }
      literal = Collections.unmodifiableList(copy);
    }
  }

  public boolean isParam() { return param != null; }

  public static VectorValue of(Param param) { return new VectorValue(null, param); }

  public static VectorValue literal(float... values) {
    List<Float> out = new ArrayList<>(values.length);
    for (float v : values) out.add(v);
    return new VectorValue(out, null);
  }

  public static VectorValue literal(List<Float> values) { return new VectorValue(values, null); }
}
