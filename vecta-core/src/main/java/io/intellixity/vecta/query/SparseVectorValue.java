package io.intellixity.vecta.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Sparse vector for hybrid search: either a {@link Param} or literal index/value pairs. */
public record SparseVectorValue(List<Integer> indices, List<Float> values, Param param) {
  public SparseVectorValue {
    if (param != null) {
      if (indices != null || values != null) {
        throw new IllegalArgumentException("SparseVectorValue is either a param or literal indices/values, not both");
      }
    } else {
      if (indices == null || values == null) {
        throw new IllegalArgumentException("literal SparseVectorValue requires indices and values");
      }
      if (indices.size() != values.size()) {
        throw new IllegalArgumentException("sparse indices and values differ in length: " + indices.size() + " != " + values.size());
      }
      List<Integer> idx = new ArrayList<>(indices.size());
      for (Integer i : indices) {
        if (i == null || i < 0) throw new IllegalArgumentException("sparse index must be >= 0: " + i);
        idx.add(i);
      }
      List<Float> vals = new ArrayList<>(values.size());
      for (Float f : values) {
        if (f == null || !Float.isFinite(f)) throw new IllegalArgumentException("sparse value must be finite: " + f);
        vals.add(f);
      }
      indices = Collections.unmodifiableList(idx);
      values = Collections.unmodifiableList(vals);
    }
  }

  public boolean isParam() { return param != null; }

  public static SparseVectorValue of(Param param) { return new SparseVectorValue(null, null, param); }

  public static SparseVectorValue literal(List<Integer> indices, List<Float> values) {
    return new SparseVectorValue(indices, values, null);
  }
}
