package io.intellixity.vecta.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Collects the {@link Param}s a query references, in a fixed walk order with duplicates kept. */
public final class QueryParams {
  private QueryParams() {}

  public static List<Param> referenced(VectorQuery q) {
    List<Param> out = new ArrayList<>();
    if (q.queryVector() != null && q.queryVector().isParam()) out.add(q.queryVector().param());
    if (q.topK() != null && !q.topK().isStatic()) out.add(q.topK().param());
    add(out, q.minScore());
    if (q.filter() != null) out.addAll(filterParams(q.filter()));
    for (VectorRecord r : q.vectors()) {
      out.add(r.id());
      if (r.vector().isParam()) out.add(r.vector().param());
      out.addAll(r.metadata().values());
      if (r.sparseVector() != null && r.sparseVector().isParam()) out.add(r.sparseVector().param());
    }
    for (Map.Entry<MetadataField, Param> e : q.updates().entrySet()) out.add(e.getValue());
    out.addAll(q.ids());
    add(out, q.namespace());
    return out;
  }

  public static List<Param> filterParams(FilterItem filter) {
    List<Param> out = new ArrayList<>();
    filter.accept(new FilterVisitor<Void>() {
      @Override
      public Void visit(FilterCondition c) {
        add(out, c.value());
        return null;
      }

      @Override
      public Void visit(FilterGroup g) {
        for (FilterItem child : g.children()) child.accept(this);
        return null;
      }

      @Override
      public Void visit(RangeFilter r) {
        add(out, r.min());
        add(out, r.max());
        return null;
      }

      @Override
      public Void visit(GeoFilter g) {
        out.add(g.center().lat());
        out.add(g.center().lon());
        out.add(g.radius());
        return null;
      }
    });
    return out;
  }

  private static void add(List<Param> out, Param p) {
    if (p != null) out.add(p);
  }
}
