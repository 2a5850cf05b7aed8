package io.b2mash.b2b.recordcore.filter;

import java.util.List;

/** Predicates joined by AND. An empty spec matches everything. */
public record FilterSpec(List<FilterPredicate> predicates) {

  public static final FilterSpec MATCH_ALL = new FilterSpec(List.of());

  public FilterSpec {
    predicates = List.copyOf(predicates);
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }
}
