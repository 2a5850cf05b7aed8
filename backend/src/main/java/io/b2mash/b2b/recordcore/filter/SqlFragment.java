package io.b2mash.b2b.recordcore.filter;

import java.util.Map;

/**
 * A rendered WHERE clause (without the {@code WHERE} keyword) plus its named parameter bindings.
 * An empty clause means no restriction.
 */
public record SqlFragment(String whereClause, Map<String, Object> params) {

  public SqlFragment {
    params = Map.copyOf(params);
  }

  public boolean isEmpty() {
    return whereClause.isEmpty();
  }
}
