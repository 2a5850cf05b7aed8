package io.b2mash.b2b.recordcore.record;

import java.util.Set;

/** Permitted and required request fields for one scenario. */
public record ScenarioFields(Set<String> permitted, Set<String> required) {

  public ScenarioFields {
    permitted = Set.copyOf(permitted);
    required = Set.copyOf(required);
    if (!permitted.containsAll(required)) {
      throw new IllegalArgumentException(
          "Required fields " + required + " must be permitted: " + permitted);
    }
  }
}
