package io.b2mash.b2b.recordcore.lifecycle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A write request that passed structural checks.
 *
 * @param id null on create
 * @param lockVersion null on create
 * @param values submitted fields other than {@code id} and {@code lockVersion}, in request order
 */
record ValidatedRequest(Long id, Integer lockVersion, Map<String, Object> values) {

  ValidatedRequest {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
