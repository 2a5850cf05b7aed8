package io.b2mash.b2b.recordcore.changelog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit stamps kept under {@code detail.changeLog}. Timestamps are ISO-8601 UTC strings with second
 * precision so they compare lexicographically in both stores.
 */
public record ChangeLog(
    String createdAt,
    String createdBy,
    String updatedAt,
    String updatedBy,
    String deletedAt,
    String deletedBy) {

  public static final String DETAIL_KEY = "changeLog";

  public static final ChangeLog EMPTY = new ChangeLog(null, null, null, null, null, null);

  public ChangeLog withUpdated(String at, String by) {
    return new ChangeLog(createdAt, createdBy, at, by, deletedAt, deletedBy);
  }

  public ChangeLog withDeleted(String at, String by) {
    return new ChangeLog(createdAt, createdBy, updatedAt, updatedBy, at, by);
  }

  /** Map form for the jsonb {@code detail} column; null stamps are kept as explicit nulls. */
  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("createdAt", createdAt);
    map.put("createdBy", createdBy);
    map.put("updatedAt", updatedAt);
    map.put("updatedBy", updatedBy);
    map.put("deletedAt", deletedAt);
    map.put("deletedBy", deletedBy);
    return map;
  }

  public static ChangeLog fromMap(Map<?, ?> map) {
    if (map == null) {
      return EMPTY;
    }
    return new ChangeLog(
        string(map.get("createdAt")),
        string(map.get("createdBy")),
        string(map.get("updatedAt")),
        string(map.get("updatedBy")),
        string(map.get("deletedAt")),
        string(map.get("deletedBy")));
  }

  /** Reads the change log out of a record's detail map. */
  public static ChangeLog fromDetail(Map<String, Object> detail) {
    if (detail == null || !(detail.get(DETAIL_KEY) instanceof Map<?, ?> raw)) {
      return EMPTY;
    }
    return fromMap(raw);
  }

  private static String string(Object value) {
    return value != null ? value.toString() : null;
  }
}
