package io.b2mash.b2b.recordcore.record;

/** Write scenario; selects the permitted and required fields and the message keys. */
public enum Scenario {
  CREATE("create", null),
  UPDATE("update", "noRecordUpdated"),
  DELETE("delete", "noRecordDeleted");

  private final String key;
  private final String noChangeKey;

  Scenario(String key, String noChangeKey) {
    this.key = key;
    this.noChangeKey = noChangeKey;
  }

  public String successKey() {
    return key + "RecordSuccess";
  }

  public String failedKey() {
    return key + "RecordFailed";
  }

  public String noChangeKey() {
    return noChangeKey;
  }
}
