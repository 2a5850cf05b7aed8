package io.b2mash.b2b.recordcore.status;

import java.util.Arrays;
import java.util.Optional;

/** Record status as stored in the {@code status} integer column. */
public enum RecordStatus {
  INACTIVE(0, "Inactive"),
  ACTIVE(1, "Active"),
  DRAFT(2, "Draft"),
  COMPLETED(3, "Completed"),
  DELETED(4, "Deleted"),
  MAINTENANCE(5, "Maintenance"),
  APPROVED(6, "Approved"),
  REJECTED(7, "Rejected");

  private final int code;
  private final String label;

  RecordStatus(int code, String label) {
    this.code = code;
    this.label = label;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  /** Looks up a status by its stored code. */
  public static Optional<RecordStatus> fromCode(int code) {
    return Arrays.stream(values()).filter(s -> s.code == code).findFirst();
  }

  /**
   * Parses a stored code.
   *
   * @throws IllegalArgumentException if no status has this code
   */
  public static RecordStatus of(int code) {
    return fromCode(code)
        .orElseThrow(() -> new IllegalArgumentException("Unknown record status code: " + code));
  }

  /** Comma separated codes, used in validation messages. */
  public static String codeList() {
    return String.join(
        ", ", Arrays.stream(values()).map(s -> String.valueOf(s.code)).toList());
  }
}
