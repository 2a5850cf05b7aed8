package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

/** A guarded field of a record changed while other data still references the record. */
public class DependencyBlockedException extends RecordCoreException {

  private final String referencingTable;

  public DependencyBlockedException(String referencingTable, List<FieldViolation> violations) {
    super(ErrorKind.DEPENDENCY_BLOCKED, "validationFailed", Map.of(), violations);
    this.referencingTable = referencingTable;
  }

  public String getReferencingTable() {
    return referencingTable;
  }
}
