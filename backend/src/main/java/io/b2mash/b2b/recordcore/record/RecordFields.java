package io.b2mash.b2b.recordcore.record;

/** Field names the lifecycle itself manages on every record type. */
public final class RecordFields {

  public static final String ID = "id";
  public static final String STATUS = "status";
  public static final String LOCK_VERSION = "lockVersion";
  public static final String DETAIL = "detail";

  private RecordFields() {}
}
