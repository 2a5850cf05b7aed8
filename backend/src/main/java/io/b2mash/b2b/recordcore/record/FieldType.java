package io.b2mash.b2b.recordcore.record;

public enum FieldType {
  STRING,
  INTEGER,
  STATUS,
  OBJECT
}
