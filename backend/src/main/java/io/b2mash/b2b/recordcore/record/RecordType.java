package io.b2mash.b2b.recordcore.record;

import io.b2mash.b2b.recordcore.filter.RecordFilterBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declares everything the generic lifecycle and query services need to know about one kind of
 * record. Fields common to all records ({@code id}, {@code status}, {@code lockVersion}, {@code
 * detail}) are handled by the services; implementations only cover their own columns.
 */
public interface RecordType<E extends ManagedRecord> {

  /** Name used in messages and logs, e.g. {@code item}. */
  String resourceName();

  /** Relational table; also the mirror collection name. */
  String tableName();

  Class<E> entityClass();

  E newInstance();

  ScenarioFields fieldsFor(Scenario scenario);

  /** Value constraints for writable fields, in validation order. */
  List<FieldSpec> fieldSpecs();

  /**
   * Copies type-specific values onto {@code record}. Only keys present in {@code values} are
   * touched.
   *
   * @return names of fields whose stored value changed
   */
  Set<String> applyFields(E record, Map<String, Object> values);

  /** Search parameters specific to this type, on top of the common ones. */
  Set<String> searchParameters();

  /** Adds type-specific predicates for the given search parameters. */
  void applyFilters(Map<String, Object> parameters, RecordFilterBuilder builder);

  /** Sort parameter value to column name. */
  Map<String, String> sortColumns();

  /** Writes type-specific fields into an output view. */
  void writeFields(E record, Map<String, Object> view);

  /** API and mirror representation; never includes the sync flag. */
  default Map<String, Object> toView(E record) {
    var view = new LinkedHashMap<String, Object>();
    view.put(RecordFields.ID, record.getId());
    writeFields(record, view);
    view.put(RecordFields.STATUS, record.getStatus().code());
    view.put(RecordFields.LOCK_VERSION, record.getLockVersion());
    view.put(RecordFields.DETAIL, record.getDetail());
    return view;
  }
}
