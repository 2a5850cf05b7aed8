package io.b2mash.b2b.recordcore.lifecycle;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import io.b2mash.b2b.recordcore.config.RecordCoreProperties.Dependencies;
import io.b2mash.b2b.recordcore.config.RecordCoreProperties.Reference;
import io.b2mash.b2b.recordcore.exception.DependencyBlockedException;
import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.record.RecordFields;
import io.b2mash.b2b.recordcore.record.RecordType;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import io.b2mash.b2b.recordcore.status.StatusTransitionPolicy;
import io.b2mash.b2b.recordcore.store.RecordStore;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Blocks changes to guarded fields of a record that other data still references. A guarded {@code
 * status} also trips when the new status is terminal, changed or not.
 */
@Component
public class DependencyGuard {

  private static final Logger log = LoggerFactory.getLogger(DependencyGuard.class);

  private final RecordCoreProperties properties;
  private final StatusTransitionPolicy statusPolicy;
  private final RecordStore recordStore;

  public DependencyGuard(
      RecordCoreProperties properties,
      StatusTransitionPolicy statusPolicy,
      RecordStore recordStore) {
    this.properties = properties;
    this.statusPolicy = statusPolicy;
    this.recordStore = recordStore;
  }

  public void check(
      RecordType<?> type, long id, Set<String> changedFields, RecordStatus newStatus) {
    Dependencies dependencies = properties.dependenciesFor(type.tableName());
    if (dependencies.references().isEmpty()) {
      return;
    }
    List<String> tripped =
        dependencies.guardedFields().stream()
            .filter(
                field ->
                    changedFields.contains(field)
                        || (RecordFields.STATUS.equals(field)
                            && statusPolicy.isDisallowedUpdate(newStatus)))
            .toList();
    if (tripped.isEmpty()) {
      return;
    }
    for (Reference reference : dependencies.references()) {
      if (recordStore.isReferenced(reference, id)) {
        log.info(
            "Change blocked by reference: {} id={}, fields={}, referencedBy={}.{}",
            type.resourceName(),
            id,
            tripped,
            reference.table(),
            reference.column());
        throw new DependencyBlockedException(
            reference.table(),
            tripped.stream()
                .map(
                    field ->
                        FieldViolation.of(field, "updatePermission", "tableName", type.tableName()))
                .toList());
      }
    }
  }
}
