package io.b2mash.b2b.recordcore.store;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties.Reference;
import io.b2mash.b2b.recordcore.filter.FilterSpec;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import io.b2mash.b2b.recordcore.record.ManagedRecord;
import io.b2mash.b2b.recordcore.record.RecordType;
import java.util.List;
import java.util.Optional;

/** Primary (relational) store of lifecycle-managed records. */
public interface RecordStore {

  /** Returns a detached copy; changes to it are only written through {@link #update}. */
  <E extends ManagedRecord> Optional<E> findById(RecordType<E> type, long id);

  /** Inserts with {@code lockVersion = 1} and returns the record with its generated id. */
  <E extends ManagedRecord> E insert(RecordType<E> type, E record);

  /**
   * Compare-and-swap write: succeeds only if the stored version still equals {@code
   * expectedVersion}, and leaves the record at {@code expectedVersion + 1}.
   *
   * @throws io.b2mash.b2b.recordcore.exception.LockConflictException if no row matched
   */
  <E extends ManagedRecord> E update(RecordType<E> type, E record, int expectedVersion);

  long count(RecordType<?> type, FilterSpec filter);

  <E extends ManagedRecord> List<E> find(
      RecordType<E> type, FilterSpec filter, SortSpec sort, PageSpec page);

  /** True if {@code reference} points at the record with this id. */
  boolean isReferenced(Reference reference, long id);

  /** Flags the record as stale in the mirror, in its own transaction. */
  void markOutOfSync(RecordType<?> type, long id);
}
