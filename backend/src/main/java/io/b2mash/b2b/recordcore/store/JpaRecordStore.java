package io.b2mash.b2b.recordcore.store;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties.Reference;
import io.b2mash.b2b.recordcore.exception.LockConflictException;
import io.b2mash.b2b.recordcore.filter.FieldRef;
import io.b2mash.b2b.recordcore.filter.FilterSpec;
import io.b2mash.b2b.recordcore.filter.RelationalFilterRenderer;
import io.b2mash.b2b.recordcore.filter.SqlFragment;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.SortSpec;
import io.b2mash.b2b.recordcore.record.ManagedRecord;
import io.b2mash.b2b.recordcore.record.RecordType;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA-backed {@link RecordStore}. Filtered reads use native SQL built by {@link
 * RelationalFilterRenderer}; writes go through the entity manager after a version-checked bulk
 * update.
 */
@Repository
public class JpaRecordStore implements RecordStore {

  private static final Logger log = LoggerFactory.getLogger(JpaRecordStore.class);

  private final RelationalFilterRenderer filterRenderer;

  @PersistenceContext private EntityManager entityManager;

  public JpaRecordStore(RelationalFilterRenderer filterRenderer) {
    this.filterRenderer = filterRenderer;
  }

  @Override
  @Transactional(readOnly = true)
  public <E extends ManagedRecord> Optional<E> findById(RecordType<E> type, long id) {
    E record = entityManager.find(type.entityClass(), id);
    if (record == null) {
      return Optional.empty();
    }
    entityManager.detach(record);
    return Optional.of(record);
  }

  @Override
  @Transactional
  public <E extends ManagedRecord> E insert(RecordType<E> type, E record) {
    record.setLockVersion(1);
    entityManager.persist(record);
    entityManager.flush();
    log.debug("Inserted {} id={}", type.resourceName(), record.getId());
    return record;
  }

  @Override
  @Transactional
  public <E extends ManagedRecord> E update(RecordType<E> type, E record, int expectedVersion) {
    String jpql =
        "UPDATE "
            + entityName(type)
            + " e SET e.lockVersion = e.lockVersion + 1"
            + " WHERE e.id = :id AND e.lockVersion = :expected";
    int rows =
        entityManager
            .createQuery(jpql)
            .setParameter("id", record.getId())
            .setParameter("expected", expectedVersion)
            .executeUpdate();
    if (rows == 0) {
      log.info(
          "Version check failed: {} id={}, expectedVersion={}",
          type.resourceName(),
          record.getId(),
          expectedVersion);
      throw new LockConflictException();
    }
    record.setLockVersion(expectedVersion + 1);
    E merged = entityManager.merge(record);
    entityManager.flush();
    return merged;
  }

  @Override
  @Transactional(readOnly = true)
  public long count(RecordType<?> type, FilterSpec filter) {
    SqlFragment fragment = filterRenderer.render(filter);
    var sql = new StringBuilder("SELECT COUNT(*) FROM ").append(table(type)).append(" e");
    appendWhere(sql, fragment);
    var query = entityManager.createNativeQuery(sql.toString());
    fragment.params().forEach(query::setParameter);
    return ((Number) query.getSingleResult()).longValue();
  }

  @Override
  @Transactional(readOnly = true)
  public <E extends ManagedRecord> List<E> find(
      RecordType<E> type, FilterSpec filter, SortSpec sort, PageSpec page) {
    if (page.pageSize() == 0) {
      return List.of();
    }
    String column = type.sortColumns().get(sort.field());
    if (column == null) {
      throw new IllegalArgumentException("Unsortable field: " + sort.field());
    }
    SqlFragment fragment = filterRenderer.render(filter);
    var sql = new StringBuilder("SELECT e.* FROM ").append(table(type)).append(" e");
    appendWhere(sql, fragment);
    sql.append(" ORDER BY e.")
        .append(FieldRef.column(column).column())
        .append(' ')
        .append(sort.direction().name());

    var query = entityManager.createNativeQuery(sql.toString(), type.entityClass());
    fragment.params().forEach(query::setParameter);
    query.setFirstResult((int) page.offset());
    query.setMaxResults(page.pageSize());

    @SuppressWarnings("unchecked")
    List<E> results = query.getResultList();
    return results;
  }

  @Override
  @Transactional(readOnly = true)
  public boolean isReferenced(Reference reference, long id) {
    String table = FieldRef.column(reference.table()).column();
    String column = FieldRef.column(reference.column()).column();
    String predicate =
        reference.jsonArray() ? column + " @> CAST(:ref AS jsonb)" : column + " = :ref";
    var query =
        entityManager.createNativeQuery(
            "SELECT EXISTS (SELECT 1 FROM " + table + " WHERE " + predicate + ")");
    query.setParameter("ref", reference.jsonArray() ? "[" + id + "]" : id);
    return Boolean.TRUE.equals(query.getSingleResult());
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void markOutOfSync(RecordType<?> type, long id) {
    entityManager
        .createNativeQuery("UPDATE " + table(type) + " SET sync_flag = 1 WHERE id = :id")
        .setParameter("id", id)
        .executeUpdate();
  }

  private static void appendWhere(StringBuilder sql, SqlFragment fragment) {
    if (!fragment.isEmpty()) {
      sql.append(" WHERE ").append(fragment.whereClause());
    }
  }

  private static String table(RecordType<?> type) {
    return FieldRef.column(type.tableName()).column();
  }

  private String entityName(RecordType<?> type) {
    return entityManager.getMetamodel().entity(type.entityClass()).getName();
  }
}
