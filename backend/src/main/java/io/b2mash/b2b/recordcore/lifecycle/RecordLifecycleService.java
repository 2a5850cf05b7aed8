package io.b2mash.b2b.recordcore.lifecycle;

import io.b2mash.b2b.recordcore.changelog.ChangeLog;
import io.b2mash.b2b.recordcore.changelog.ChangeLogTracker;
import io.b2mash.b2b.recordcore.exception.InvalidStatusTransitionException;
import io.b2mash.b2b.recordcore.exception.NoEffectiveChangeException;
import io.b2mash.b2b.recordcore.exception.PermissionDeniedException;
import io.b2mash.b2b.recordcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.recordcore.exception.StorageFailureException;
import io.b2mash.b2b.recordcore.lock.OptimisticLockGuard;
import io.b2mash.b2b.recordcore.record.ManagedRecord;
import io.b2mash.b2b.recordcore.record.RecordFields;
import io.b2mash.b2b.recordcore.record.RecordType;
import io.b2mash.b2b.recordcore.record.Scenario;
import io.b2mash.b2b.recordcore.security.Actor;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import io.b2mash.b2b.recordcore.status.StatusTransitionPolicy;
import io.b2mash.b2b.recordcore.status.TransitionVerdict;
import io.b2mash.b2b.recordcore.store.MirrorStore;
import io.b2mash.b2b.recordcore.store.RecordStore;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Create, update and soft delete of lifecycle-managed records.
 *
 * <p>For update and delete the checks run in a fixed order: request structure, load, restricted
 * status, status transition, lock version, field values, dependency guard, no-op detection. The
 * first failing check aborts the request. Everything up to the version-checked write shares one
 * transaction; the mirror write happens after commit and never fails the request.
 */
@Service
public class RecordLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(RecordLifecycleService.class);

  private final RecordStore recordStore;
  private final MirrorStore mirrorStore;
  private final StatusTransitionPolicy statusPolicy;
  private final ChangeLogTracker changeLogTracker;
  private final DependencyGuard dependencyGuard;
  private final TransactionTemplate txTemplate;

  public RecordLifecycleService(
      RecordStore recordStore,
      MirrorStore mirrorStore,
      StatusTransitionPolicy statusPolicy,
      ChangeLogTracker changeLogTracker,
      DependencyGuard dependencyGuard,
      PlatformTransactionManager txManager) {
    this.recordStore = recordStore;
    this.mirrorStore = mirrorStore;
    this.statusPolicy = statusPolicy;
    this.changeLogTracker = changeLogTracker;
    this.dependencyGuard = dependencyGuard;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  public <E extends ManagedRecord> RecordWriteResult create(
      RecordType<E> type, Map<String, Object> params, Actor actor) {
    ValidatedRequest request = FieldValidator.checkStructure(type, Scenario.CREATE, params);
    Map<String, Object> values = request.values();

    RecordStatus status = RecordStatus.DRAFT;
    if (values.get(RecordFields.STATUS) != null) {
      status = FieldValidator.parseStatus(values.get(RecordFields.STATUS));
    }
    requireAllowedToRequest(status, actor);
    FieldValidator.checkValues(type, values);

    E record = type.newInstance();
    record.setStatus(status);
    type.applyFields(record, values);
    record.setDetail(clientDetail(values.get(RecordFields.DETAIL)));
    record.setChangeLog(changeLogTracker.onCreate(actor));

    E saved;
    try {
      saved = txTemplate.execute(tx -> recordStore.insert(type, record));
    } catch (DataAccessException e) {
      log.error("Insert failed: {}", type.resourceName(), e);
      throw new StorageFailureException(Scenario.CREATE.failedKey(), e);
    }
    log.info("Created {} id={}, status={}", type.resourceName(), saved.getId(), status);
    mirror(type, saved);
    return new RecordWriteResult(Scenario.CREATE, type.toView(saved));
  }

  public <E extends ManagedRecord> RecordWriteResult update(
      RecordType<E> type, Map<String, Object> params, Actor actor) {
    return mutate(type, Scenario.UPDATE, params, actor);
  }

  /** Soft delete: a transition to {@link RecordStatus#DELETED}, never a row removal. */
  public <E extends ManagedRecord> RecordWriteResult delete(
      RecordType<E> type, Map<String, Object> params, Actor actor) {
    return mutate(type, Scenario.DELETE, params, actor);
  }

  private <E extends ManagedRecord> RecordWriteResult mutate(
      RecordType<E> type, Scenario scenario, Map<String, Object> params, Actor actor) {
    ValidatedRequest request = FieldValidator.checkStructure(type, scenario, params);

    E saved;
    try {
      saved = txTemplate.execute(tx -> applyMutation(type, scenario, request, actor));
    } catch (DataAccessException e) {
      log.error("Write failed: {} id={}", type.resourceName(), request.id(), e);
      throw new StorageFailureException(scenario.failedKey(), e);
    }
    log.info(
        "{} {} id={}, status={}, lockVersion={}",
        scenario,
        type.resourceName(),
        saved.getId(),
        saved.getStatus(),
        saved.getLockVersion());
    mirror(type, saved);
    return new RecordWriteResult(scenario, type.toView(saved));
  }

  private <E extends ManagedRecord> E applyMutation(
      RecordType<E> type, Scenario scenario, ValidatedRequest request, Actor actor) {
    Map<String, Object> values = request.values();
    E record =
        recordStore
            .findById(type, request.id())
            .orElseThrow(() -> new ResourceNotFoundException(type.resourceName(), request.id()));

    RecordStatus current = record.getStatus();
    RecordStatus next = current;
    if (scenario == Scenario.DELETE) {
      next = RecordStatus.DELETED;
    } else if (values.containsKey(RecordFields.STATUS)) {
      next = FieldValidator.parseStatus(values.get(RecordFields.STATUS));
      if (next != current) {
        requireAllowedToRequest(next, actor);
      }
    }
    if (next != current) {
      checkTransition(type, record.getId(), current, next, actor);
    }

    OptimisticLockGuard.checkVersion(record.getLockVersion(), request.lockVersion());
    FieldValidator.checkValues(type, values);

    Set<String> changed = new LinkedHashSet<>();
    if (next != current) {
      record.setStatus(next);
      changed.add(RecordFields.STATUS);
    }
    changed.addAll(type.applyFields(record, values));
    if (values.containsKey(RecordFields.DETAIL)) {
      Map<String, Object> detail = clientDetail(values.get(RecordFields.DETAIL));
      if (!detail.equals(withoutChangeLog(record.getDetail()))) {
        ChangeLog changeLog = record.getChangeLog();
        record.setDetail(detail);
        record.setChangeLog(changeLog);
        changed.add(RecordFields.DETAIL);
      }
    }

    dependencyGuard.check(type, record.getId(), changed, next);
    if (changed.isEmpty()) {
      throw new NoEffectiveChangeException(scenario.noChangeKey());
    }

    record.setChangeLog(changeLogTracker.onMutate(record.getChangeLog(), next, changed, actor));
    if (mirrorStore.isEnabled()) {
      record.setSyncFlag(null);
    }
    return recordStore.update(type, record, request.lockVersion());
  }

  private void checkTransition(
      RecordType<?> type, Long id, RecordStatus current, RecordStatus next, Actor actor) {
    TransitionVerdict verdict = statusPolicy.evaluate(current, next, actor.isPrivileged());
    switch (verdict) {
      case REVIVAL_DENIED:
        throw new PermissionDeniedException(
            "deletedStatusChanged", Map.of("value", current.label()));
      case NOT_PERMITTED:
      case UNKNOWN_CURRENT:
        throw new InvalidStatusTransitionException(current, next);
      case PRIVILEGED_REVIVAL:
        log.info(
            "Privileged revival: {} id={}, to={}, actor={}",
            type.resourceName(),
            id,
            next,
            actor.name());
        break;
      default:
        break;
    }
  }

  /** Non-privileged actors may not ask for a restricted status. */
  private void requireAllowedToRequest(RecordStatus status, Actor actor) {
    if (statusPolicy.isRestricted(status) && !actor.isPrivileged()) {
      throw new PermissionDeniedException("superadminOnly");
    }
  }

  private <E extends ManagedRecord> void mirror(RecordType<E> type, E record) {
    if (!mirrorStore.isEnabled()) {
      return;
    }
    try {
      mirrorStore.upsert(type.tableName(), RecordFields.ID, type.toView(record));
    } catch (RuntimeException e) {
      log.warn(
          "Mirror write failed, flagging for re-sync: {} id={}",
          type.resourceName(),
          record.getId(),
          e);
      flagOutOfSync(type, record);
    }
  }

  private <E extends ManagedRecord> void flagOutOfSync(RecordType<E> type, E record) {
    try {
      recordStore.markOutOfSync(type, record.getId());
      record.setSyncFlag(1);
    } catch (DataAccessException e) {
      log.error(
          "Could not flag {} id={} for re-sync; mirror stays stale",
          type.resourceName(),
          record.getId(),
          e);
    }
  }

  /** Client-supplied detail; the change log inside it is server-owned and dropped. */
  private static Map<String, Object> clientDetail(Object raw) {
    var detail = new LinkedHashMap<String, Object>();
    if (raw instanceof Map<?, ?> map) {
      map.forEach((key, value) -> detail.put(String.valueOf(key), value));
    }
    detail.remove(ChangeLog.DETAIL_KEY);
    return detail;
  }

  private static Map<String, Object> withoutChangeLog(Map<String, Object> detail) {
    var copy = new LinkedHashMap<String, Object>(detail != null ? detail : Map.of());
    copy.remove(ChangeLog.DETAIL_KEY);
    return copy;
  }
}
