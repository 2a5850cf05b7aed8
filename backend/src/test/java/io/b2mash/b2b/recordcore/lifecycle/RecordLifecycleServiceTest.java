package io.b2mash.b2b.recordcore.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.recordcore.changelog.ChangeLog;
import io.b2mash.b2b.recordcore.changelog.ChangeLogTracker;
import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import io.b2mash.b2b.recordcore.exception.DependencyBlockedException;
import io.b2mash.b2b.recordcore.exception.InvalidStatusTransitionException;
import io.b2mash.b2b.recordcore.exception.LockConflictException;
import io.b2mash.b2b.recordcore.exception.NoEffectiveChangeException;
import io.b2mash.b2b.recordcore.exception.PermissionDeniedException;
import io.b2mash.b2b.recordcore.exception.ResourceNotFoundException;
import io.b2mash.b2b.recordcore.exception.StorageFailureException;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.item.Item;
import io.b2mash.b2b.recordcore.item.ItemRecordType;
import io.b2mash.b2b.recordcore.record.Scenario;
import io.b2mash.b2b.recordcore.security.Actor;
import io.b2mash.b2b.recordcore.security.Roles;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import io.b2mash.b2b.recordcore.status.StatusTransitionPolicy;
import io.b2mash.b2b.recordcore.store.MirrorStore;
import io.b2mash.b2b.recordcore.store.RecordStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class RecordLifecycleServiceTest {

  private static final long ITEM_ID = 7L;
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @Mock private RecordStore recordStore;
  @Mock private MirrorStore mirrorStore;
  @Mock private DependencyGuard dependencyGuard;
  @Mock private PlatformTransactionManager txManager;

  private final ItemRecordType itemType = new ItemRecordType();
  private final Actor alice = Actor.of("alice");
  private final Actor admin = Actor.of("root", Roles.SUPERADMIN);

  private RecordLifecycleService service;

  @BeforeEach
  void setUp() {
    var policy =
        new StatusTransitionPolicy(new RecordCoreProperties.Status(null, null, null, null));
    var tracker = new ChangeLogTracker(Clock.fixed(NOW, ZoneOffset.UTC));
    service =
        new RecordLifecycleService(
            recordStore, mirrorStore, policy, tracker, dependencyGuard, txManager);
  }

  @Test
  void createDefaultsToDraftAndStampsCreator() {
    when(recordStore.insert(eq(itemType), any(Item.class)))
        .thenAnswer(
            invocation -> {
              Item item = invocation.getArgument(1);
              item.setLockVersion(1);
              return item;
            });

    RecordWriteResult result =
        service.create(itemType, Map.of("name", "<b>Widget</b>", "detail", Map.of("a", 1)), alice);

    assertThat(result.scenario()).isEqualTo(Scenario.CREATE);
    assertThat(result.record())
        .containsEntry("name", "Widget")
        .containsEntry("status", RecordStatus.DRAFT.code())
        .containsEntry("lockVersion", 1);
    Map<String, Object> detail = detailOf(result);
    assertThat(detail).containsEntry("a", 1);
    ChangeLog log = ChangeLog.fromDetail(detail);
    assertThat(log.createdBy()).isEqualTo("alice");
    assertThat(log.createdAt()).isEqualTo("2024-06-01T12:00:00Z");
    assertThat(log.updatedAt()).isNull();
  }

  @Test
  void createIgnoresClientSuppliedChangeLog() {
    when(recordStore.insert(eq(itemType), any(Item.class)))
        .thenAnswer(invocation -> invocation.getArgument(1));

    RecordWriteResult result =
        service.create(
            itemType,
            Map.of("name", "x", "detail", Map.of("changeLog", Map.of("createdBy", "mallory"))),
            alice);

    assertThat(ChangeLog.fromDetail(detailOf(result)).createdBy()).isEqualTo("alice");
  }

  @Test
  void createWithRestrictedStatusNeedsPrivilege() {
    assertThatThrownBy(
            () -> service.create(itemType, Map.of("name", "x", "status", 3), alice))
        .isInstanceOfSatisfying(
            PermissionDeniedException.class,
            ex -> assertThat(ex.getMessageKey()).isEqualTo("superadminOnly"));
    verify(recordStore, never()).insert(any(), any());
  }

  @Test
  void createStorageErrorBecomesStorageFailure() {
    when(recordStore.insert(eq(itemType), any(Item.class)))
        .thenThrow(new DataIntegrityViolationException("constraint"));

    assertThatThrownBy(() -> service.create(itemType, Map.of("name", "x"), alice))
        .isInstanceOfSatisfying(
            StorageFailureException.class,
            ex -> assertThat(ex.getMessageKey()).isEqualTo("createRecordFailed"));
  }

  @Test
  void updateOfMissingRecordIsNotFound() {
    when(recordStore.findById(itemType, ITEM_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.update(itemType, Map.of("id", ITEM_ID, "lockVersion", 1), alice))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void staleLockVersionIsRejectedBeforeWriting() {
    givenStored(item("Widget", RecordStatus.DRAFT, 3));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "name", "New"), alice))
        .isInstanceOf(LockConflictException.class);
    verify(recordStore, never()).update(any(), any(), anyInt());
  }

  @Test
  void updateWritesWithExpectedVersionAndStampsUpdater() {
    givenStored(item("Widget", RecordStatus.DRAFT, 3));
    givenUpdateSucceeds(3);

    RecordWriteResult result =
        service.update(
            itemType,
            Map.of("id", ITEM_ID, "lockVersion", 3, "name", "Gadget", "status", 1),
            alice);

    assertThat(result.record())
        .containsEntry("name", "Gadget")
        .containsEntry("status", RecordStatus.ACTIVE.code())
        .containsEntry("lockVersion", 4);
    ChangeLog log = ChangeLog.fromDetail(detailOf(result));
    assertThat(log.createdBy()).isEqualTo("creator");
    assertThat(log.updatedBy()).isEqualTo("alice");
    assertThat(log.updatedAt()).isEqualTo("2024-06-01T12:00:00Z");
    verify(dependencyGuard)
        .check(itemType, ITEM_ID, Set.of("status", "name"), RecordStatus.ACTIVE);
  }

  @Test
  void completedCannotReturnToDraft() {
    givenStored(item("Widget", RecordStatus.COMPLETED, 2));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "status", 2), admin))
        .isInstanceOfSatisfying(
            InvalidStatusTransitionException.class,
            ex -> {
              assertThat(ex.getFrom()).isEqualTo(RecordStatus.COMPLETED);
              assertThat(ex.getTo()).isEqualTo(RecordStatus.DRAFT);
              assertThat(ex.getViolations())
                  .singleElement()
                  .satisfies(v -> assertThat(v.messageKey()).isEqualTo("cannotChangeStatus"));
            });
  }

  @Test
  void invalidTransitionIsReportedBeforeStaleLock() {
    givenStored(item("Widget", RecordStatus.ACTIVE, 5));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 1, "status", 2), alice))
        .isInstanceOf(InvalidStatusTransitionException.class);
  }

  @Test
  void nonPrivilegedActorCannotRevive() {
    givenStored(item("Widget", RecordStatus.DELETED, 4));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 4, "status", 1), alice))
        .isInstanceOfSatisfying(
            PermissionDeniedException.class,
            ex -> {
              assertThat(ex.getMessageKey()).isEqualTo("deletedStatusChanged");
              assertThat(ex.getMessageArgs()).containsEntry("value", "Deleted");
            });
  }

  @Test
  void privilegedActorCanRevive() {
    givenStored(item("Widget", RecordStatus.DELETED, 4));
    givenUpdateSucceeds(4);

    RecordWriteResult result =
        service.update(itemType, Map.of("id", ITEM_ID, "lockVersion", 4, "status", 1), admin);

    assertThat(result.record()).containsEntry("status", RecordStatus.ACTIVE.code());
  }

  @Test
  void nonPrivilegedActorCannotRequestCompleted() {
    givenStored(item("Widget", RecordStatus.ACTIVE, 1));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 1, "status", 3), alice))
        .isInstanceOfSatisfying(
            PermissionDeniedException.class,
            ex -> assertThat(ex.getMessageKey()).isEqualTo("superadminOnly"));
  }

  @Test
  void unchangedUpdateIsNoEffectiveChange() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType,
                    Map.of("id", ITEM_ID, "lockVersion", 2, "name", "Widget", "status", 2),
                    alice))
        .isInstanceOfSatisfying(
            NoEffectiveChangeException.class,
            ex -> assertThat(ex.getMessageKey()).isEqualTo("noRecordUpdated"));
    verify(recordStore, never()).update(any(), any(), anyInt());
  }

  @Test
  void detailWithSameContentIsNotAChange() {
    Item stored = item("Widget", RecordStatus.DRAFT, 2);
    stored.setDetail(Map.of("color", "red"));
    stored.setChangeLog(new ChangeLog("2024-01-01T00:00:00Z", "creator", null, null, null, null));
    givenStored(stored);

    assertThatThrownBy(
            () ->
                service.update(
                    itemType,
                    Map.of("id", ITEM_ID, "lockVersion", 2, "detail", Map.of("color", "red")),
                    alice))
        .isInstanceOf(NoEffectiveChangeException.class);
  }

  @Test
  void deleteIsSoftAndStampsDeleter() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));
    givenUpdateSucceeds(2);

    RecordWriteResult result =
        service.delete(itemType, Map.of("id", ITEM_ID, "lockVersion", 2), alice);

    assertThat(result.scenario()).isEqualTo(Scenario.DELETE);
    assertThat(result.record()).containsEntry("status", RecordStatus.DELETED.code());
    ChangeLog log = ChangeLog.fromDetail(detailOf(result));
    assertThat(log.deletedBy()).isEqualTo("alice");
    assertThat(log.updatedBy()).isNull();
  }

  @Test
  void deletingTwiceIsNoEffectiveChange() {
    givenStored(item("Widget", RecordStatus.DELETED, 3));

    assertThatThrownBy(
            () -> service.delete(itemType, Map.of("id", ITEM_ID, "lockVersion", 3), alice))
        .isInstanceOfSatisfying(
            NoEffectiveChangeException.class,
            ex -> assertThat(ex.getMessageKey()).isEqualTo("noRecordDeleted"));
  }

  @Test
  void deleteOfCompletedRecordIsAnInvalidTransition() {
    givenStored(item("Widget", RecordStatus.COMPLETED, 3));

    assertThatThrownBy(
            () -> service.delete(itemType, Map.of("id", ITEM_ID, "lockVersion", 3), admin))
        .isInstanceOf(InvalidStatusTransitionException.class);
  }

  @Test
  void dependencyGuardFailureAbortsTheWrite() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));
    doThrow(new DependencyBlockedException("item_links", List.of()))
        .when(dependencyGuard)
        .check(itemType, ITEM_ID, Set.of("name"), RecordStatus.DRAFT);

    assertThatThrownBy(
            () ->
                service.update(
                    itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "name", "Other"), alice))
        .isInstanceOf(DependencyBlockedException.class);
    verify(recordStore, never()).update(any(), any(), anyInt());
  }

  @Test
  void invalidValueIsReportedAfterLockCheck() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));

    assertThatThrownBy(
            () ->
                service.update(
                    itemType,
                    Map.of("id", ITEM_ID, "lockVersion", 2, "name", "x".repeat(300)),
                    alice))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void mirrorFailureFlagsRecordButRequestSucceeds() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));
    givenUpdateSucceeds(2);
    when(mirrorStore.isEnabled()).thenReturn(true);
    doThrow(new IllegalStateException("mongo down"))
        .when(mirrorStore)
        .upsert(eq("items"), eq("id"), anyMap());

    RecordWriteResult result =
        service.update(itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "name", "New"), alice);

    assertThat(result.record()).containsEntry("name", "New");
    verify(recordStore).markOutOfSync(itemType, ITEM_ID);
  }

  @Test
  void failedFlaggingIsLoggedNotThrown() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));
    givenUpdateSucceeds(2);
    when(mirrorStore.isEnabled()).thenReturn(true);
    doThrow(new IllegalStateException("mongo down"))
        .when(mirrorStore)
        .upsert(anyString(), anyString(), anyMap());
    doThrow(new QueryTimeoutException("db down"))
        .when(recordStore)
        .markOutOfSync(itemType, ITEM_ID);

    RecordWriteResult result =
        service.update(itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "name", "New"), alice);

    assertThat(result.record()).containsEntry("name", "New");
  }

  @Test
  void enabledMirrorReceivesTheStoredView() {
    givenStored(item("Widget", RecordStatus.DRAFT, 2));
    givenUpdateSucceeds(2);
    when(mirrorStore.isEnabled()).thenReturn(true);

    service.update(itemType, Map.of("id", ITEM_ID, "lockVersion", 2, "name", "New"), alice);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> document = ArgumentCaptor.forClass(Map.class);
    verify(mirrorStore).upsert(eq("items"), eq("id"), document.capture());
    assertThat(document.getValue())
        .containsEntry("id", ITEM_ID)
        .containsEntry("lockVersion", 3)
        .doesNotContainKey("syncFlag");
  }

  private Item item(String name, RecordStatus status, int lockVersion) {
    var item = new Item(name);
    ReflectionTestUtils.setField(item, "id", ITEM_ID);
    item.setStatus(status);
    item.setLockVersion(lockVersion);
    item.setChangeLog(new ChangeLog("2024-01-01T00:00:00Z", "creator", null, null, null, null));
    return item;
  }

  private void givenStored(Item item) {
    when(recordStore.findById(itemType, ITEM_ID)).thenReturn(Optional.of(item));
  }

  private void givenUpdateSucceeds(int expectedVersion) {
    when(recordStore.update(eq(itemType), any(Item.class), eq(expectedVersion)))
        .thenAnswer(
            invocation -> {
              Item item = invocation.getArgument(1);
              item.setLockVersion(expectedVersion + 1);
              return item;
            });
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> detailOf(RecordWriteResult result) {
    return (Map<String, Object>) result.record().get("detail");
  }
}
