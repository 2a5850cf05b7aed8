package io.b2mash.b2b.recordcore.changelog;

import io.b2mash.b2b.recordcore.security.Actor;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Decides which change-log stamps a write sets. */
@Component
public class ChangeLogTracker {

  private static final String STATUS_FIELD = "status";

  private final Clock clock;

  public ChangeLogTracker(Clock clock) {
    this.clock = clock;
  }

  public ChangeLog onCreate(Actor actor) {
    return onCreate(actor, Instant.now(clock));
  }

  public ChangeLog onCreate(Actor actor, Instant timestamp) {
    return new ChangeLog(format(timestamp), actor.name(), null, null, null, null);
  }

  public ChangeLog onMutate(
      ChangeLog existing, RecordStatus newStatus, Set<String> changedFields, Actor actor) {
    return onMutate(existing, newStatus, changedFields, actor, Instant.now(clock));
  }

  /**
   * Stamps {@code deleted*} when the status changed to {@link RecordStatus#DELETED}, {@code
   * updated*} when anything else changed, and returns {@code existing} untouched otherwise.
   */
  public ChangeLog onMutate(
      ChangeLog existing,
      RecordStatus newStatus,
      Set<String> changedFields,
      Actor actor,
      Instant timestamp) {
    var base = existing != null ? existing : ChangeLog.EMPTY;
    if (changedFields.contains(STATUS_FIELD) && newStatus == RecordStatus.DELETED) {
      return base.withDeleted(format(timestamp), actor.name());
    }
    if (!changedFields.isEmpty()) {
      return base.withUpdated(format(timestamp), actor.name());
    }
    return base;
  }

  public String now() {
    return format(Instant.now(clock));
  }

  static String format(Instant timestamp) {
    return DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.SECONDS));
  }
}
