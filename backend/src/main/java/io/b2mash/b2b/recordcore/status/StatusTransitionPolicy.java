package io.b2mash.b2b.recordcore.status;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a record may move from one status to another. The successor table is
 * configuration ({@code recordcore.status.transitions}); this class only reads it.
 */
@Component
public class StatusTransitionPolicy {

  private static final Logger log = LoggerFactory.getLogger(StatusTransitionPolicy.class);

  private final Map<RecordStatus, Set<RecordStatus>> transitions;
  private final Set<RecordStatus> restricted;
  private final Set<RecordStatus> disallowedUpdate;
  private final Set<RecordStatus> revivalTargets;

  @Autowired
  public StatusTransitionPolicy(RecordCoreProperties properties) {
    this(properties.status());
  }

  public StatusTransitionPolicy(RecordCoreProperties.Status config) {
    this.transitions = new EnumMap<>(RecordStatus.class);
    config.transitions().forEach((from, to) -> transitions.put(from, copyOf(to)));
    this.restricted = copyOf(config.restricted());
    this.disallowedUpdate = copyOf(config.disallowedUpdate());
    this.revivalTargets = copyOf(config.revivalTargets());
    validateTable();
    log.info(
        "Status transition table loaded: statuses={}, restricted={}, terminal={}",
        transitions.keySet(),
        restricted,
        disallowedUpdate);
  }

  /** Returns true if the change is allowed. */
  public boolean canTransition(RecordStatus current, RecordStatus next, boolean privileged) {
    return evaluate(current, next, privileged).isAllowed();
  }

  /** Evaluates a proposed change without side effects. */
  public TransitionVerdict evaluate(RecordStatus current, RecordStatus next, boolean privileged) {
    if (current == next) {
      return TransitionVerdict.NO_OP;
    }
    if (current == RecordStatus.DELETED) {
      boolean openTarget = revivalTargets.isEmpty() || revivalTargets.contains(next);
      return privileged && openTarget
          ? TransitionVerdict.PRIVILEGED_REVIVAL
          : TransitionVerdict.REVIVAL_DENIED;
    }
    Set<RecordStatus> successors = transitions.get(current);
    if (successors == null) {
      return TransitionVerdict.UNKNOWN_CURRENT;
    }
    return successors.contains(next) ? TransitionVerdict.ALLOWED : TransitionVerdict.NOT_PERMITTED;
  }

  /** Returns true if only a privileged actor may request this status. */
  public boolean isRestricted(RecordStatus status) {
    return restricted.contains(status);
  }

  /** Returns true if records in this status can no longer be updated. */
  public boolean isDisallowedUpdate(RecordStatus status) {
    return disallowedUpdate.contains(status);
  }

  /** Returns the configured successors of a status, empty if it has no entry. */
  public Set<RecordStatus> successorsOf(RecordStatus status) {
    return transitions.getOrDefault(status, Set.of());
  }

  // Every successor must either have its own entry or be declared terminal, otherwise a record
  // could reach a status with no defined exit.
  private void validateTable() {
    if (transitions.isEmpty()) {
      throw new IllegalStateException("recordcore.status.transitions must not be empty");
    }
    List<String> dangling = new ArrayList<>();
    transitions.forEach(
        (from, successors) -> {
          for (RecordStatus to : successors) {
            if (!transitions.containsKey(to) && !disallowedUpdate.contains(to)) {
              dangling.add(from + "->" + to);
            }
          }
        });
    if (!dangling.isEmpty()) {
      throw new IllegalStateException(
          "Status transition table is incomplete; targets without an entry and not terminal: "
              + dangling);
    }
  }

  private static Set<RecordStatus> copyOf(Set<RecordStatus> statuses) {
    return statuses == null || statuses.isEmpty()
        ? EnumSet.noneOf(RecordStatus.class)
        : EnumSet.copyOf(statuses);
  }
}
