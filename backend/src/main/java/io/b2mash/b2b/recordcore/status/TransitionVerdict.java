package io.b2mash.b2b.recordcore.status;

/** Outcome of evaluating a proposed status change. */
public enum TransitionVerdict {
  NO_OP(true),
  ALLOWED(true),
  PRIVILEGED_REVIVAL(true),
  /** Leaving DELETED without the privilege (or into a status not open for revival). */
  REVIVAL_DENIED(false),
  /** The target is not a registered successor of the current status. */
  NOT_PERMITTED(false),
  /** The current status has no entry in the transition table. */
  UNKNOWN_CURRENT(false);

  private final boolean allowed;

  TransitionVerdict(boolean allowed) {
    this.allowed = allowed;
  }

  public boolean isAllowed() {
    return allowed;
  }
}
