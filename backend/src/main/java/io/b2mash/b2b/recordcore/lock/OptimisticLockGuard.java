package io.b2mash.b2b.recordcore.lock;

import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.LockConflictException;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;

/**
 * Pre-check of the caller's {@code lockVersion} against the stored one. The increment itself is
 * done by the store's compare-and-swap write.
 */
public final class OptimisticLockGuard {

  public static final String FIELD = "lockVersion";

  private OptimisticLockGuard() {}

  /**
   * @throws ValidationFailedException if {@code supplied} is missing
   * @throws LockConflictException if {@code supplied} differs from {@code stored}
   */
  public static void checkVersion(int stored, Integer supplied) {
    if (supplied == null) {
      throw ValidationFailedException.of(FieldViolation.of(FIELD, "required"));
    }
    if (stored != supplied) {
      throw new LockConflictException();
    }
  }
}
