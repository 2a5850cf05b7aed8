package io.b2mash.b2b.recordcore.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.recordcore.exception.ErrorKind;
import io.b2mash.b2b.recordcore.exception.LockConflictException;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

class OptimisticLockGuardTest {

  @Test
  void matchingVersionPasses() {
    assertThatCode(() -> OptimisticLockGuard.checkVersion(3, 3)).doesNotThrowAnyException();
  }

  @Test
  void staleVersionIsALockConflict() {
    assertThatThrownBy(() -> OptimisticLockGuard.checkVersion(3, 2))
        .isInstanceOfSatisfying(
            LockConflictException.class,
            ex -> {
              assertThat(ex.getKind()).isEqualTo(ErrorKind.LOCK_CONFLICT);
              assertThat(ex.getMessageKey()).isEqualTo("lockVersionOutdated");
            });
  }

  @Test
  void newerVersionIsAlsoALockConflict() {
    assertThatThrownBy(() -> OptimisticLockGuard.checkVersion(3, 4))
        .isInstanceOf(LockConflictException.class);
  }

  @Test
  void missingVersionIsAValidationError() {
    assertThatThrownBy(() -> OptimisticLockGuard.checkVersion(1, null))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            ex ->
                assertThat(ex.getViolations())
                    .singleElement()
                    .satisfies(
                        v -> {
                          assertThat(v.field()).isEqualTo("lockVersion");
                          assertThat(v.messageKey()).isEqualTo("required");
                        }));
  }
}
