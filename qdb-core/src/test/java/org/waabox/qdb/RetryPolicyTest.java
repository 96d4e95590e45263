package org.waabox.qdb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RetryPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RetryPolicyTest {

  @Test
  void whenCreating_givenValidParams_shouldRetainValues() {
    final RetryPolicy policy = RetryPolicy.of(5, Duration.ofMillis(250));

    assertEquals(5, policy.maxAttempts());
    assertEquals(Duration.ofMillis(250), policy.backoff());
  }

  @Test
  void whenCreating_givenZeroAttempts_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(0, Duration.ofSeconds(1))
    );
  }

  @Test
  void whenCreating_givenNullBackoff_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        RetryPolicy.of(3, null)
    );
  }

  @Test
  void whenCreating_givenNegativeBackoff_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(3, Duration.ofSeconds(-5))
    );
  }

  @Test
  void whenCreating_givenZeroBackoff_shouldRetryImmediately() {
    final RetryPolicy policy = RetryPolicy.of(2, Duration.ZERO);

    assertEquals(Duration.ZERO, policy.backoff());
  }

  @Test
  void whenUsingDefault_shouldAllowThreeImmediateAttempts() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();

    assertEquals(3, policy.maxAttempts());
    assertEquals(Duration.ZERO, policy.backoff());
  }
}
