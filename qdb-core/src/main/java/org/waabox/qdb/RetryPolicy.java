package org.waabox.qdb;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how often a transport retries a request that the service
 * rejected as unauthenticated, and how long it waits in between.
 *
 * <p>Instances are created through static factory methods. The default
 * policy uses 3 attempts with no wait between them.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The maximum number of attempts. */
  private final int maxAttempts;

  /** The duration to wait between attempts. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param theMaxAttempts the maximum number of attempts
   * @param theBackoff     the duration to wait between attempts
   */
  private RetryPolicy(final int theMaxAttempts, final Duration theBackoff) {
    maxAttempts = theMaxAttempts;
    backoff = theBackoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param backoff     the duration to wait between attempts, never null,
   *                    never negative
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero, or backoff is negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts,
      final Duration backoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must not be negative, got: " + backoff);
    }
    return new RetryPolicy(maxAttempts, backoff);
  }

  /**
   * Creates a retry policy with the defaults: 3 attempts, no backoff.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, Duration.ZERO);
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the duration to wait between attempts.
   *
   * @return the backoff duration, never null
   */
  public Duration backoff() {
    return backoff;
  }
}
