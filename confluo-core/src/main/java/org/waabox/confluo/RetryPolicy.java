package org.waabox.confluo;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the exponential backoff applied when a batch delivery fails or a
 * change stream must be reopened.
 *
 * <p>The delay before retry number {@code n} (starting at 1) is
 * {@code baseBackoff * 2^n}, capped at {@code maxBackoff}. The default
 * policy uses a 1-second base, which yields 2, 4 and 8 seconds for the first
 * three retries, and a 5-minute cap.
 *
 * <p>How many retries a batch gets is decided per subscription through
 * {@link SubscriptionOptions#maxRetries()}.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default base backoff. */
  private static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);

  /** The default backoff cap. */
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(5);

  /** Doubling past this exponent always overflows the cap. */
  private static final int MAX_EXPONENT = 30;

  /** The backoff unit that gets doubled on every retry. */
  private final Duration baseBackoff;

  /** The upper bound of any computed backoff. */
  private final Duration maxBackoff;

  /**
   * Creates a new retry policy.
   *
   * @param theBaseBackoff the base backoff, never null
   * @param theMaxBackoff  the backoff cap, never null
   */
  private RetryPolicy(final Duration theBaseBackoff,
      final Duration theMaxBackoff) {
    baseBackoff = theBaseBackoff;
    maxBackoff = theMaxBackoff;
  }

  /**
   * Creates a retry policy with the given base and the default cap.
   *
   * @param baseBackoff the base backoff, must be positive
   *
   * @return a new retry policy, never null
   *
   * @throws NullPointerException     if baseBackoff is null
   * @throws IllegalArgumentException if baseBackoff is zero or negative
   */
  public static RetryPolicy of(final Duration baseBackoff) {
    Objects.requireNonNull(baseBackoff, "baseBackoff must not be null");
    final Duration cap = baseBackoff.compareTo(DEFAULT_MAX_BACKOFF) > 0
        ? baseBackoff : DEFAULT_MAX_BACKOFF;
    return of(baseBackoff, cap);
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param baseBackoff the base backoff, must be positive
   * @param maxBackoff  the backoff cap, must not be lower than baseBackoff
   *
   * @return a new retry policy, never null
   *
   * @throws NullPointerException     if any argument is null
   * @throws IllegalArgumentException if baseBackoff is not positive or
   *                                  maxBackoff is lower than baseBackoff
   */
  public static RetryPolicy of(final Duration baseBackoff,
      final Duration maxBackoff) {
    Objects.requireNonNull(baseBackoff, "baseBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (baseBackoff.isZero() || baseBackoff.isNegative()) {
      throw new IllegalArgumentException(
          "baseBackoff must be positive, got: " + baseBackoff);
    }
    if (maxBackoff.compareTo(baseBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff " + maxBackoff
          + " must not be lower than baseBackoff " + baseBackoff);
    }
    return new RetryPolicy(baseBackoff, maxBackoff);
  }

  /**
   * Creates a retry policy with a 1-second base and a 5-minute cap.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_BASE_BACKOFF, DEFAULT_MAX_BACKOFF);
  }

  /**
   * Computes the delay before the given retry.
   *
   * @param retry the retry number, starting at 1
   *
   * @return the delay, never null and never above {@link #maxBackoff()}
   *
   * @throws IllegalArgumentException if retry is lower than 1
   */
  public Duration backoffFor(final int retry) {
    if (retry < 1) {
      throw new IllegalArgumentException(
          "retry must be greater than 0, got: " + retry);
    }
    if (retry > MAX_EXPONENT) {
      return maxBackoff;
    }
    final long factor = 1L << retry;
    final long baseMillis = baseBackoff.toMillis();
    if (baseMillis > maxBackoff.toMillis() / factor) {
      return maxBackoff;
    }
    return Duration.ofMillis(baseMillis * factor);
  }

  /**
   * Returns the backoff unit that gets doubled on every retry.
   *
   * @return the base backoff, never null
   */
  public Duration baseBackoff() {
    return baseBackoff;
  }

  /**
   * Returns the upper bound of any computed backoff.
   *
   * @return the backoff cap, never null
   */
  public Duration maxBackoff() {
    return maxBackoff;
  }
}
