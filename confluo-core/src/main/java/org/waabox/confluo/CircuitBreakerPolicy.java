package org.waabox.confluo;

import java.time.Duration;
import java.util.Objects;

/**
 * Configures the per-source circuit breaker.
 *
 * <p>After {@code errorThreshold} consecutive failures of a source, its
 * circuit opens and updates for it are dropped until {@code coolDown}
 * elapses. Defaults: 5 failures, 60 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CircuitBreakerPolicy {

  /** The default consecutive failure threshold. */
  private static final int DEFAULT_ERROR_THRESHOLD = 5;

  /** The default cool-down. */
  private static final Duration DEFAULT_COOL_DOWN = Duration.ofSeconds(60);

  /** The consecutive failures that open the circuit. */
  private final int errorThreshold;

  /** How long an open circuit stays open. */
  private final Duration coolDown;

  private CircuitBreakerPolicy(final int theErrorThreshold,
      final Duration theCoolDown) {
    errorThreshold = theErrorThreshold;
    coolDown = theCoolDown;
  }

  /**
   * Creates a circuit breaker policy.
   *
   * @param errorThreshold the consecutive failures that open the circuit,
   *                       must be greater than zero
   * @param coolDown       how long an open circuit stays open, must be
   *                       positive
   *
   * @return a new policy, never null
   *
   * @throws NullPointerException     if coolDown is null
   * @throws IllegalArgumentException if any value is out of range
   */
  public static CircuitBreakerPolicy of(final int errorThreshold,
      final Duration coolDown) {
    if (errorThreshold <= 0) {
      throw new IllegalArgumentException(
          "errorThreshold must be greater than 0, got: " + errorThreshold);
    }
    Objects.requireNonNull(coolDown, "coolDown must not be null");
    if (coolDown.isZero() || coolDown.isNegative()) {
      throw new IllegalArgumentException(
          "coolDown must be positive, got: " + coolDown);
    }
    return new CircuitBreakerPolicy(errorThreshold, coolDown);
  }

  /**
   * Creates the default policy: 5 failures, 60 seconds cool-down.
   *
   * @return the default policy, never null
   */
  public static CircuitBreakerPolicy defaultPolicy() {
    return new CircuitBreakerPolicy(DEFAULT_ERROR_THRESHOLD,
        DEFAULT_COOL_DOWN);
  }

  /**
   * Returns the consecutive failures that open the circuit.
   *
   * @return the threshold, always greater than zero
   */
  public int errorThreshold() {
    return errorThreshold;
  }

  /**
   * Returns how long an open circuit stays open.
   *
   * @return the cool-down, never null
   */
  public Duration coolDown() {
    return coolDown;
  }
}
