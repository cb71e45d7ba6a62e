package org.waabox.confluo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.confluo.metrics.ConfluoMetrics;

/**
 * Isolates failing sources through a per-source consecutive failure count.
 *
 * <p>When a source reaches {@link CircuitBreakerPolicy#errorThreshold()}
 * consecutive failures its circuit opens: {@link #allows(String)} returns
 * false until {@link CircuitBreakerPolicy#coolDown()} elapses, at which
 * point the count goes back to zero and the circuit closes again. A success
 * resets the count right away.
 *
 * <p>The cool-down is evaluated lazily against the clock, so no timer is
 * held per source. Thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CircuitBreaker {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CircuitBreaker.class);

  /** What this breaker guards, used in log messages. */
  private final String name;

  /** The thresholds. */
  private final CircuitBreakerPolicy policy;

  /** The clock the cool-down is measured with. */
  private final Clock clock;

  /** The metrics reporter. */
  private final ConfluoMetrics metrics;

  /** The failure state of each source with at least one failure. */
  private final Map<String, State> states = new ConcurrentHashMap<>();

  /**
   * Creates a new circuit breaker.
   *
   * @param theName    what the breaker guards, never null
   * @param thePolicy  the thresholds, never null
   * @param theClock   the clock, never null
   * @param theMetrics the metrics reporter, never null
   */
  CircuitBreaker(final String theName, final CircuitBreakerPolicy thePolicy,
      final Clock theClock, final ConfluoMetrics theMetrics) {
    name = Objects.requireNonNull(theName, "name must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Tells whether work for the source may proceed. Closes the circuit when
   * its cool-down has elapsed.
   *
   * @param source the source, never null
   *
   * @return false while the circuit of the source is open
   */
  boolean allows(final String source) {
    final State state = states.computeIfPresent(source,
        (key, current) -> current.expired(clock.instant()) ? null : current);
    return state == null || state.openedAt == null;
  }

  /**
   * Records a failure of the source.
   *
   * @param source the source, never null
   *
   * @return true if this failure opened the circuit
   */
  boolean recordFailure(final String source) {
    final Instant now = clock.instant();
    final AtomicBoolean opened = new AtomicBoolean(false);
    final State state = states.compute(source, (key, current) -> {
      final State base = current == null || current.expired(now)
          ? new State(0, null) : current;
      final int failures = base.failures + 1;
      if (base.openedAt == null && failures >= policy.errorThreshold()) {
        opened.set(true);
        return new State(failures, now);
      }
      return new State(failures, base.openedAt);
    });
    if (opened.get()) {
      log.warn("Circuit '{}' opened for source '{}' after {} consecutive"
          + " failures, cooling down for {}", name, source, state.failures,
          policy.coolDown());
      metrics.circuitOpened(source);
    }
    return opened.get();
  }

  /**
   * Records a success of the source, resetting its failure count.
   *
   * @param source the source, never null
   */
  void recordSuccess(final String source) {
    states.remove(source);
  }

  /**
   * Forgets everything about the source.
   *
   * @param source the source, never null
   */
  void reset(final String source) {
    states.remove(source);
  }

  /**
   * Returns the consecutive failures recorded for the source.
   *
   * @param source the source, never null
   *
   * @return the failure count, zero when unknown or cooled down
   */
  int failures(final String source) {
    final State state = states.get(source);
    if (state == null || state.expired(clock.instant())) {
      return 0;
    }
    return state.failures;
  }

  /**
   * Returns how long the circuit of the source stays open.
   *
   * @param source the source, never null
   *
   * @return the remaining cool-down, zero when the circuit is closed
   */
  Duration retryAfter(final String source) {
    final State state = states.get(source);
    if (state == null || state.openedAt == null) {
      return Duration.ZERO;
    }
    final Duration remaining = Duration.between(clock.instant(),
        state.openedAt.plus(policy.coolDown()));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Counts the sources whose circuit is currently open.
   *
   * @return the open circuits
   */
  int openCircuits() {
    final Instant now = clock.instant();
    int open = 0;
    for (final State state : states.values()) {
      if (state.openedAt != null && !state.expired(now)) {
        open++;
      }
    }
    return open;
  }

  /** Forgets every source. */
  void clear() {
    states.clear();
  }

  /** The immutable failure state of one source. */
  private final class State {

    /** The consecutive failures. */
    private final int failures;

    /** When the circuit opened, null while closed. */
    private final Instant openedAt;

    private State(final int theFailures, final Instant theOpenedAt) {
      failures = theFailures;
      openedAt = theOpenedAt;
    }

    private boolean expired(final Instant now) {
      return openedAt != null
          && !now.isBefore(openedAt.plus(policy.coolDown()));
    }
  }
}
