package org.waabox.confluo;

import java.time.Duration;
import java.util.Objects;

/**
 * Configures how the pool coalesces changes into batch deliveries.
 *
 * <p>Defaults:
 * <ul>
 *   <li>batchSize: 50 changes, a full group flushes right away</li>
 *   <li>throttle: 50 ms minimum between two flushes of the same source</li>
 *   <li>completedRetention: 1 second a delivered group is kept before it is
 *       reaped</li>
 *   <li>staleAge: 10 minutes after which a completed group is swept
 *       regardless</li>
 *   <li>sweepInterval: 5 minutes between sweeps</li>
 * </ul>
 *
 * <p>The debounce quiet period is a per subscription setting, see
 * {@link SubscriptionOptions#debounce()}.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BatchPolicy {

  /** The maximum number of changes in one batch. */
  private final int batchSize;

  /** The minimum interval between two flushes of the same source. */
  private final Duration throttle;

  /** How long a delivered group is kept before it is reaped. */
  private final Duration completedRetention;

  /** The age after which a completed group is swept. */
  private final Duration staleAge;

  /** The interval between two sweeps. */
  private final Duration sweepInterval;

  private BatchPolicy(final Builder builder) {
    batchSize = builder.batchSize;
    throttle = builder.throttle;
    completedRetention = builder.completedRetention;
    staleAge = builder.staleAge;
    sweepInterval = builder.sweepInterval;
  }

  /**
   * Creates the default batch policy.
   *
   * @return the default policy, never null
   */
  public static BatchPolicy defaultPolicy() {
    return builder().build();
  }

  /**
   * Creates a builder initialized with the defaults.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the maximum number of changes in one batch.
   *
   * @return the batch size, always greater than zero
   */
  public int batchSize() {
    return batchSize;
  }

  /**
   * Returns the minimum interval between two flushes of the same source.
   *
   * @return the throttle, never null, may be zero
   */
  public Duration throttle() {
    return throttle;
  }

  /**
   * Returns how long a delivered group is kept before it is reaped.
   *
   * @return the retention, never null
   */
  public Duration completedRetention() {
    return completedRetention;
  }

  /**
   * Returns the age after which a completed or failed group is swept.
   *
   * @return the stale age, never null
   */
  public Duration staleAge() {
    return staleAge;
  }

  /**
   * Returns the interval between two sweeps of stale groups.
   *
   * @return the sweep interval, never null
   */
  public Duration sweepInterval() {
    return sweepInterval;
  }

  /** A builder of {@link BatchPolicy} instances. */
  public static final class Builder {

    /** The maximum number of changes in one batch. */
    private int batchSize = 50;

    /** The minimum interval between two flushes of the same source. */
    private Duration throttle = Duration.ofMillis(50);

    /** How long a delivered group is kept. */
    private Duration completedRetention = Duration.ofSeconds(1);

    /** The age after which a completed group is swept. */
    private Duration staleAge = Duration.ofMinutes(10);

    /** The interval between two sweeps. */
    private Duration sweepInterval = Duration.ofMinutes(5);

    private Builder() {
    }

    /**
     * Sets the maximum number of changes in one batch.
     *
     * @param theBatchSize the batch size, must be greater than zero
     *
     * @return this builder for chaining, never null
     */
    public Builder batchSize(final int theBatchSize) {
      if (theBatchSize <= 0) {
        throw new IllegalArgumentException(
            "batchSize must be greater than 0, got: " + theBatchSize);
      }
      batchSize = theBatchSize;
      return this;
    }

    /**
     * Sets the minimum interval between two flushes of the same source.
     *
     * @param theThrottle the throttle, zero disables it, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder throttle(final Duration theThrottle) {
      throttle = requireNotNegative(theThrottle, "throttle");
      return this;
    }

    /**
     * Sets how long a delivered group is kept before it is reaped.
     *
     * @param theRetention the retention, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder completedRetention(final Duration theRetention) {
      completedRetention = requireNotNegative(theRetention,
          "completedRetention");
      return this;
    }

    /**
     * Sets the age after which a completed group is swept.
     *
     * @param theStaleAge the stale age, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder staleAge(final Duration theStaleAge) {
      staleAge = requireNotNegative(theStaleAge, "staleAge");
      return this;
    }

    /**
     * Sets the interval between two sweeps of stale groups.
     *
     * @param theSweepInterval the interval, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder sweepInterval(final Duration theSweepInterval) {
      requireNotNegative(theSweepInterval, "sweepInterval");
      if (theSweepInterval.isZero()) {
        throw new IllegalArgumentException("sweepInterval must be positive");
      }
      sweepInterval = theSweepInterval;
      return this;
    }

    /**
     * Builds the policy.
     *
     * @return a new policy, never null
     */
    public BatchPolicy build() {
      return new BatchPolicy(this);
    }

    private static Duration requireNotNegative(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isNegative()) {
        throw new IllegalArgumentException(
            name + " must not be negative, got: " + value);
      }
      return value;
    }
  }
}
