package org.waabox.confluo;

import java.time.Duration;
import java.util.Objects;

/**
 * The settings of one subscription.
 *
 * <p>Options are resolved once, when the subscription is created, and never
 * change afterwards. Defaults:
 * <ul>
 *   <li>targetedQuery: {@code true}. Informational, whether the query is
 *       narrow; reported through {@link SubscriptionInfo}.</li>
 *   <li>batchUpdates: {@code true}. Changes are coalesced into batch
 *       deliveries; when false each change is delivered right away.</li>
 *   <li>debounce: 100 ms of quiet before a batch flushes.</li>
 *   <li>maxRetries: 3 redeliveries of a batch the listener rejected.</li>
 *   <li>cleanupTimeout: 5 minutes after which a subscription that was
 *       neither removed nor renewed is removed by the pool.</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionOptions {

  /** The options every builder starts from. */
  private static final SubscriptionOptions DEFAULTS = new Builder().build();

  /** Whether the query targets a narrow subset of the data. */
  private final boolean targetedQuery;

  /** Whether changes go through the batch aggregator. */
  private final boolean batchUpdates;

  /** The quiet period before a batch flushes. */
  private final Duration debounce;

  /** The redeliveries a rejected batch gets. */
  private final int maxRetries;

  /** The idle time after which the pool removes the subscription. */
  private final Duration cleanupTimeout;

  private SubscriptionOptions(final Builder builder) {
    targetedQuery = builder.targetedQuery;
    batchUpdates = builder.batchUpdates;
    debounce = builder.debounce;
    maxRetries = builder.maxRetries;
    cleanupTimeout = builder.cleanupTimeout;
  }

  /**
   * Returns the default options.
   *
   * @return the defaults, never null
   */
  public static SubscriptionOptions defaults() {
    return DEFAULTS;
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
   * Creates a builder initialized with these options.
   *
   * @return a new builder, never null
   */
  public Builder toBuilder() {
    return new Builder()
        .targetedQuery(targetedQuery)
        .batchUpdates(batchUpdates)
        .debounce(debounce)
        .maxRetries(maxRetries)
        .cleanupTimeout(cleanupTimeout);
  }

  /**
   * Tells whether the query targets a narrow subset of the data.
   *
   * @return true for targeted queries
   */
  public boolean targetedQuery() {
    return targetedQuery;
  }

  /**
   * Tells whether changes are coalesced into batch deliveries.
   *
   * @return true if changes are batched
   */
  public boolean batchUpdates() {
    return batchUpdates;
  }

  /**
   * Returns the quiet period before a batch flushes.
   *
   * @return the debounce, never null
   */
  public Duration debounce() {
    return debounce;
  }

  /**
   * Returns how many times a rejected batch is redelivered.
   *
   * @return the maximum retries, zero or more
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the idle time after which the pool removes the subscription.
   *
   * @return the cleanup timeout, never null
   */
  public Duration cleanupTimeout() {
    return cleanupTimeout;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SubscriptionOptions)) {
      return false;
    }
    final SubscriptionOptions that = (SubscriptionOptions) other;
    return targetedQuery == that.targetedQuery
        && batchUpdates == that.batchUpdates
        && maxRetries == that.maxRetries
        && debounce.equals(that.debounce)
        && cleanupTimeout.equals(that.cleanupTimeout);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(targetedQuery, batchUpdates, debounce, maxRetries,
        cleanupTimeout);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "SubscriptionOptions{targetedQuery=" + targetedQuery
        + ", batchUpdates=" + batchUpdates
        + ", debounce=" + debounce
        + ", maxRetries=" + maxRetries
        + ", cleanupTimeout=" + cleanupTimeout + "}";
  }

  /** A builder of {@link SubscriptionOptions}. */
  public static final class Builder {

    /** Whether the query is targeted. */
    private boolean targetedQuery = true;

    /** Whether changes are batched. */
    private boolean batchUpdates = true;

    /** The debounce. */
    private Duration debounce = Duration.ofMillis(100);

    /** The maximum retries. */
    private int maxRetries = 3;

    /** The cleanup timeout. */
    private Duration cleanupTimeout = Duration.ofMinutes(5);

    private Builder() {
    }

    /**
     * Sets whether the query targets a narrow subset of the data.
     *
     * @param value the flag
     *
     * @return this builder for chaining, never null
     */
    public Builder targetedQuery(final boolean value) {
      targetedQuery = value;
      return this;
    }

    /**
     * Sets whether changes are coalesced into batch deliveries.
     *
     * @param value the flag
     *
     * @return this builder for chaining, never null
     */
    public Builder batchUpdates(final boolean value) {
      batchUpdates = value;
      return this;
    }

    /**
     * Sets the quiet period before a batch flushes.
     *
     * @param theDebounce the debounce, zero or positive, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theDebounce is negative
     */
    public Builder debounce(final Duration theDebounce) {
      Objects.requireNonNull(theDebounce, "debounce must not be null");
      if (theDebounce.isNegative()) {
        throw new IllegalArgumentException(
            "debounce must not be negative, got: " + theDebounce);
      }
      debounce = theDebounce;
      return this;
    }

    /**
     * Sets how many times a rejected batch is redelivered.
     *
     * @param theMaxRetries the retries, zero or more
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theMaxRetries is negative
     */
    public Builder maxRetries(final int theMaxRetries) {
      if (theMaxRetries < 0) {
        throw new IllegalArgumentException(
            "maxRetries must not be negative, got: " + theMaxRetries);
      }
      maxRetries = theMaxRetries;
      return this;
    }

    /**
     * Sets the idle time after which the pool removes the subscription.
     *
     * @param theCleanupTimeout the timeout, must be positive
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theCleanupTimeout is not positive
     */
    public Builder cleanupTimeout(final Duration theCleanupTimeout) {
      Objects.requireNonNull(theCleanupTimeout,
          "cleanupTimeout must not be null");
      if (theCleanupTimeout.isZero() || theCleanupTimeout.isNegative()) {
        throw new IllegalArgumentException(
            "cleanupTimeout must be positive, got: " + theCleanupTimeout);
      }
      cleanupTimeout = theCleanupTimeout;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     */
    public SubscriptionOptions build() {
      return new SubscriptionOptions(this);
    }
  }
}
