package org.waabox.confluo.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.confluo.BatchPolicy;
import org.waabox.confluo.CircuitBreakerPolicy;
import org.waabox.confluo.RetryPolicy;
import org.waabox.confluo.SubscriptionOptions;

/**
 * Configuration properties for Confluo, mapped from the {@code confluo.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code confluo.batch-size} - the maximum changes in one batch,
 *       defaults to 50.</li>
 *   <li>{@code confluo.throttle} - the minimum interval between two flushes
 *       of the same subscription, defaults to 50ms.</li>
 *   <li>{@code confluo.error-threshold} - the consecutive failures that open
 *       a circuit, defaults to 5.</li>
 *   <li>{@code confluo.circuit-cool-down} - how long an open circuit stays
 *       open, defaults to 60s.</li>
 *   <li>{@code confluo.retry-backoff} - the base of the exponential backoff
 *       of retries and reconnects, defaults to 1s.</li>
 *   <li>{@code confluo.defaults.*} - the options of subscriptions created
 *       without explicit options.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "confluo")
public class ConfluoProperties {

  /** The maximum number of changes in one batch. */
  private int batchSize = 50;

  /** The minimum interval between two flushes of the same subscription. */
  private Duration throttle = Duration.ofMillis(50);

  /** The consecutive failures that open a circuit. */
  private int errorThreshold = 5;

  /** How long an open circuit stays open. */
  private Duration circuitCoolDown = Duration.ofSeconds(60);

  /** The base of the exponential backoff. */
  private Duration retryBackoff = Duration.ofSeconds(1);

  /** The default subscription options. */
  private final Defaults defaults = new Defaults();

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(final int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getThrottle() {
    return throttle;
  }

  public void setThrottle(final Duration throttle) {
    this.throttle = throttle;
  }

  public int getErrorThreshold() {
    return errorThreshold;
  }

  public void setErrorThreshold(final int errorThreshold) {
    this.errorThreshold = errorThreshold;
  }

  public Duration getCircuitCoolDown() {
    return circuitCoolDown;
  }

  public void setCircuitCoolDown(final Duration circuitCoolDown) {
    this.circuitCoolDown = circuitCoolDown;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(final Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }

  public Defaults getDefaults() {
    return defaults;
  }

  /**
   * Builds the batch policy these properties describe.
   *
   * @return the batch policy, never null
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  BatchPolicy toBatchPolicy() {
    return BatchPolicy.builder()
        .batchSize(batchSize)
        .throttle(throttle)
        .build();
  }

  /**
   * Builds the circuit breaker policy these properties describe.
   *
   * @return the circuit breaker policy, never null
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  CircuitBreakerPolicy toCircuitBreakerPolicy() {
    return CircuitBreakerPolicy.of(errorThreshold, circuitCoolDown);
  }

  /**
   * Builds the retry policy these properties describe.
   *
   * @return the retry policy, never null
   *
   * @throws IllegalArgumentException if the backoff is not positive
   */
  RetryPolicy toRetryPolicy() {
    return RetryPolicy.of(retryBackoff);
  }

  /**
   * The options of subscriptions created without explicit options, mapped
   * from {@code confluo.defaults.*}.
   */
  public static class Defaults {

    /** Whether queries are targeted. */
    private boolean targetedQuery = true;

    /** Whether changes are batched. */
    private boolean batchUpdates = true;

    /** The quiet period before a batch flushes. */
    private Duration debounce = Duration.ofMillis(100);

    /** The redeliveries of a rejected batch. */
    private int maxRetries = 3;

    /** The idle time after which a subscription is removed. */
    private Duration cleanupTimeout = Duration.ofMinutes(5);

    public boolean isTargetedQuery() {
      return targetedQuery;
    }

    public void setTargetedQuery(final boolean targetedQuery) {
      this.targetedQuery = targetedQuery;
    }

    public boolean isBatchUpdates() {
      return batchUpdates;
    }

    public void setBatchUpdates(final boolean batchUpdates) {
      this.batchUpdates = batchUpdates;
    }

    public Duration getDebounce() {
      return debounce;
    }

    public void setDebounce(final Duration debounce) {
      this.debounce = debounce;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(final int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getCleanupTimeout() {
      return cleanupTimeout;
    }

    public void setCleanupTimeout(final Duration cleanupTimeout) {
      this.cleanupTimeout = cleanupTimeout;
    }

    /**
     * Builds the subscription options these properties describe.
     *
     * @return the options, never null
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    SubscriptionOptions toOptions() {
      return SubscriptionOptions.builder()
          .targetedQuery(targetedQuery)
          .batchUpdates(batchUpdates)
          .debounce(debounce)
          .maxRetries(maxRetries)
          .cleanupTimeout(cleanupTimeout)
          .build();
    }
  }
}
