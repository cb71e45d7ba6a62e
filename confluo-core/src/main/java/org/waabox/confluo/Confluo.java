package org.waabox.confluo;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.confluo.delivery.DeliveryListener;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.metrics.NoopConfluoMetrics;
import org.waabox.confluo.stream.ChangeStreamPort;

/**
 * The main entry point of the Confluo subscription pool.
 *
 * <p>A pool lets many independent callers watch the same query without each
 * one opening its own change-stream connection. Subscriptions of the same
 * query key share one connection, opened on the first subscription and
 * closed when the last one goes away. Change notifications are fanned out to
 * every subscription, either immediately or coalesced into batches.
 *
 * <p>Subscriptions that are neither removed nor renewed within their
 * {@link SubscriptionOptions#cleanupTimeout()} are removed by the pool.
 * Failing listeners and failing streams are isolated through per-source
 * circuit breakers, so one misbehaving consumer or query key does not affect
 * the others.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}, and must be released with {@link #shutdown()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Confluo pool = Confluo.builder()
 *     .changeStreamPort(firestorePort)
 *     .batchPolicy(BatchPolicy.builder().batchSize(20).build())
 *     .build();
 *
 * String id = pool.subscribe("novel:42", novelQuery, delivery -> {
 *   if (delivery instanceof BatchDelivery batch) {
 *     render(batch.updates());
 *   }
 * });
 * ...
 * pool.unsubscribe(id);
 * pool.shutdown();
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Confluo {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Confluo.class);

  /** The options of subscriptions created without explicit options. */
  private final SubscriptionOptions defaultOptions;

  /** Guards the subscriptions and the listener reference counts. */
  private final ReentrantLock lock;

  /** The live subscriptions. */
  private final SubscriptionRegistry registry;

  /** The shared stream connections. */
  private final ListenerMultiplexer multiplexer;

  /** The batch aggregator. */
  private final BatchAggregator aggregator;

  /** The idle timers. */
  private final CleanupScheduler cleanup;

  /** The per-subscription circuit breaker. */
  private final CircuitBreaker deliveryBreaker;

  /** The per-query-key circuit breaker. */
  private final CircuitBreaker streamBreaker;

  /** The pool wide gauges. */
  private final MetricsCollector collector;

  /** The scheduler running flushes, retries, reopens and timers. */
  private final ScheduledThreadPoolExecutor scheduler;

  /** Whether this pool has been shut down. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private Confluo(final ChangeStreamPort port,
      final BatchPolicy batchPolicy,
      final CircuitBreakerPolicy circuitBreakerPolicy,
      final RetryPolicy retryPolicy,
      final SubscriptionOptions theDefaultOptions,
      final ConfluoMetrics metrics,
      final Clock clock) {
    defaultOptions = theDefaultOptions;

    scheduler = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread thread = new Thread(r, "confluo-scheduler");
      thread.setDaemon(true);
      return thread;
    });
    scheduler.setRemoveOnCancelPolicy(true);

    lock = new ReentrantLock();
    collector = new MetricsCollector();
    deliveryBreaker = new CircuitBreaker("delivery", circuitBreakerPolicy,
        clock, metrics);
    streamBreaker = new CircuitBreaker("stream", circuitBreakerPolicy,
        clock, metrics);
    registry = new SubscriptionRegistry(lock, clock);
    aggregator = new BatchAggregator(batchPolicy, retryPolicy, scheduler,
        clock, deliveryBreaker, metrics);
    final ChangeEventRouter router = new ChangeEventRouter(registry,
        aggregator, deliveryBreaker, collector, metrics, clock);
    multiplexer = new ListenerMultiplexer(port, lock, router, streamBreaker,
        retryPolicy, scheduler, metrics);
    cleanup = new CleanupScheduler(scheduler);

    aggregator.start();
  }

  /**
   * Creates a new builder for constructing a Confluo pool.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes a listener to a query with the pool default options.
   *
   * @param queryKey        the canonical identifier of what is watched,
   *                        never null or empty
   * @param queryDescriptor the transport description of the query, handed
   *                        to the {@link ChangeStreamPort} as is, may be null
   * @param listener        the listener receiving deliveries, never null
   *
   * @return the subscription id, never null
   *
   * @see #subscribe(String, Object, DeliveryListener, SubscriptionOptions)
   */
  public String subscribe(final String queryKey, final Object queryDescriptor,
      final DeliveryListener listener) {
    return subscribe(queryKey, queryDescriptor, listener, defaultOptions);
  }

  /**
   * Subscribes a listener to a query.
   *
   * <p>If this is the first subscription of the query key, a change-stream
   * connection is opened; otherwise the existing one is shared. The idle
   * timer of the subscription starts right away.
   *
   * <p>A connection that fails to open does not fail the subscription: the
   * listener gets an {@link org.waabox.confluo.delivery.ErrorDelivery} and
   * the pool keeps trying to reopen the connection.
   *
   * @param queryKey        the canonical identifier of what is watched,
   *                        never null or empty
   * @param queryDescriptor the transport description of the query, handed
   *                        to the {@link ChangeStreamPort} as is, may be null
   * @param listener        the listener receiving deliveries, never null
   * @param options         the subscription options, never null
   *
   * @return the subscription id, never null
   *
   * @throws NullPointerException     if a required argument is null
   * @throws IllegalArgumentException if queryKey is empty
   * @throws IllegalStateException    if the pool was shut down
   */
  public String subscribe(final String queryKey, final Object queryDescriptor,
      final DeliveryListener listener, final SubscriptionOptions options) {
    Objects.requireNonNull(queryKey, "queryKey must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    Objects.requireNonNull(options, "options must not be null");
    if (queryKey.isEmpty()) {
      throw new IllegalArgumentException("queryKey must not be empty");
    }

    lock.lock();
    try {
      requireRunning();
      final Subscription subscription = registry.register(queryKey, listener,
          options);
      multiplexer.acquire(queryKey, queryDescriptor);
      scheduleCleanup(subscription);
      log.debug("Subscription '{}' created for '{}'", subscription.id(),
          queryKey);
      return subscription.id();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a subscription. Its pending batches are discarded and, if it was
   * the last subscription of its query key, the connection is closed.
   *
   * <p>Unknown or already removed ids are ignored.
   *
   * @param subscriptionId the subscription id, never null
   */
  public void unsubscribe(final String subscriptionId) {
    Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");

    lock.lock();
    try {
      final Optional<Subscription> removed = registry.remove(subscriptionId);
      if (removed.isEmpty()) {
        return;
      }
      final Subscription subscription = removed.get();
      cleanup.cancel(subscriptionId);
      aggregator.discard(subscriptionId);
      multiplexer.release(subscription.queryKey());
      log.debug("Subscription '{}' removed from '{}'", subscriptionId,
          subscription.queryKey());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Restarts the idle timer of a subscription.
   *
   * @param subscriptionId the subscription id, never null
   *
   * @return false if the subscription does not exist
   */
  public boolean renew(final String subscriptionId) {
    Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");

    lock.lock();
    try {
      final Optional<Subscription> subscription =
          registry.find(subscriptionId);
      if (subscription.isEmpty() || stopped.get()) {
        return false;
      }
      scheduleCleanup(subscription.get());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes every batch group still accumulating, without waiting for its
   * debounce. The minimum interval between two flushes of the same
   * subscription still applies.
   */
  public void flushAll() {
    aggregator.flushAll();
  }

  /**
   * Returns a point in time view of the pool.
   *
   * @return the metrics, never null
   */
  public PoolMetrics metrics() {
    return collector.collect(multiplexer, registry, aggregator,
        deliveryBreaker, streamBreaker);
  }

  /**
   * Looks up a live subscription.
   *
   * @param subscriptionId the subscription id, never null
   *
   * @return the subscription view, empty if it does not exist
   */
  public Optional<SubscriptionInfo> subscription(final String subscriptionId) {
    Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");
    return registry.find(subscriptionId).map(Subscription::info);
  }

  /**
   * Lists the live subscriptions, grouped by query key.
   *
   * @return the subscription views, never null
   */
  public List<SubscriptionInfo> subscriptions() {
    final List<SubscriptionInfo> infos = new ArrayList<>();
    for (final Subscription subscription : registry.all()) {
      infos.add(subscription.info());
    }
    return infos;
  }

  /**
   * Tells whether {@link #shutdown()} was called.
   *
   * @return true once the pool is shut down
   */
  public boolean isShutdown() {
    return stopped.get();
  }

  /**
   * Shuts the pool down: closes every connection, cancels every timer,
   * drops every pending batch and stops the scheduler.
   *
   * <p>Calling this method more than once has no effect.
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    final int subscriptions;
    lock.lock();
    try {
      subscriptions = registry.size();
      cleanup.cancelAll();
      multiplexer.shutdown();
      registry.clear();
    } finally {
      lock.unlock();
    }
    aggregator.shutdown();
    deliveryBreaker.clear();
    streamBreaker.clear();
    scheduler.shutdownNow();
    log.info("Confluo pool shut down, {} subscription(s) dropped",
        subscriptions);
  }

  private void scheduleCleanup(final Subscription subscription) {
    final String id = subscription.id();
    cleanup.schedule(id, subscription.options().cleanupTimeout(),
        () -> unsubscribe(id));
  }

  private void requireRunning() {
    if (stopped.get()) {
      throw new IllegalStateException("The pool has been shut down");
    }
  }

  /**
   * A fluent builder for constructing {@link Confluo} pools.
   *
   * <p>The change-stream port is required. Defaults:
   * <ul>
   *   <li>batchPolicy: {@link BatchPolicy#defaultPolicy()}</li>
   *   <li>circuitBreakerPolicy: {@link CircuitBreakerPolicy#defaultPolicy()}
   *   </li>
   *   <li>retryPolicy: {@link RetryPolicy#defaultPolicy()}</li>
   *   <li>defaultOptions: {@link SubscriptionOptions#defaults()}</li>
   *   <li>metrics: {@link NoopConfluoMetrics}</li>
   *   <li>clock: {@link Clock#systemUTC()}</li>
   * </ul>
   */
  public static final class Builder {

    /** The change-stream port. */
    private ChangeStreamPort changeStreamPort;

    /** The optional batch policy. */
    private BatchPolicy batchPolicy;

    /** The optional circuit breaker policy. */
    private CircuitBreakerPolicy circuitBreakerPolicy;

    /** The optional retry policy. */
    private RetryPolicy retryPolicy;

    /** The optional default subscription options. */
    private SubscriptionOptions defaultOptions;

    /** The optional metrics reporter. */
    private ConfluoMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the transport opening change-stream connections.
     *
     * @param thePort the port, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if thePort is null
     */
    public Builder changeStreamPort(final ChangeStreamPort thePort) {
      Objects.requireNonNull(thePort, "changeStreamPort must not be null");
      this.changeStreamPort = thePort;
      return this;
    }

    /**
     * Sets how changes are coalesced into batches.
     *
     * @param theBatchPolicy the batch policy, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theBatchPolicy is null
     */
    public Builder batchPolicy(final BatchPolicy theBatchPolicy) {
      Objects.requireNonNull(theBatchPolicy, "batchPolicy must not be null");
      this.batchPolicy = theBatchPolicy;
      return this;
    }

    /**
     * Sets when failing sources are isolated.
     *
     * @param thePolicy the circuit breaker policy, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if thePolicy is null
     */
    public Builder circuitBreakerPolicy(final CircuitBreakerPolicy thePolicy) {
      Objects.requireNonNull(thePolicy,
          "circuitBreakerPolicy must not be null");
      this.circuitBreakerPolicy = thePolicy;
      return this;
    }

    /**
     * Sets the backoff of batch redeliveries and stream reopens.
     *
     * @param theRetryPolicy the retry policy, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theRetryPolicy is null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      Objects.requireNonNull(theRetryPolicy, "retryPolicy must not be null");
      this.retryPolicy = theRetryPolicy;
      return this;
    }

    /**
     * Sets the options of subscriptions created without explicit options.
     *
     * @param theOptions the options, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theOptions is null
     */
    public Builder defaultOptions(final SubscriptionOptions theOptions) {
      Objects.requireNonNull(theOptions, "defaultOptions must not be null");
      this.defaultOptions = theOptions;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final ConfluoMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the clock used for timestamps and circuit cool-downs.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theClock is null
     */
    public Builder clock(final Clock theClock) {
      Objects.requireNonNull(theClock, "clock must not be null");
      this.clock = theClock;
      return this;
    }

    /**
     * Builds the pool. Any unset optional field is replaced with its
     * default.
     *
     * @return a new, running pool, never null
     *
     * @throws IllegalStateException if no change-stream port was set
     */
    public Confluo build() {
      if (changeStreamPort == null) {
        throw new IllegalStateException("changeStreamPort is required");
      }
      final Confluo pool = new Confluo(
          changeStreamPort,
          batchPolicy != null ? batchPolicy : BatchPolicy.defaultPolicy(),
          circuitBreakerPolicy != null
              ? circuitBreakerPolicy : CircuitBreakerPolicy.defaultPolicy(),
          retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy(),
          defaultOptions != null
              ? defaultOptions : SubscriptionOptions.defaults(),
          metrics != null ? metrics : new NoopConfluoMetrics(),
          clock != null ? clock : Clock.systemUTC());
      log.info("Confluo pool started");
      return pool;
    }
  }
}
