package org.waabox.confluo;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregates the pool wide gauges reported by {@link PoolMetrics}.
 *
 * <p>The memory estimate is coarse: 1024 bytes per listener,
 * 512 per query key group and 256 per change held by a batch group.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MetricsCollector {

  /** Estimated bytes held by one listener entry. */
  static final long LISTENER_BYTES = 1024;

  /** Estimated bytes held by one query key group. */
  static final long GROUP_BYTES = 512;

  /** Estimated bytes held by one batched change. */
  static final long ITEM_BYTES = 256;

  /** Guards the moving average. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The moving average of handling times, in milliseconds. */
  private double averageResponseTimeMs;

  /**
   * Folds one handling time into the moving average, giving the new sample
   * the same weight as the whole history.
   *
   * @param nanos the handling time, in nanoseconds
   */
  void recordResponseTime(final long nanos) {
    final double sample = nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
    lock.lock();
    try {
      averageResponseTimeMs = (averageResponseTimeMs + sample) / 2;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the moving average of handling times.
   *
   * @return the average, in milliseconds
   */
  double averageResponseTimeMs() {
    lock.lock();
    try {
      return averageResponseTimeMs;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Assembles the current metrics of a pool.
   *
   * @param multiplexer     the listener multiplexer, never null
   * @param registry        the subscription registry, never null
   * @param aggregator      the batch aggregator, never null
   * @param deliveryBreaker the per-subscription breaker, never null
   * @param streamBreaker   the per-query-key breaker, never null
   *
   * @return the metrics, never null
   */
  PoolMetrics collect(final ListenerMultiplexer multiplexer,
      final SubscriptionRegistry registry, final BatchAggregator aggregator,
      final CircuitBreaker deliveryBreaker,
      final CircuitBreaker streamBreaker) {
    final int subscriptions = registry.size();
    final int targeted = registry.targetedCount();
    final long memory = multiplexer.entryCount() * LISTENER_BYTES
        + registry.groupCount() * GROUP_BYTES
        + aggregator.heldItems() * ITEM_BYTES;

    return new PoolMetrics(
        multiplexer.activeListeners(),
        multiplexer.sharedListeners(),
        subscriptions,
        aggregator.batchedUpdates(),
        memory,
        averageResponseTimeMs(),
        deliveryBreaker.openCircuits() + streamBreaker.openCircuits(),
        aggregator.pendingGroups(),
        aggregator.totalBatches(),
        aggregator.averageBatchSize(),
        aggregator.averageProcessingTimeMs(),
        aggregator.errorRate(),
        targeted,
        Math.max(0, subscriptions - targeted));
  }
}
