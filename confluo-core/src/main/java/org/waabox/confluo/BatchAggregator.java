package org.waabox.confluo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.confluo.delivery.BatchDelivery;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.stream.ChangeRecord;

/**
 * Coalesces the changes of each subscription into batch deliveries.
 *
 * <p>The batch source is the subscription id. Every change goes into the
 * open {@link BatchGroup} of its source. A group is flushed when:
 * <ul>
 *   <li>it reaches {@link BatchPolicy#batchSize()} changes: the full group
 *       is dispatched and the next change opens a new group, or</li>
 *   <li>no change arrived for the subscription debounce: every change
 *       restarts the quiet period.</li>
 * </ul>
 * On top of the debounce, two flushes of the same source are at least
 * {@link BatchPolicy#throttle()} apart; a flush that comes too early is
 * delayed, never dropped.
 *
 * <p>Flushes run on the pool scheduler, so listeners are invoked
 * asynchronously and one at a time. A listener that throws gets the same
 * batch again after {@link RetryPolicy#backoffFor(int)}, up to
 * {@link SubscriptionOptions#maxRetries()} times; after that the group is
 * abandoned and the failure is recorded against the source circuit. While
 * that circuit is open, changes for the source are dropped.
 *
 * <p>Delivered groups are reaped after
 * {@link BatchPolicy#completedRetention()}; a periodic sweep reclaims any
 * delivered group older than {@link BatchPolicy#staleAge()} that the reap
 * missed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class BatchAggregator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(BatchAggregator.class);

  /** The batching thresholds. */
  private final BatchPolicy policy;

  /** The backoff of failed deliveries. */
  private final RetryPolicy retryPolicy;

  /** The scheduler running flushes, retries and sweeps. */
  private final ScheduledExecutorService scheduler;

  /** The clock used for timestamps. */
  private final Clock clock;

  /** The per-source circuit breaker. */
  private final CircuitBreaker circuitBreaker;

  /** The metrics reporter. */
  private final ConfluoMetrics metrics;

  /** Serializes every state change of groups and sources. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The live groups, keyed by group id, in creation order. */
  private final Map<String, BatchGroup> groups = new LinkedHashMap<>();

  /** The accumulation state of each source. */
  private final Map<String, SourceState> sources = new HashMap<>();

  /** The changes delivered through batches. */
  private final AtomicLong batchedUpdates = new AtomicLong();

  /** The delivery attempts, successful or not. */
  private final AtomicLong totalBatches = new AtomicLong();

  /** The changes carried by every delivery attempt. */
  private final AtomicLong attemptedUpdates = new AtomicLong();

  /** The delivery attempts the listener rejected. */
  private final AtomicLong failedBatches = new AtomicLong();

  /** The moving average of delivery times, in ms. Guarded by the lock. */
  private double averageProcessingTimeMs;

  /** The periodic sweep, null until started. */
  private ScheduledFuture<?> sweep;

  /**
   * Creates a new aggregator.
   *
   * @param thePolicy         the batching thresholds, never null
   * @param theRetryPolicy    the backoff of failed deliveries, never null
   * @param theScheduler      the scheduler, never null
   * @param theClock          the clock, never null
   * @param theCircuitBreaker the per-source circuit breaker, never null
   * @param theMetrics        the metrics reporter, never null
   */
  BatchAggregator(final BatchPolicy thePolicy,
      final RetryPolicy theRetryPolicy,
      final ScheduledExecutorService theScheduler, final Clock theClock,
      final CircuitBreaker theCircuitBreaker, final ConfluoMetrics theMetrics) {
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    circuitBreaker = Objects.requireNonNull(theCircuitBreaker,
        "circuitBreaker must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /** Starts the periodic sweep of stale groups. */
  void start() {
    final long interval = policy.sweepInterval().toMillis();
    sweep = scheduler.scheduleAtFixedRate(this::sweep, interval, interval,
        TimeUnit.MILLISECONDS);
  }

  /**
   * Adds a change to the open group of the subscription.
   *
   * @param subscription the subscription, never null
   * @param change       the change, never null
   *
   * @return false if the change was dropped because the subscription was
   *         removed or its circuit is open
   */
  boolean add(final Subscription subscription, final ChangeRecord change) {
    final String source = subscription.id();
    if (!circuitBreaker.allows(source)) {
      log.warn("Circuit open for source '{}', dropping change '{}'",
          source, change.id());
      return false;
    }

    lock.lock();
    try {
      if (!subscription.isActive()) {
        log.debug("Source '{}' was removed, dropping change '{}'", source,
            change.id());
        return false;
      }
      final SourceState state = sources.computeIfAbsent(source,
          k -> new SourceState());
      BatchGroup group = state.open;
      if (group == null) {
        final Instant now = clock.instant();
        group = new BatchGroup(newGroupId(source), subscription, now);
        groups.put(group.groupId(), group);
        state.open = group;
      }
      group.add(new ChangeItem(change, clock.instant(), source));

      if (group.size() >= policy.batchSize()) {
        state.open = null;
        state.cancelDebounce();
        requestFlush(state, group);
      } else {
        state.cancelDebounce();
        state.debounce = scheduler.schedule(() -> debounceElapsed(source),
            subscription.options().debounce().toMillis(),
            TimeUnit.MILLISECONDS);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes the open group of every source now, subject to the throttle.
   */
  void flushAll() {
    lock.lock();
    try {
      for (final SourceState state : sources.values()) {
        state.cancelDebounce();
        final BatchGroup group = state.open;
        if (group != null && !group.isEmpty()) {
          state.open = null;
          requestFlush(state, group);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops everything held for a source: its groups, its debounce timer and
   * its circuit state.
   *
   * @param source the source, never null
   *
   * @return the number of changes dropped without being delivered
   */
  int discard(final String source) {
    int dropped = 0;
    lock.lock();
    try {
      final SourceState state = sources.remove(source);
      if (state != null) {
        state.cancelDebounce();
      }
      final Iterator<BatchGroup> it = groups.values().iterator();
      while (it.hasNext()) {
        final BatchGroup group = it.next();
        if (group.source().equals(source)) {
          if (group.state() != BatchGroup.State.COMPLETED) {
            dropped += group.size();
          }
          it.remove();
        }
      }
    } finally {
      lock.unlock();
    }
    circuitBreaker.reset(source);
    if (dropped > 0) {
      log.debug("Discarded {} undelivered change(s) of source '{}'",
          dropped, source);
    }
    return dropped;
  }

  /**
   * Returns the changes delivered through batches so far.
   *
   * @return the batched updates
   */
  long batchedUpdates() {
    return batchedUpdates.get();
  }

  /**
   * Returns the delivery attempts so far, retries included.
   *
   * @return the attempted batches
   */
  long totalBatches() {
    return totalBatches.get();
  }

  /**
   * Returns the mean number of changes per delivery attempt.
   *
   * @return the average batch size, zero before the first attempt
   */
  double averageBatchSize() {
    final long batches = totalBatches.get();
    return batches == 0 ? 0 : attemptedUpdates.get() / (double) batches;
  }

  /**
   * Returns the moving average of the time listeners took to handle a
   * batch, giving each new sample the same weight as the whole history.
   *
   * @return the average, in milliseconds
   */
  double averageProcessingTimeMs() {
    lock.lock();
    try {
      return averageProcessingTimeMs;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the share of delivery attempts the listener rejected.
   *
   * @return a value between 0 and 1, zero before the first attempt
   */
  double errorRate() {
    final long batches = totalBatches.get();
    return batches == 0 ? 0 : failedBatches.get() / (double) batches;
  }

  /**
   * Counts the groups not yet delivered, including failed groups waiting
   * for a retry.
   *
   * @return the pending groups
   */
  int pendingGroups() {
    lock.lock();
    try {
      int pending = 0;
      for (final BatchGroup group : groups.values()) {
        if (group.state() != BatchGroup.State.COMPLETED) {
          pending++;
        }
      }
      return pending;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts the changes held by live groups.
   *
   * @return the held changes
   */
  int heldItems() {
    lock.lock();
    try {
      int held = 0;
      for (final BatchGroup group : groups.values()) {
        held += group.size();
      }
      return held;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes delivered groups older than {@link BatchPolicy#staleAge()}.
   * Failed groups are left alone: they either wait for a retry or were
   * already dropped when abandoned.
   *
   * @return the number of groups removed
   */
  int sweep() {
    final Instant threshold = clock.instant().minus(policy.staleAge());
    int removed = 0;
    lock.lock();
    try {
      final Iterator<BatchGroup> it = groups.values().iterator();
      while (it.hasNext()) {
        final BatchGroup group = it.next();
        if (group.isCompleted() && group.createdAt().isBefore(threshold)) {
          it.remove();
          removed++;
        }
      }
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      log.debug("Swept {} stale batch group(s)", removed);
    }
    return removed;
  }

  /** Cancels every timer and forgets every group. */
  void shutdown() {
    lock.lock();
    try {
      if (sweep != null) {
        sweep.cancel(false);
        sweep = null;
      }
      for (final SourceState state : sources.values()) {
        state.cancelDebounce();
      }
      sources.clear();
      groups.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Called when the quiet period of a source elapsed.
   *
   * @param source the source, never null
   */
  private void debounceElapsed(final String source) {
    lock.lock();
    try {
      final SourceState state = sources.get(source);
      if (state == null) {
        return;
      }
      state.debounce = null;
      final BatchGroup group = state.open;
      if (group == null || group.isEmpty()) {
        return;
      }
      state.open = null;
      requestFlush(state, group);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Queues the flush of a group on the scheduler, no earlier than the
   * throttle allows. Must be called while holding the lock.
   *
   * @param state the state of the group source, never null
   * @param group the group, never null
   */
  private void requestFlush(final SourceState state, final BatchGroup group) {
    final long now = System.nanoTime();
    final long at = state.flushedBefore && state.nextFlushAt - now > 0
        ? state.nextFlushAt : now;
    state.nextFlushAt = at + policy.throttle().toNanos();
    state.flushedBefore = true;

    final String groupId = group.groupId();
    final long delay = at - now;
    if (delay <= 0) {
      scheduler.execute(() -> process(groupId));
    } else {
      log.debug("Throttling flush of group '{}' by {} ns", groupId, delay);
      scheduler.schedule(() -> process(groupId), delay,
          TimeUnit.NANOSECONDS);
    }
  }

  /**
   * Delivers a pending group to its subscription.
   *
   * @param groupId the group id, never null
   */
  private void process(final String groupId) {
    final BatchGroup group;
    final BatchDelivery delivery;
    lock.lock();
    try {
      group = groups.get(groupId);
      if (group == null || group.state() != BatchGroup.State.PENDING) {
        return;
      }
      if (!group.owner().isActive()) {
        groups.remove(groupId);
        return;
      }
      if (!circuitBreaker.allows(group.source())) {
        log.warn("Circuit open for source '{}', dropping batch '{}' of {}"
            + " change(s)", group.source(), groupId, group.size());
        groups.remove(groupId);
        return;
      }
      group.state(BatchGroup.State.PROCESSING);
      delivery = group.toDelivery(clock.instant());
    } finally {
      lock.unlock();
    }

    final long start = System.nanoTime();
    try {
      group.owner().deliver(delivery);
    } catch (final Exception e) {
      attempted(delivery.count(), System.nanoTime() - start, true);
      failed(group, e);
      return;
    }
    final long elapsed = System.nanoTime() - start;
    attempted(delivery.count(), elapsed, false);
    completed(group, delivery, TimeUnit.NANOSECONDS.toMillis(elapsed));
  }

  /**
   * Accounts for one delivery attempt.
   *
   * @param changes the changes in the batch
   * @param nanos   the time the listener took, in nanoseconds
   * @param failed  whether the listener rejected the batch
   */
  private void attempted(final int changes, final long nanos,
      final boolean failed) {
    totalBatches.incrementAndGet();
    attemptedUpdates.addAndGet(changes);
    if (failed) {
      failedBatches.incrementAndGet();
    }
    final double sample = nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
    lock.lock();
    try {
      averageProcessingTimeMs = (averageProcessingTimeMs + sample) / 2;
    } finally {
      lock.unlock();
    }
  }

  private void completed(final BatchGroup group, final BatchDelivery delivery,
      final long durationMs) {
    lock.lock();
    try {
      group.state(BatchGroup.State.COMPLETED);
    } finally {
      lock.unlock();
    }
    group.owner().delivered(delivery.count(), clock.instant());
    batchedUpdates.addAndGet(delivery.count());
    circuitBreaker.recordSuccess(group.source());
    metrics.batchDelivered(group.source(), delivery.count(), durationMs);

    final String groupId = group.groupId();
    scheduler.schedule(() -> reap(groupId),
        policy.completedRetention().toMillis(), TimeUnit.MILLISECONDS);
  }

  private void failed(final BatchGroup group, final Exception cause) {
    metrics.deliveryFailed(group.source(), cause);
    final int errors;
    final int maxRetries = group.owner().options().maxRetries();
    lock.lock();
    try {
      errors = group.failed();
      if (errors > maxRetries) {
        groups.remove(group.groupId());
      }
    } finally {
      lock.unlock();
    }

    if (errors <= maxRetries) {
      final Duration backoff = retryPolicy.backoffFor(errors);
      log.warn("Delivery of batch '{}' to '{}' failed (attempt {}/{}),"
          + " retrying in {}: {}", group.groupId(), group.source(), errors,
          maxRetries + 1, backoff, cause.getMessage());
      final String groupId = group.groupId();
      scheduler.schedule(() -> retry(groupId), backoff.toMillis(),
          TimeUnit.MILLISECONDS);
    } else {
      log.error("Delivery of batch '{}' to '{}' failed {} time(s), dropping"
          + " {} change(s)", group.groupId(), group.source(), errors,
          group.size(), cause);
      circuitBreaker.recordFailure(group.source());
    }
  }

  private void retry(final String groupId) {
    lock.lock();
    try {
      final BatchGroup group = groups.get(groupId);
      if (group == null || group.state() != BatchGroup.State.FAILED) {
        return;
      }
      group.retry();
    } finally {
      lock.unlock();
    }
    process(groupId);
  }

  private void reap(final String groupId) {
    lock.lock();
    try {
      final BatchGroup group = groups.get(groupId);
      if (group != null && group.state() == BatchGroup.State.COMPLETED) {
        groups.remove(groupId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a snapshot of the ids of live groups, for diagnostics.
   *
   * @return the group ids in creation order, never null
   */
  List<String> groupIds() {
    lock.lock();
    try {
      return new ArrayList<>(groups.keySet());
    } finally {
      lock.unlock();
    }
  }

  private static String newGroupId(final String source) {
    return "batch_" + source + "_" + UUID.randomUUID();
  }

  /** The accumulation state of one source. Guarded by the lock. */
  private static final class SourceState {

    /** The group receiving new changes, null when none is open. */
    private BatchGroup open;

    /** The pending debounce timer, null when none. */
    private ScheduledFuture<?> debounce;

    /** The earliest nano time the next flush may run. */
    private long nextFlushAt;

    /** Whether a flush was requested before, so nextFlushAt is set. */
    private boolean flushedBefore;

    private void cancelDebounce() {
      if (debounce != null) {
        debounce.cancel(false);
        debounce = null;
      }
    }
  }
}
