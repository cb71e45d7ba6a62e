package org.waabox.confluo;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one idle timer per subscription and removes the subscriptions
 * whose timer expires.
 *
 * <p>Timers are started on creation and on explicit renewal only, never on
 * delivery. A timer fires at most once; cancelling it after it fired is a
 * no-op, and a timer that was cancelled or replaced never runs its expiry
 * action.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CleanupScheduler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CleanupScheduler.class);

  /** The scheduler running the timers. */
  private final ScheduledExecutorService scheduler;

  /** The pending timers, keyed by subscription id. */
  private final Map<String, Timer> timers = new ConcurrentHashMap<>();

  /**
   * Creates a new cleanup scheduler.
   *
   * @param theScheduler the scheduler running the timers, never null
   */
  CleanupScheduler(final ScheduledExecutorService theScheduler) {
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
  }

  /**
   * Starts, or restarts, the idle timer of a subscription.
   *
   * @param subscriptionId the subscription id, never null
   * @param timeout        the idle timeout, never null
   * @param onExpire       the action run when the timer fires, never null
   */
  void schedule(final String subscriptionId, final Duration timeout,
      final Runnable onExpire) {
    final Timer timer = new Timer();
    final Timer previous = timers.put(subscriptionId, timer);
    if (previous != null) {
      previous.cancel();
    }
    timer.attach(scheduler.schedule(() -> {
      if (!timers.remove(subscriptionId, timer)) {
        return;
      }
      log.info("Subscription '{}' idle for {}, removing it",
          subscriptionId, timeout);
      try {
        onExpire.run();
      } catch (final Exception e) {
        log.error("Cleanup of subscription '{}' failed: {}",
            subscriptionId, e.getMessage(), e);
      }
    }, timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Cancels the timer of a subscription.
   *
   * @param subscriptionId the subscription id, never null
   *
   * @return true if a pending timer was cancelled
   */
  boolean cancel(final String subscriptionId) {
    final Timer timer = timers.remove(subscriptionId);
    if (timer == null) {
      return false;
    }
    timer.cancel();
    return true;
  }

  /**
   * Returns the number of pending timers.
   *
   * @return the pending timers
   */
  int pending() {
    return timers.size();
  }

  /** Cancels every pending timer. */
  void cancelAll() {
    for (final String id : timers.keySet()) {
      cancel(id);
    }
  }

  /** A timer slot, placed in the map before its task is scheduled. */
  private static final class Timer {

    /** The scheduled task, null until attached. */
    private ScheduledFuture<?> future;

    /** Whether the timer was cancelled. */
    private boolean cancelled;

    private synchronized void attach(final ScheduledFuture<?> theFuture) {
      future = theFuture;
      if (cancelled) {
        future.cancel(false);
      }
    }

    private synchronized void cancel() {
      cancelled = true;
      if (future != null) {
        future.cancel(false);
      }
    }
  }
}
