package org.waabox.confluo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.stream.ChangeRecord;
import org.waabox.confluo.stream.ChangeStreamHandler;
import org.waabox.confluo.stream.ChangeStreamPort;
import org.waabox.confluo.stream.StreamHandle;

/**
 * Keeps exactly one change-stream connection per query key, shared by
 * every subscription of that key.
 *
 * <p>Each query key with at least one subscription has one
 * {@link ListenerEntry} counting its references. The connection is opened
 * when the count goes from 0 to 1 and closed when it goes back to 0. All
 * count transitions happen under the pool lock, so they are exact even when
 * subscribe, unsubscribe and cleanup timers race.
 *
 * <p>When a connection fails, or cannot be opened, the entry keeps its
 * references but loses its connection; the failure is fanned out to the
 * subscriptions and recorded against the query key circuit. A failure met
 * while opening under the pool lock is fanned out from the scheduler
 * thread instead. A reopen is then scheduled with exponential backoff, and
 * postponed while the circuit is open. Emissions of a connection that was
 * closed or replaced are dropped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ListenerMultiplexer {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ListenerMultiplexer.class);

  /** The transport. */
  private final ChangeStreamPort port;

  /** The pool lock. */
  private final ReentrantLock lock;

  /** Where emissions and failures are routed. */
  private final ChangeEventRouter router;

  /** The per-query-key circuit breaker. */
  private final CircuitBreaker circuitBreaker;

  /** The backoff of reopen attempts. */
  private final RetryPolicy retryPolicy;

  /** The scheduler running reopen attempts. */
  private final ScheduledExecutorService scheduler;

  /** The metrics reporter. */
  private final ConfluoMetrics metrics;

  /** The entries, keyed by query key. Guarded by the lock. */
  private final Map<String, ListenerEntry> entries = new HashMap<>();

  ListenerMultiplexer(final ChangeStreamPort thePort,
      final ReentrantLock theLock, final ChangeEventRouter theRouter,
      final CircuitBreaker theCircuitBreaker, final RetryPolicy theRetryPolicy,
      final ScheduledExecutorService theScheduler,
      final ConfluoMetrics theMetrics) {
    port = thePort;
    lock = theLock;
    router = theRouter;
    circuitBreaker = theCircuitBreaker;
    retryPolicy = theRetryPolicy;
    scheduler = theScheduler;
    metrics = theMetrics;
  }

  /**
   * Takes a reference on the listener of a query key, opening the
   * connection if this is the first reference.
   *
   * @param queryKey        the query key, never null
   * @param queryDescriptor the transport description of the query, used
   *                        only when a connection has to be opened
   */
  void acquire(final String queryKey, final Object queryDescriptor) {
    lock.lock();
    try {
      ListenerEntry entry = entries.get(queryKey);
      if (entry == null) {
        entry = new ListenerEntry(queryKey, queryDescriptor);
        entries.put(queryKey, entry);
        entry.references++;
        open(entry);
      } else {
        entry.references++;
        if (!entry.isConnected() && entry.reopen == null) {
          open(entry);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops a reference on the listener of a query key, closing the
   * connection if this was the last reference.
   *
   * <p>The failure count of a destroyed entry is forgotten unless its
   * circuit is open: a new subscription of the key during the cool-down
   * does not open a connection before the cool-down ends.
   *
   * @param queryKey the query key, never null
   *
   * @return true if the entry was destroyed
   */
  boolean release(final String queryKey) {
    lock.lock();
    try {
      final ListenerEntry entry = entries.get(queryKey);
      if (entry == null) {
        return false;
      }
      entry.references--;
      if (entry.references > 0) {
        return false;
      }
      entries.remove(queryKey);
      entry.cancelReopen();
      if (entry.disconnect()) {
        log.info("Closed listener for '{}'", queryKey);
        metrics.listenerClosed(queryKey);
      }
      // An open circuit outlives the entry and expires on its own.
      if (circuitBreaker.allows(queryKey)) {
        circuitBreaker.reset(queryKey);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of references held on the listener of a query key.
   *
   * @param queryKey the query key, never null
   *
   * @return the reference count, zero when there is no entry
   */
  int references(final String queryKey) {
    lock.lock();
    try {
      final ListenerEntry entry = entries.get(queryKey);
      return entry == null ? 0 : entry.references;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of query keys with an entry, connected or not.
   *
   * @return the entry count
   */
  int entryCount() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of open connections.
   *
   * @return the active listeners
   */
  int activeListeners() {
    lock.lock();
    try {
      int active = 0;
      for (final ListenerEntry entry : entries.values()) {
        if (entry.isConnected()) {
          active++;
        }
      }
      return active;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of references served by a connection opened for an
   * earlier reference.
   *
   * @return the shared listeners
   */
  int sharedListeners() {
    lock.lock();
    try {
      int shared = 0;
      for (final ListenerEntry entry : entries.values()) {
        shared += Math.max(0, entry.references - 1);
      }
      return shared;
    } finally {
      lock.unlock();
    }
  }

  /** Closes every connection and forgets every entry. */
  void shutdown() {
    lock.lock();
    try {
      final List<ListenerEntry> all = new ArrayList<>(entries.values());
      entries.clear();
      for (final ListenerEntry entry : all) {
        entry.cancelReopen();
        if (entry.disconnect()) {
          metrics.listenerClosed(entry.queryKey);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens the connection of an entry, unless its circuit is open. Must be
   * called while holding the lock.
   *
   * @param entry the entry, never null
   */
  private void open(final ListenerEntry entry) {
    final String queryKey = entry.queryKey;
    if (!circuitBreaker.allows(queryKey)) {
      log.warn("Circuit open for '{}', not reopening its listener", queryKey);
      scheduleReopen(entry);
      return;
    }

    final int generation = ++entry.generation;
    final StreamHandle handle;
    try {
      handle = port.open(queryKey, entry.queryDescriptor,
          new EntryHandler(entry, generation));
    } catch (final RuntimeException e) {
      failed(entry, e);
      return;
    }
    if (entry.generation != generation || entries.get(queryKey) != entry) {
      // Failed or released while opening.
      handle.close();
      return;
    }
    entry.handle = handle;
    log.info("Opened listener for '{}'", queryKey);
    metrics.listenerOpened(queryKey);
  }

  /**
   * Handles the failure of the connection of an entry.
   *
   * @param entry the entry, never null
   * @param cause the failure, never null
   */
  private void failed(final ListenerEntry entry, final Throwable cause) {
    final String queryKey = entry.queryKey;
    log.error("Listener for '{}' failed: {}", queryKey, cause.getMessage(),
        cause);
    metrics.streamFailed(queryKey, cause);
    circuitBreaker.recordFailure(queryKey);
    if (lock.isHeldByCurrentThread()) {
      routeErrorLater(queryKey, cause);
    } else {
      router.routeError(queryKey, cause);
    }

    lock.lock();
    try {
      if (entries.get(queryKey) == entry && entry.reopen == null
          && !entry.isConnected()) {
        scheduleReopen(entry);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Hands an error to the router on the scheduler thread, so listeners never
   * run while the pool lock is held.
   *
   * @param queryKey the query key, never null
   * @param cause    the failure, never null
   */
  private void routeErrorLater(final String queryKey, final Throwable cause) {
    try {
      scheduler.execute(() -> router.routeError(queryKey, cause));
    } catch (final RejectedExecutionException e) {
      log.debug("Pool stopped, not routing the failure of '{}'", queryKey);
    }
  }

  /**
   * Schedules a reopen attempt for an entry. Must be called while holding
   * the lock.
   *
   * @param entry the entry, never null
   */
  private void scheduleReopen(final ListenerEntry entry) {
    final String queryKey = entry.queryKey;
    final int failures = Math.max(1, circuitBreaker.failures(queryKey));
    final Duration backoff = retryPolicy.backoffFor(failures);
    final Duration coolDown = circuitBreaker.retryAfter(queryKey);
    final Duration delay = coolDown.compareTo(backoff) > 0
        ? coolDown : backoff;

    log.debug("Reopening listener for '{}' in {}", queryKey, delay);
    entry.reopen = scheduler.schedule(() -> reopen(entry), delay.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  private void reopen(final ListenerEntry entry) {
    lock.lock();
    try {
      entry.reopen = null;
      if (entries.get(entry.queryKey) != entry || entry.isConnected()) {
        return;
      }
      open(entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Tells whether the given connection generation of an entry is the live
   * one.
   */
  private boolean isLive(final ListenerEntry entry, final int generation) {
    lock.lock();
    try {
      return entries.get(entry.queryKey) == entry
          && entry.generation == generation;
    } finally {
      lock.unlock();
    }
  }

  /** The handler registered with the port for one connection. */
  private final class EntryHandler implements ChangeStreamHandler {

    /** The entry the connection belongs to. */
    private final ListenerEntry entry;

    /** The connection generation this handler serves. */
    private final int generation;

    private EntryHandler(final ListenerEntry theEntry, final int theGeneration) {
      entry = theEntry;
      generation = theGeneration;
    }

    @Override
    public void onChanges(final List<ChangeRecord> changes) {
      if (!isLive(entry, generation)) {
        log.debug("Dropping {} late change(s) for '{}'", changes.size(),
            entry.queryKey);
        return;
      }
      circuitBreaker.recordSuccess(entry.queryKey);
      router.routeChanges(entry.queryKey, changes);
    }

    @Override
    public void onError(final Throwable cause) {
      lock.lock();
      try {
        if (entries.get(entry.queryKey) != entry
            || entry.generation != generation) {
          log.debug("Ignoring late failure for '{}': {}", entry.queryKey,
              cause.getMessage());
          return;
        }
        entry.generation++;
        entry.disconnect();
      } finally {
        lock.unlock();
      }
      failed(entry, cause);
    }
  }

  /**
   * The shared listener of one query key. Guarded by the lock.
   */
  private static final class ListenerEntry {

    /** The query key. */
    private final String queryKey;

    /** The transport description of the query. */
    private final Object queryDescriptor;

    /** The live subscriptions of the query key. */
    private int references;

    /** The open connection, null while disconnected. */
    private StreamHandle handle;

    /** Incremented on every open and every failure. */
    private int generation;

    /** The pending reopen attempt, null when none. */
    private ScheduledFuture<?> reopen;

    private ListenerEntry(final String theQueryKey,
        final Object theQueryDescriptor) {
      queryKey = theQueryKey;
      queryDescriptor = theQueryDescriptor;
    }

    private boolean isConnected() {
      return handle != null;
    }

    /**
     * Closes the connection, if any.
     *
     * @return true if a connection was closed
     */
    private boolean disconnect() {
      if (handle == null) {
        return false;
      }
      final StreamHandle closing = handle;
      handle = null;
      try {
        closing.close();
      } catch (final RuntimeException e) {
        log.warn("Closing the listener for '{}' failed: {}", queryKey,
            e.getMessage());
      }
      return true;
    }

    private void cancelReopen() {
      if (reopen != null) {
        reopen.cancel(false);
        reopen = null;
      }
    }
  }
}
