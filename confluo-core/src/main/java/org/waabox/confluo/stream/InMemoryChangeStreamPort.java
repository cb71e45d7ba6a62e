package org.waabox.confluo.stream;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ChangeStreamPort} living entirely in the current process.
 *
 * <p>Changes are pushed programmatically through {@link #emit} and
 * connection failures are simulated through {@link #fail}. Useful to embed
 * the pool on top of an in-process event source, and for tests.
 *
 * <p>Thread safety: this class is thread-safe. Emissions for the same query
 * key are delivered on the calling thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryChangeStreamPort implements ChangeStreamPort {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(InMemoryChangeStreamPort.class);

  /** The open connections, keyed by query key. */
  private final Map<String, List<Connection>> connections =
      new ConcurrentHashMap<>();

  /** The number of opened connections, keyed by query key. */
  private final Map<String, AtomicInteger> opened = new ConcurrentHashMap<>();

  /** The number of closed connections, keyed by query key. */
  private final Map<String, AtomicInteger> closed = new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public StreamHandle open(final String queryKey,
      final Object queryDescriptor, final ChangeStreamHandler handler) {
    Objects.requireNonNull(queryKey, "queryKey must not be null");
    Objects.requireNonNull(handler, "handler must not be null");

    final Connection connection = new Connection(queryKey, handler);
    connections.computeIfAbsent(queryKey, k -> new CopyOnWriteArrayList<>())
        .add(connection);
    counter(opened, queryKey).incrementAndGet();

    log.debug("Opened in-memory stream for '{}'", queryKey);
    return connection::close;
  }

  /**
   * Pushes changes to every open connection of the given query key.
   *
   * @param queryKey the query key, never null
   * @param changes  the changes, in emission order
   *
   * @return the number of connections the changes were pushed to
   */
  public int emit(final String queryKey, final ChangeRecord... changes) {
    Objects.requireNonNull(queryKey, "queryKey must not be null");
    final List<ChangeRecord> batch = List.copyOf(Arrays.asList(changes));
    int delivered = 0;
    for (final Connection connection : openConnections(queryKey)) {
      connection.handler.onChanges(batch);
      delivered++;
    }
    return delivered;
  }

  /**
   * Fails every open connection of the given query key. Failed connections
   * are closed and receive no further changes.
   *
   * @param queryKey the query key, never null
   * @param cause    the failure reported to the handlers, never null
   *
   * @return the number of connections that were failed
   */
  public int fail(final String queryKey, final Throwable cause) {
    Objects.requireNonNull(queryKey, "queryKey must not be null");
    Objects.requireNonNull(cause, "cause must not be null");
    int failed = 0;
    for (final Connection connection : openConnections(queryKey)) {
      if (connection.terminate()) {
        connection.handler.onError(cause);
        failed++;
      }
    }
    return failed;
  }

  /**
   * Tells whether at least one connection is open for the query key.
   *
   * @param queryKey the query key, never null
   *
   * @return true if a connection is open
   */
  public boolean isOpen(final String queryKey) {
    return !openConnections(queryKey).isEmpty();
  }

  /**
   * Returns how many connections were ever opened for the query key.
   *
   * @param queryKey the query key, never null
   *
   * @return the open count
   */
  public int openCount(final String queryKey) {
    return counter(opened, queryKey).get();
  }

  /**
   * Returns how many connections were closed, by the pool or by a failure,
   * for the query key.
   *
   * @param queryKey the query key, never null
   *
   * @return the close count
   */
  public int closeCount(final String queryKey) {
    return counter(closed, queryKey).get();
  }

  private List<Connection> openConnections(final String queryKey) {
    return connections.getOrDefault(queryKey, List.of());
  }

  private static AtomicInteger counter(final Map<String, AtomicInteger> map,
      final String queryKey) {
    return map.computeIfAbsent(queryKey, k -> new AtomicInteger());
  }

  /** One open connection. */
  private final class Connection {

    /** The query key this connection serves. */
    private final String queryKey;

    /** The handler registered on open. */
    private final ChangeStreamHandler handler;

    /** Whether this connection is still open. */
    private final AtomicBoolean open = new AtomicBoolean(true);

    private Connection(final String theQueryKey,
        final ChangeStreamHandler theHandler) {
      queryKey = theQueryKey;
      handler = theHandler;
    }

    private boolean terminate() {
      if (!open.compareAndSet(true, false)) {
        return false;
      }
      final List<Connection> list = connections.get(queryKey);
      if (list != null) {
        list.remove(this);
      }
      counter(closed, queryKey).incrementAndGet();
      return true;
    }

    private void close() {
      if (terminate()) {
        log.debug("Closed in-memory stream for '{}'", queryKey);
      }
    }
  }
}
