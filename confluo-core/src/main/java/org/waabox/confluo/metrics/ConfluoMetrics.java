package org.waabox.confluo.metrics;

/**
 * An abstraction for recording operational events of a Confluo pool.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopConfluoMetrics}
 * when metrics collection is not required. Pool wide gauges are also
 * available on demand through {@code Confluo#metrics()}.
 *
 * <p>Implementations are invoked from stream and scheduler threads and must
 * not block.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ConfluoMetrics {

  /**
   * Records that a change-stream connection was opened.
   *
   * @param queryKey the query key served by the connection, never null
   */
  void listenerOpened(String queryKey);

  /**
   * Records that a change-stream connection was closed because its last
   * subscription went away.
   *
   * @param queryKey the query key served by the connection, never null
   */
  void listenerClosed(String queryKey);

  /**
   * Records a connection level failure.
   *
   * @param queryKey the query key served by the connection, never null
   * @param cause    the failure, never null
   */
  void streamFailed(String queryKey, Throwable cause);

  /**
   * Records a successful batch delivery.
   *
   * @param source     the batch source, never null
   * @param size       the number of changes delivered
   * @param durationMs the time the listener took, in milliseconds
   */
  void batchDelivered(String source, int size, long durationMs);

  /**
   * Records a delivery the listener rejected by throwing.
   *
   * @param source the delivery source, never null
   * @param cause  the exception thrown by the listener, never null
   */
  void deliveryFailed(String source, Throwable cause);

  /**
   * Records that the circuit of a source opened.
   *
   * @param source the source, never null
   */
  void circuitOpened(String source);
}
