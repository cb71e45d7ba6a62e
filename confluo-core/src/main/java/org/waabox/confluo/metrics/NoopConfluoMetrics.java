package org.waabox.confluo.metrics;

/**
 * A no-operation implementation of {@link ConfluoMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopConfluoMetrics implements ConfluoMetrics {

  /** {@inheritDoc} */
  @Override
  public void listenerOpened(final String queryKey) {
  }

  /** {@inheritDoc} */
  @Override
  public void listenerClosed(final String queryKey) {
  }

  /** {@inheritDoc} */
  @Override
  public void streamFailed(final String queryKey, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void batchDelivered(final String source, final int size,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void deliveryFailed(final String source, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void circuitOpened(final String source) {
  }
}
