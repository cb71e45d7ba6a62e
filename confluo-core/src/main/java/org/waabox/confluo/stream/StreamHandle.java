package org.waabox.confluo.stream;

/**
 * A handle to an open change-stream connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface StreamHandle extends AutoCloseable {

  /**
   * Releases the underlying connection. Calling it more than once has no
   * further effect.
   */
  @Override
  void close();
}
