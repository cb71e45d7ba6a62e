package org.waabox.confluo.stream;

import java.util.List;

/**
 * Receives what a live change-stream connection pushes.
 *
 * <p>A handler is registered once per opened connection. Implementations
 * of {@link ChangeStreamPort} may invoke it from any thread, but must not
 * invoke it concurrently for the same connection: changes are expected in
 * emission order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeStreamHandler {

  /**
   * Called with the changes of one emission of the stream.
   *
   * @param changes the changes in emission order, never null
   */
  void onChanges(List<ChangeRecord> changes);

  /**
   * Called once when the connection fails. No further calls follow for the
   * same connection.
   *
   * @param cause the failure, never null
   */
  void onError(Throwable cause);
}
