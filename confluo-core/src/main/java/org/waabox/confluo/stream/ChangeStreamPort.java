package org.waabox.confluo.stream;

/**
 * The transport that opens live change-stream connections against the
 * remote data store.
 *
 * <p>Implementations wrap a concrete client (a document database snapshot
 * listener, a change-data-capture feed, a websocket channel). The pool
 * opens at most one connection per query key through this port and closes
 * it once the last subscription for the key goes away.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeStreamPort {

  /**
   * Opens a live connection for the given query.
   *
   * @param queryKey        the canonical key of the query, never null
   * @param queryDescriptor the transport specific description of the query,
   *                        may be null
   * @param handler         the handler receiving changes and the terminal
   *                        error, never null
   *
   * @return the handle used to close the connection, never null
   *
   * @throws ChangeStreamException if the connection cannot be opened
   */
  StreamHandle open(String queryKey, Object queryDescriptor,
      ChangeStreamHandler handler);
}
