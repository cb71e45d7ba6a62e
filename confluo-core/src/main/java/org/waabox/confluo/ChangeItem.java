package org.waabox.confluo;

import java.time.Instant;

import org.waabox.confluo.delivery.ChangeDelivery;
import org.waabox.confluo.stream.ChangeRecord;

/**
 * A change waiting in a {@link BatchGroup}.
 *
 * <p>Guarded by the lock of the owning {@link BatchAggregator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ChangeItem {

  /** The change as emitted by the stream. */
  private final ChangeRecord change;

  /** When the change entered the aggregator. */
  private final Instant timestamp;

  /** The batch source the change belongs to. */
  private final String source;

  /** How many times the change was redelivered. */
  private int retryCount;

  ChangeItem(final ChangeRecord theChange, final Instant theTimestamp,
      final String theSource) {
    change = theChange;
    timestamp = theTimestamp;
    source = theSource;
  }

  String id() {
    return change.id();
  }

  Instant timestamp() {
    return timestamp;
  }

  String source() {
    return source;
  }

  int retryCount() {
    return retryCount;
  }

  void retried() {
    retryCount++;
  }

  ChangeDelivery toDelivery() {
    return ChangeDelivery.of(change);
  }
}
