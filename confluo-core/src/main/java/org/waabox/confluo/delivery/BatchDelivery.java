package org.waabox.confluo.delivery;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Several changes coalesced into one delivery.
 *
 * <p>Changes keep the order in which the stream emitted them.
 *
 * @param groupId   the identifier of the batch group, never null
 * @param updates   the coalesced changes, never null
 * @param count     the number of changes
 * @param timestamp the instant the batch was flushed, never null
 * @param attempt   zero for the first delivery attempt, incremented on
 *                  every retry
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BatchDelivery(String groupId, List<ChangeDelivery> updates,
    int count, Instant timestamp, int attempt) implements Delivery {

  /**
   * Validates the record components and freezes the update list.
   *
   * @throws NullPointerException if any reference component is null
   */
  public BatchDelivery {
    Objects.requireNonNull(groupId, "groupId must not be null");
    Objects.requireNonNull(updates, "updates must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    updates = List.copyOf(updates);
  }

  /**
   * Tells whether this delivery is a retry of a failed one.
   *
   * @return true if attempt is greater than zero
   */
  public boolean isRetry() {
    return attempt > 0;
  }

  /** {@inheritDoc} */
  @Override
  public String type() {
    return "batch";
  }
}
