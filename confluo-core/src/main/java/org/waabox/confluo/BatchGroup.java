package org.waabox.confluo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.waabox.confluo.delivery.BatchDelivery;
import org.waabox.confluo.delivery.ChangeDelivery;

/**
 * A transient accumulation of changes of one source, flushed as a single
 * {@link BatchDelivery}.
 *
 * <p>Lifecycle: {@code PENDING} while it accumulates and while a flush is
 * queued, {@code PROCESSING} while the listener runs, then
 * {@code COMPLETED}, or {@code FAILED} until a retry puts it back to
 * {@code PENDING}.
 *
 * <p>Guarded by the lock of the owning {@link BatchAggregator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class BatchGroup {

  /** The processing states of a group. */
  enum State {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }

  /** The group identifier. */
  private final String groupId;

  /** The subscription whose changes the group holds. */
  private final Subscription owner;

  /** The changes, in arrival order. */
  private final List<ChangeItem> items = new ArrayList<>();

  /** The creation instant. */
  private final Instant createdAt;

  /** The instant the last change was added. */
  private Instant lastModified;

  /** The processing state. */
  private State state = State.PENDING;

  /** The failed delivery attempts. */
  private int errorCount;

  BatchGroup(final String theGroupId, final Subscription theOwner,
      final Instant theCreatedAt) {
    groupId = theGroupId;
    owner = theOwner;
    createdAt = theCreatedAt;
    lastModified = theCreatedAt;
  }

  String groupId() {
    return groupId;
  }

  String source() {
    return owner.id();
  }

  Subscription owner() {
    return owner;
  }

  Instant createdAt() {
    return createdAt;
  }

  Instant lastModified() {
    return lastModified;
  }

  State state() {
    return state;
  }

  void state(final State theState) {
    state = theState;
  }

  int errorCount() {
    return errorCount;
  }

  int size() {
    return items.size();
  }

  boolean isEmpty() {
    return items.isEmpty();
  }

  boolean isCompleted() {
    return state == State.COMPLETED;
  }

  void add(final ChangeItem item) {
    items.add(item);
    lastModified = item.timestamp();
  }

  /**
   * Records a failed attempt.
   *
   * @return the failed attempts so far
   */
  int failed() {
    errorCount++;
    state = State.FAILED;
    return errorCount;
  }

  /** Puts a failed group back to pending for another attempt. */
  void retry() {
    state = State.PENDING;
    for (final ChangeItem item : items) {
      item.retried();
    }
  }

  BatchDelivery toDelivery(final Instant now) {
    final List<ChangeDelivery> updates = new ArrayList<>(items.size());
    for (final ChangeItem item : items) {
      updates.add(item.toDelivery());
    }
    return new BatchDelivery(groupId, updates, updates.size(), now,
        errorCount);
  }
}
