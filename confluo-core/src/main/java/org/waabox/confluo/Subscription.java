package org.waabox.confluo;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import org.waabox.confluo.delivery.Delivery;
import org.waabox.confluo.delivery.DeliveryListener;

/**
 * A live subscription, owned by the {@link SubscriptionRegistry}.
 *
 * <p>The identity, query key, listener and options never change. The
 * delivery counters are updated from stream and scheduler threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Subscription {

  /** The opaque identifier handed to the caller. */
  private final String id;

  /** The watched query key. */
  private final String queryKey;

  /** The listener receiving deliveries. */
  private final DeliveryListener listener;

  /** The resolved options. */
  private final SubscriptionOptions options;

  /** The creation instant. */
  private final Instant createdAt;

  /** The instant of the last delivery. */
  private volatile Instant lastUpdate;

  /** The number of changes delivered. */
  private final AtomicLong updateCount = new AtomicLong();

  /** False once the registry removed the subscription. */
  private volatile boolean active = true;

  Subscription(final String theId, final String theQueryKey,
      final DeliveryListener theListener, final SubscriptionOptions theOptions,
      final Instant theCreatedAt) {
    id = theId;
    queryKey = theQueryKey;
    listener = theListener;
    options = theOptions;
    createdAt = theCreatedAt;
    lastUpdate = theCreatedAt;
  }

  String id() {
    return id;
  }

  String queryKey() {
    return queryKey;
  }

  SubscriptionOptions options() {
    return options;
  }

  /**
   * Tells whether the subscription is still registered. Once false, it
   * never becomes true again.
   *
   * @return true until the subscription is removed
   */
  boolean isActive() {
    return active;
  }

  /** Marks the subscription as removed. */
  void deactivate() {
    active = false;
  }

  /**
   * Hands a delivery to the listener. Exceptions thrown by the listener
   * propagate to the caller.
   *
   * @param delivery the delivery, never null
   */
  void deliver(final Delivery delivery) {
    listener.onDelivery(delivery);
  }

  /**
   * Accounts for changes the listener accepted.
   *
   * @param changes the number of changes
   * @param at      the delivery instant, never null
   */
  void delivered(final int changes, final Instant at) {
    updateCount.addAndGet(changes);
    lastUpdate = at;
  }

  SubscriptionInfo info() {
    return new SubscriptionInfo(id, queryKey, options, createdAt, lastUpdate,
        updateCount.get());
  }
}
