package org.waabox.confluo;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.waabox.confluo.delivery.DeliveryListener;

/**
 * Owns the live subscriptions, grouped by query key.
 *
 * <p>Assigns subscription identities and keeps, per query key, the
 * subscriptions in creation order. Every method runs under the pool lock,
 * shared with the {@link ListenerMultiplexer}, so a subscription and the
 * reference it holds on its listener are added and removed atomically.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SubscriptionRegistry {

  /** The pool lock. */
  private final ReentrantLock lock;

  /** The clock stamping creation times. */
  private final Clock clock;

  /** The subscriptions of each query key, in creation order. */
  private final Map<String, List<Subscription>> groups = new LinkedHashMap<>();

  /** The subscriptions, keyed by id. */
  private final Map<String, Subscription> byId = new HashMap<>();

  /**
   * Creates a new registry.
   *
   * @param theLock  the pool lock, never null
   * @param theClock the clock, never null
   */
  SubscriptionRegistry(final ReentrantLock theLock, final Clock theClock) {
    lock = theLock;
    clock = theClock;
  }

  /**
   * Creates a subscription and appends it to the group of its query key.
   *
   * @param queryKey the query key, never null
   * @param listener the listener, never null
   * @param options  the resolved options, never null
   *
   * @return the new subscription, never null
   */
  Subscription register(final String queryKey,
      final DeliveryListener listener, final SubscriptionOptions options) {
    lock.lock();
    try {
      final Subscription subscription = new Subscription(newId(), queryKey,
          listener, options, clock.instant());
      byId.put(subscription.id(), subscription);
      groups.computeIfAbsent(queryKey, k -> new ArrayList<>())
          .add(subscription);
      return subscription;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a subscription and deactivates it, so in-flight dispatches skip
   * it. The group of its query key is dropped when it becomes empty.
   *
   * @param subscriptionId the subscription id, never null
   *
   * @return the removed subscription, empty if the id is unknown
   */
  Optional<Subscription> remove(final String subscriptionId) {
    lock.lock();
    try {
      final Subscription subscription = byId.remove(subscriptionId);
      if (subscription == null) {
        return Optional.empty();
      }
      subscription.deactivate();
      final List<Subscription> group = groups.get(subscription.queryKey());
      if (group != null) {
        group.remove(subscription);
        if (group.isEmpty()) {
          groups.remove(subscription.queryKey());
        }
      }
      return Optional.of(subscription);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Looks up a subscription.
   *
   * @param subscriptionId the subscription id, never null
   *
   * @return the subscription, empty if the id is unknown
   */
  Optional<Subscription> find(final String subscriptionId) {
    lock.lock();
    try {
      return Optional.ofNullable(byId.get(subscriptionId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes a snapshot of the subscriptions of a query key. Later changes to
   * the registry do not affect the returned list.
   *
   * @param queryKey the query key, never null
   *
   * @return the subscriptions in creation order, never null
   */
  List<Subscription> snapshot(final String queryKey) {
    lock.lock();
    try {
      final List<Subscription> group = groups.get(queryKey);
      return group == null ? List.of() : List.copyOf(group);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes a snapshot of every live subscription.
   *
   * @return the subscriptions grouped by query key, never null
   */
  List<Subscription> all() {
    lock.lock();
    try {
      final List<Subscription> all = new ArrayList<>(byId.size());
      for (final List<Subscription> group : groups.values()) {
        all.addAll(group);
      }
      return all;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of live subscriptions.
   *
   * @return the subscription count
   */
  int size() {
    lock.lock();
    try {
      return byId.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of live subscriptions whose query is targeted.
   *
   * @return the targeted subscription count
   */
  int targetedCount() {
    lock.lock();
    try {
      int targeted = 0;
      for (final Subscription subscription : byId.values()) {
        if (subscription.options().targetedQuery()) {
          targeted++;
        }
      }
      return targeted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of query keys with at least one subscription.
   *
   * @return the group count
   */
  int groupCount() {
    lock.lock();
    try {
      return groups.size();
    } finally {
      lock.unlock();
    }
  }

  /** Forgets every subscription. */
  void clear() {
    lock.lock();
    try {
      for (final Subscription subscription : byId.values()) {
        subscription.deactivate();
      }
      groups.clear();
      byId.clear();
    } finally {
      lock.unlock();
    }
  }

  private static String newId() {
    return "sub_" + UUID.randomUUID();
  }
}
