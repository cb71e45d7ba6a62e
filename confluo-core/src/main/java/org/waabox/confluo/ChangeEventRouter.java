package org.waabox.confluo;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.confluo.delivery.ChangeDelivery;
import org.waabox.confluo.delivery.ErrorDelivery;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.stream.ChangeRecord;
import org.waabox.confluo.stream.ChangeStreamException;

/**
 * Fans the emissions of a change stream out to the subscriptions of its
 * query key.
 *
 * <p>The subscription list is a snapshot taken when an emission arrives,
 * so subscriptions added halfway through wait for the next emission.
 * Subscriptions removed halfway through, even by another listener of the
 * same dispatch, are skipped from then on. For each
 * subscription, changes either go to the {@link BatchAggregator} or are
 * delivered immediately, in emission order. Errors are always delivered
 * immediately to every subscription.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ChangeEventRouter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ChangeEventRouter.class);

  /** Where the subscriptions of a query key are looked up. */
  private final SubscriptionRegistry registry;

  /** Where batched subscriptions get their changes. */
  private final BatchAggregator aggregator;

  /** The per-subscription circuit breaker. */
  private final CircuitBreaker circuitBreaker;

  /** Where handling times are accumulated. */
  private final MetricsCollector collector;

  /** The metrics reporter. */
  private final ConfluoMetrics metrics;

  /** The clock stamping deliveries. */
  private final Clock clock;

  ChangeEventRouter(final SubscriptionRegistry theRegistry,
      final BatchAggregator theAggregator,
      final CircuitBreaker theCircuitBreaker,
      final MetricsCollector theCollector, final ConfluoMetrics theMetrics,
      final Clock theClock) {
    registry = theRegistry;
    aggregator = theAggregator;
    circuitBreaker = theCircuitBreaker;
    collector = theCollector;
    metrics = theMetrics;
    clock = theClock;
  }

  /**
   * Routes one emission of the stream of a query key.
   *
   * @param queryKey the query key, never null
   * @param changes  the changes in emission order, never null
   */
  void routeChanges(final String queryKey, final List<ChangeRecord> changes) {
    final List<Subscription> targets = registry.snapshot(queryKey);
    if (targets.isEmpty() || changes.isEmpty()) {
      return;
    }

    final long start = System.nanoTime();
    for (final ChangeRecord change : changes) {
      for (final Subscription subscription : targets) {
        if (!subscription.isActive()) {
          continue;
        }
        if (subscription.options().batchUpdates()) {
          aggregator.add(subscription, change);
        } else {
          deliverNow(subscription, change);
        }
      }
    }
    collector.recordResponseTime(System.nanoTime() - start);
  }

  /**
   * Delivers a stream failure to every subscription of a query key.
   *
   * @param queryKey the query key, never null
   * @param cause    the failure, never null
   */
  void routeError(final String queryKey, final Throwable cause) {
    final String message = cause.getMessage() != null
        ? cause.getMessage() : cause.getClass().getName();
    final ErrorDelivery delivery = new ErrorDelivery(message,
        ChangeStreamException.codeOf(cause));

    for (final Subscription subscription : registry.snapshot(queryKey)) {
      if (!subscription.isActive()) {
        continue;
      }
      try {
        subscription.deliver(delivery);
      } catch (final Exception e) {
        log.warn("Subscription '{}' threw while receiving the error of '{}':"
            + " {}", subscription.id(), queryKey, e.getMessage());
      }
    }
  }

  private void deliverNow(final Subscription subscription,
      final ChangeRecord change) {
    final String source = subscription.id();
    if (!circuitBreaker.allows(source)) {
      log.warn("Circuit open for source '{}', dropping change '{}'",
          source, change.id());
      return;
    }
    try {
      subscription.deliver(ChangeDelivery.of(change));
    } catch (final Exception e) {
      log.warn("Subscription '{}' failed to handle change '{}': {}",
          source, change.id(), e.getMessage());
      metrics.deliveryFailed(source, e);
      circuitBreaker.recordFailure(source);
      return;
    }
    subscription.delivered(1, clock.instant());
    circuitBreaker.recordSuccess(source);
  }
}
