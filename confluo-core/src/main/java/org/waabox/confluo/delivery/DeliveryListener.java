package org.waabox.confluo.delivery;

/**
 * Receives the deliveries of one subscription.
 *
 * <p>Immediate change deliveries and error deliveries arrive on the thread
 * of the change stream; batch deliveries, and errors met while opening a
 * stream, arrive on the pool scheduler thread. The pool does not hold its
 * lock while invoking listeners, so a slow listener does not block
 * subscribe or unsubscribe calls. Changes a transport emits from within
 * its own open call are the exception. An exception thrown from a batch
 * delivery makes the pool retry the batch with exponential backoff.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface DeliveryListener {

  /**
   * Called for every delivery of the subscription.
   *
   * @param delivery the envelope, never null
   */
  void onDelivery(Delivery delivery);
}
