package org.waabox.confluo.delivery;

/**
 * An envelope handed to a {@link DeliveryListener}.
 *
 * <p>There are three shapes:
 * <ul>
 *   <li>{@link ChangeDelivery}: one change, delivered immediately.</li>
 *   <li>{@link BatchDelivery}: several coalesced changes.</li>
 *   <li>{@link ErrorDelivery}: the stream of the subscription failed.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public sealed interface Delivery
    permits ChangeDelivery, BatchDelivery, ErrorDelivery {

  /**
   * Returns the envelope type: {@code added}, {@code modified},
   * {@code removed}, {@code batch} or {@code error}.
   *
   * @return the type name, never null
   */
  String type();
}
