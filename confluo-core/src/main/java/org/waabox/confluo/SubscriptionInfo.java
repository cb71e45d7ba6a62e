package org.waabox.confluo;

import java.time.Instant;

/**
 * A read only view of a live subscription.
 *
 * @param id          the subscription identifier, never null
 * @param queryKey    the watched query key, never null
 * @param options     the resolved options, never null
 * @param createdAt   the instant the subscription was created, never null
 * @param lastUpdate  the instant of the last delivery, or of the creation
 *                    when nothing was delivered yet, never null
 * @param updateCount the number of changes delivered so far
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SubscriptionInfo(
    String id,
    String queryKey,
    SubscriptionOptions options,
    Instant createdAt,
    Instant lastUpdate,
    long updateCount
) {
}
