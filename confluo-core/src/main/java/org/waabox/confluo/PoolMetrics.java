package org.waabox.confluo;

/**
 * A point in time view of the pool.
 *
 * @param activeListeners       the change-stream connections currently
 *                              open
 * @param sharedListeners       the live subscriptions served by a
 *                              connection another subscription opened
 * @param totalSubscriptions    the live subscriptions
 * @param batchedUpdates        the changes delivered through batches since
 *                              the pool was built
 * @param memoryUsageEstimate   a rough estimate of the bytes held by
 *                              listeners, subscription groups and batch
 *                              groups
 * @param averageResponseTimeMs the moving average of the time spent handling
 *                              one emission of a stream, in milliseconds
 * @param openCircuits          the sources whose circuit is open
 * @param pendingBatchGroups    the batch groups not yet delivered
 * @param totalBatches          the batch delivery attempts, retries
 *                              included
 * @param averageBatchSize      the mean changes per batch delivery attempt
 * @param averageBatchProcessingTimeMs the moving average of the time
 *                              listeners took to handle a batch, in
 *                              milliseconds
 * @param batchErrorRate        the share of batch delivery attempts the
 *                              listener rejected, between 0 and 1
 * @param targetedSubscriptions the live subscriptions of a targeted query
 * @param broadSubscriptions    the live subscriptions of a broad query
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PoolMetrics(
    int activeListeners,
    int sharedListeners,
    int totalSubscriptions,
    long batchedUpdates,
    long memoryUsageEstimate,
    double averageResponseTimeMs,
    int openCircuits,
    int pendingBatchGroups,
    long totalBatches,
    double averageBatchSize,
    double averageBatchProcessingTimeMs,
    double batchErrorRate,
    int targetedSubscriptions,
    int broadSubscriptions
) {
}
