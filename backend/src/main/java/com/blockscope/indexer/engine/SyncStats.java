package com.blockscope.indexer.engine;

/**
 * Counters accumulated since start.
 */
public record SyncStats(
        IndexerLifecycleState lifecycleState,
        long lastProcessedHeight,
        long blocksProcessed,
        long transactionsProcessed,
        long prevoutCacheHits,
        long prevoutRpcCalls
) {
}
