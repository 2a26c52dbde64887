package com.blockscope.indexer.status;

/**
 * Snapshot of indexer sync progress. Nullable numbers are unknown rather than zero.
 */
public record IndexerStatus(
        boolean featureEnabled,
        SyncState state,
        boolean syncInProgress,
        BlockRef lastProcessed,
        ChainTip chainTip,
        Long blocksRemaining,
        Double progressPercent,
        Throughput throughput,
        Long estimatedCompletionMs,
        String error
) {

    public record BlockRef(Long height, String hash) {
    }

    /** stale is true when the tip was not refreshed for this snapshot; error holds the refresh failure. */
    public record ChainTip(Long height, String hash, boolean stale, String error) {
    }

    public record Throughput(int sampleCount, long windowMs, Double blocksPerSecond, Double transactionsPerSecond) {

        public static Throughput empty() {
            return new Throughput(0, 0, null, null);
        }
    }

    /** Status with no progress information, used when the indexer is disabled, failed or not running yet. */
    public static IndexerStatus empty(boolean featureEnabled, SyncState state, boolean syncInProgress, String error) {
        return new IndexerStatus(featureEnabled, state, syncInProgress, null, null, null, null,
                Throughput.empty(), null, error);
    }
}
