package com.blockscope.indexer.engine;

public enum IndexerLifecycleState {
    UNINITIALIZED,
    OPENING,
    RECONCILING,
    BACKFILLING,
    LIVE,
    STOPPING,
    CLOSED,
    /** start() threw; the error is kept for status reporting. */
    FAILED
}
