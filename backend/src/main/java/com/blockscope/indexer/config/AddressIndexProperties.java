package com.blockscope.indexer.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Address indexer settings: storage location, prevout fan-out, store sizing and sync pacing.
 */
@ConfigurationProperties(prefix = "blockscope.address-index")
@NoArgsConstructor
@Getter
@Setter
public class AddressIndexProperties {

    /** Master switch. When false the indexer is never started and status reports "disabled". */
    private boolean enabled = true;

    /** Directory holding the embedded index database. */
    private String indexPath = "./data/address-index";

    /** Consecutive unused addresses scanned per xpub branch before stopping. */
    private int xpubGapLimit = 20;

    /** Worker count for parallel prevout lookups (capped at 8). */
    private int prevoutConcurrency = 4;

    /** When false, prevouts are always fetched inline one by one. */
    private boolean parallelPrevoutEnabled = true;

    private long prevoutCacheMax = 50_000;

    private long prevoutCacheTtlMs = 600_000;

    /** SQLite page cache in bytes; 0 keeps the driver default. */
    private long storeCacheBytes = 64L * 1024 * 1024;

    /** WAL size in bytes before an automatic checkpoint; 0 keeps the driver default. */
    private long storeWriteBufferBytes = 16L * 1024 * 1024;

    /** Blocks committed per transaction during backfill. 1 means one transaction per block. */
    private int batchBlockCount = 1;

    /** Upper bound on how long shutdown waits for in-flight block processing. */
    private long shutdownDrainTimeoutMs = 10_000;

    /** Number of recent block samples kept for throughput and ETA. */
    private int statusSampleWindow = 120;

    private int blockFetchMaxAttempts = 15;

    private long blockFetchBaseDelayMs = 200;

    /** How often the chain tip is polled for new blocks. */
    private long tipPollIntervalMs = 5_000;
}
