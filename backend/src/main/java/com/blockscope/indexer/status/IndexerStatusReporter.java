package com.blockscope.indexer.status;

import com.blockscope.indexer.adapter.BitcoinRpcClient;
import com.blockscope.indexer.adapter.RpcException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps a bounded window of recent block samples and turns it, together with the chain tip, into an
 * {@link IndexerStatus}. Every computed status is pushed to {@link IndexerMetrics}.
 */
@Slf4j
public class IndexerStatusReporter {

    private final BitcoinRpcClient rpcClient;
    private final IndexerMetrics metrics;
    private final Clock clock;
    private final int windowSize;
    private final Deque<BlockSample> samples = new ArrayDeque<>();
    private volatile Tip lastKnownTip;

    public IndexerStatusReporter(BitcoinRpcClient rpcClient, IndexerMetrics metrics, Clock clock, int windowSize) {
        this.rpcClient = rpcClient;
        this.metrics = metrics;
        this.clock = clock;
        this.windowSize = Math.max(2, windowSize);
    }

    public void recordSample(long height, String hash, int txCount, long durationMs) {
        BlockSample sample = new BlockSample(height, hash, txCount, durationMs, clock.millis());
        synchronized (samples) {
            samples.addLast(sample);
            while (samples.size() > windowSize) {
                samples.removeFirst();
            }
        }
    }

    public List<BlockSample> getSamples() {
        synchronized (samples) {
            return new ArrayList<>(samples);
        }
    }

    /**
     * @param checkpointHeight stored last processed height, null or negative when nothing has been indexed
     * @param refreshTip       query the node for the current tip; otherwise reuse the last known tip marked stale
     */
    public IndexerStatus getStatus(boolean refreshTip, Long checkpointHeight, String checkpointHash, boolean syncInProgress) {
        List<BlockSample> window = getSamples();
        BlockSample newest = window.isEmpty() ? null : window.get(window.size() - 1);

        IndexerStatus.BlockRef lastProcessed = null;
        if (checkpointHeight != null && checkpointHeight >= 0) {
            lastProcessed = new IndexerStatus.BlockRef(checkpointHeight, checkpointHash);
        } else if (newest != null) {
            lastProcessed = new IndexerStatus.BlockRef(newest.height(), newest.hash());
        }

        IndexerStatus.ChainTip chainTip;
        String tipError = null;
        if (refreshTip) {
            try {
                JsonNode count = rpcClient.call("getblockcount");
                long height = count.asLong();
                String hash = rpcClient.call("getblockhash", height).asText(null);
                lastKnownTip = new Tip(height, hash);
                chainTip = new IndexerStatus.ChainTip(height, hash, false, null);
            } catch (RpcException e) {
                tipError = e.getMessage() != null ? e.getMessage() : "Failed to fetch chain tip";
                log.warn("Chain tip refresh failed: {}", tipError);
                Tip known = lastKnownTip;
                chainTip = new IndexerStatus.ChainTip(known != null ? known.height() : null,
                        known != null ? known.hash() : null, true, tipError);
            }
        } else {
            Tip known = lastKnownTip;
            chainTip = known != null ? new IndexerStatus.ChainTip(known.height(), known.hash(), true, null) : null;
        }

        Long tipHeight = tipError == null && chainTip != null ? chainTip.height() : null;
        Long blocksRemaining = null;
        Double progressPercent = null;
        if (tipHeight != null) {
            long processed = lastProcessed != null ? lastProcessed.height() : -1;
            blocksRemaining = Math.max(0, tipHeight - processed);
            if (tipHeight > 0) {
                double pct = 100.0 * Math.max(0, processed) / tipHeight;
                progressPercent = Math.min(100.0, Math.max(0.0, pct));
            } else {
                progressPercent = processed >= 0 ? 100.0 : 0.0;
            }
        }

        IndexerStatus.Throughput throughput = throughput(window);
        Long eta = null;
        if (blocksRemaining != null && throughput.blocksPerSecond() != null && throughput.blocksPerSecond() > 0) {
            eta = Math.round(blocksRemaining / throughput.blocksPerSecond() * 1000.0);
        }

        SyncState state;
        if (tipError != null) {
            state = SyncState.DEGRADED;
        } else if (window.isEmpty() && lastProcessed == null) {
            state = SyncState.STARTING;
        } else if (blocksRemaining != null && blocksRemaining > 0) {
            state = SyncState.CATCHING_UP;
        } else if (blocksRemaining != null) {
            state = SyncState.SYNCED;
        } else {
            state = syncInProgress ? SyncState.CATCHING_UP : SyncState.STARTING;
        }

        IndexerStatus status = new IndexerStatus(true, state, syncInProgress, lastProcessed, chainTip,
                blocksRemaining, progressPercent, throughput, eta, null);
        if (metrics != null) {
            metrics.recordSyncStatus(status);
        }
        return status;
    }

    static IndexerStatus.Throughput throughput(List<BlockSample> window) {
        if (window.size() < 2) {
            return new IndexerStatus.Throughput(window.size(), 0, null, null);
        }
        long windowMs = window.get(window.size() - 1).timestampMs() - window.get(0).timestampMs();
        if (windowMs <= 0) {
            return new IndexerStatus.Throughput(window.size(), 0, null, null);
        }
        double seconds = windowMs / 1000.0;
        long txTotal = 0;
        for (BlockSample s : window) {
            txTotal += s.txCount();
        }
        return new IndexerStatus.Throughput(window.size(), windowMs, window.size() / seconds, txTotal / seconds);
    }

    private record Tip(long height, String hash) {
    }
}
