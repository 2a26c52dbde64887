package com.blockscope.indexer.status;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Micrometer meters for the address indexer: block and prevout timers plus gauges fed from the latest status.
 */
@Component
public class IndexerMetrics {

    public static final String BLOCK_DURATION = "address_indexer.block.duration";
    public static final String PREVOUT_DURATION = "address_indexer.prevout.duration";
    public static final String SYNC_PREFIX = "address_indexer.sync.";

    private final MeterRegistry registry;
    private final AtomicReference<IndexerStatus> latest = new AtomicReference<>();

    public IndexerMetrics(MeterRegistry registry) {
        this.registry = registry;
        gauge("blocks_remaining", s -> s.blocksRemaining());
        gauge("progress_percent", s -> s.progressPercent());
        gauge("eta_seconds", s -> s.estimatedCompletionMs() != null ? s.estimatedCompletionMs() / 1000.0 : null);
        gauge("tip_height", s -> s.chainTip() != null ? s.chainTip().height() : null);
        gauge("last_processed_height", s -> s.lastProcessed() != null ? s.lastProcessed().height() : null);
        gauge("in_progress", s -> s.syncInProgress() ? 1 : 0);
        for (SyncState state : SyncState.values()) {
            Gauge.builder(SYNC_PREFIX + "state", latest,
                            ref -> ref.get() != null && ref.get().state() == state ? 1.0 : 0.0)
                    .tag("state", state.code())
                    .register(registry);
        }
    }

    private void gauge(String name, Function<IndexerStatus, Number> f) {
        Gauge.builder(SYNC_PREFIX + name, latest, ref -> {
                    IndexerStatus s = ref.get();
                    if (s == null) {
                        return Double.NaN;
                    }
                    Number n = f.apply(s);
                    return n != null ? n.doubleValue() : Double.NaN;
                })
                .register(registry);
    }

    public void recordBlockDuration(long durationMs, boolean success) {
        Timer.builder(BLOCK_DURATION)
                .tag("outcome", success ? "success" : "error")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordPrevoutDuration(long durationMs, String source, String path) {
        Timer.builder(PREVOUT_DURATION)
                .tag("source", source)
                .tag("path", path)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSyncStatus(IndexerStatus status) {
        latest.set(status);
    }
}
