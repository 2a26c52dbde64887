package com.blockscope.indexer.prevout;

import com.blockscope.domain.OutPoint;
import com.blockscope.domain.Prevout;
import com.blockscope.indexer.adapter.BitcoinRpcClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Resolves prevouts in parallel on a dedicated executor, at most {@code concurrency} lookups in flight.
 * Individual lookup failures are reported per item; a failure of the dispatch itself is thrown to the caller.
 */
@Slf4j
public class PrevoutWorkerPool {

    private final BitcoinRpcClient rpcClient;
    private final Executor executor;
    private final int concurrency;
    private final Semaphore permits;
    private volatile boolean closed;

    public PrevoutWorkerPool(BitcoinRpcClient rpcClient, Executor executor, int concurrency) {
        this.rpcClient = rpcClient;
        this.executor = executor;
        this.concurrency = Math.max(1, concurrency);
        this.permits = new Semaphore(this.concurrency);
    }

    public List<PrevoutLookupResult> fetchMany(List<OutPoint> outPoints) {
        if (closed) {
            throw new IllegalStateException("Prevout worker pool is closed");
        }
        List<CompletableFuture<PrevoutLookupResult>> futures = new ArrayList<>(outPoints.size());
        for (OutPoint op : outPoints) {
            futures.add(CompletableFuture.supplyAsync(() -> lookup(op), executor));
        }
        List<PrevoutLookupResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<PrevoutLookupResult> f : futures) {
            try {
                results.add(f.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw cause instanceof RuntimeException re ? re : new IllegalStateException(cause);
            }
        }
        return results;
    }

    private PrevoutLookupResult lookup(OutPoint op) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PrevoutLookupResult.failed(op, new IllegalStateException("Interrupted waiting for prevout worker", e));
        }
        try {
            Prevout prevout = PrevoutResolver.resolveViaRpc(rpcClient, op);
            return PrevoutLookupResult.ok(op, prevout);
        } catch (RuntimeException e) {
            return PrevoutLookupResult.failed(op, e);
        } finally {
            permits.release();
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void destroy() {
        if (!closed) {
            closed = true;
            log.debug("Prevout worker pool closed");
        }
    }
}
