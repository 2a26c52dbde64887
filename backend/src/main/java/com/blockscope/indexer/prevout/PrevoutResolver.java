package com.blockscope.indexer.prevout;

import com.blockscope.domain.OutPoint;
import com.blockscope.domain.Prevout;
import com.blockscope.indexer.adapter.BitcoinJson;
import com.blockscope.indexer.adapter.BitcoinRpcClient;
import com.blockscope.indexer.adapter.RpcNotFoundException;
import com.blockscope.indexer.status.IndexerMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves the outputs spent by transaction inputs. Lookups go cache first, then the worker pool, then
 * inline sequential RPC. A lookup that still fails resolves to null for that input only.
 */
@Slf4j
public class PrevoutResolver {

    public static final int MAX_RECOMMENDED_CONCURRENCY = 8;

    static final String SOURCE_CACHE = "cache";
    static final String SOURCE_RPC = "rpc";
    static final String SOURCE_MIXED = "mixed";
    static final String PATH_WORKER = "worker";
    static final String PATH_INLINE = "inline";

    private final BitcoinRpcClient rpcClient;
    private final Cache cache;
    private final IndexerMetrics metrics;
    private volatile PrevoutWorkerPool workerPool;
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong rpcCalls = new AtomicLong();

    /**
     * @param workerPool null runs every lookup inline
     */
    public PrevoutResolver(BitcoinRpcClient rpcClient, PrevoutWorkerPool workerPool, Cache cache, IndexerMetrics metrics) {
        this.rpcClient = rpcClient;
        this.workerPool = workerPool;
        this.cache = cache;
        this.metrics = metrics;
    }

    /** One entry per input of tx, in input order; null for coinbase and unresolvable inputs. */
    public List<Prevout> fetchPrevouts(JsonNode tx) {
        return fetchPrevouts(List.of(tx)).get(0);
    }

    /** Resolves every input of every transaction in one dispatch. */
    public List<List<Prevout>> fetchPrevouts(List<JsonNode> txs) {
        long startedAt = System.currentTimeMillis();
        Map<String, Prevout> resolved = new HashMap<>();
        Set<String> cachedKeys = new LinkedHashSet<>();
        Map<String, OutPoint> misses = new HashMap<>();
        List<OutPoint> missOrder = new ArrayList<>();

        for (JsonNode tx : txs) {
            for (JsonNode input : tx.path("vin")) {
                if (BitcoinJson.isCoinbase(input)) {
                    continue;
                }
                OutPoint op = new OutPoint(input.path("txid").asText(), input.path("vout").asInt());
                String key = op.key();
                if (resolved.containsKey(key) || misses.containsKey(key)) {
                    continue;
                }
                Prevout hit = cache != null ? cache.get(key, Prevout.class) : null;
                if (hit != null) {
                    resolved.put(key, hit);
                    cachedKeys.add(key);
                } else {
                    misses.put(key, op);
                    missOrder.add(op);
                }
            }
        }
        cacheHits.addAndGet(cachedKeys.size());

        String path = PATH_INLINE;
        if (!missOrder.isEmpty()) {
            PrevoutWorkerPool pool = workerPool;
            boolean dispatched = false;
            if (pool != null) {
                try {
                    for (PrevoutLookupResult r : pool.fetchMany(missOrder)) {
                        rpcCalls.incrementAndGet();
                        Prevout p = r.isFailed() ? resolveInline(r.outPoint(), r.error()) : r.prevout();
                        store(resolved, r.outPoint(), p);
                    }
                    dispatched = true;
                    path = PATH_WORKER;
                } catch (RuntimeException e) {
                    log.warn("Prevout worker dispatch failed, falling back to inline lookups for the rest of the run: {}",
                            e.getMessage());
                    workerPool = null;
                    pool.destroy();
                }
            }
            if (!dispatched) {
                for (OutPoint op : missOrder) {
                    store(resolved, op, resolveInline(op, null));
                }
            }
        }

        String source = missOrder.isEmpty() ? SOURCE_CACHE : (cachedKeys.isEmpty() ? SOURCE_RPC : SOURCE_MIXED);
        if (metrics != null && (!missOrder.isEmpty() || !cachedKeys.isEmpty())) {
            metrics.recordPrevoutDuration(System.currentTimeMillis() - startedAt, source, path);
        }

        List<List<Prevout>> out = new ArrayList<>(txs.size());
        for (JsonNode tx : txs) {
            List<Prevout> perTx = new ArrayList<>(tx.path("vin").size());
            for (JsonNode input : tx.path("vin")) {
                if (BitcoinJson.isCoinbase(input)) {
                    perTx.add(null);
                } else {
                    perTx.add(resolved.get(input.path("txid").asText() + ":" + input.path("vout").asInt()));
                }
            }
            out.add(perTx);
        }
        return out;
    }

    private Prevout resolveInline(OutPoint op, RuntimeException workerError) {
        if (workerError != null) {
            log.debug("Worker lookup failed for {}, retrying inline: {}", op.key(), workerError.getMessage());
        }
        rpcCalls.incrementAndGet();
        try {
            return resolveViaRpc(rpcClient, op);
        } catch (RuntimeException e) {
            log.warn("Prevout lookup failed for {}: {}", op.key(), e.getMessage());
            return null;
        }
    }

    private void store(Map<String, Prevout> resolved, OutPoint op, Prevout prevout) {
        resolved.put(op.key(), prevout);
        if (prevout != null && cache != null) {
            cache.put(op.key(), prevout);
        }
    }

    /**
     * getrawtransaction(txid, true) and read output vout. Returns null when the transaction or output does not exist.
     */
    static Prevout resolveViaRpc(BitcoinRpcClient rpcClient, OutPoint op) {
        JsonNode tx;
        try {
            tx = rpcClient.call("getrawtransaction", op.txid(), true);
        } catch (RpcNotFoundException e) {
            return null;
        }
        JsonNode output = tx != null ? BitcoinJson.findOutput(tx, op.vout()) : null;
        if (output == null) {
            return null;
        }
        return new Prevout(op.txid(), op.vout(), BitcoinJson.toSatoshis(output.path("value")),
                BitcoinJson.addressesOf(output.path("scriptPubKey")));
    }

    public boolean isWorkerPoolActive() {
        return workerPool != null;
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getRpcCalls() {
        return rpcCalls.get();
    }

    public void close() {
        PrevoutWorkerPool pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.destroy();
        }
    }
}
