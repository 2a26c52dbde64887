package com.blockscope.indexer.engine;

import com.blockscope.common.RetryPolicy;
import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.AddressTransactionPage;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.domain.BlockNewEvent;
import com.blockscope.domain.DerivedAddress;
import com.blockscope.domain.Prevout;
import com.blockscope.domain.XpubRecord;
import com.blockscope.indexer.adapter.BitcoinJson;
import com.blockscope.indexer.adapter.BitcoinRpcClient;
import com.blockscope.indexer.adapter.RpcException;
import com.blockscope.indexer.adapter.RpcNotFoundException;
import com.blockscope.indexer.config.AddressIndexProperties;
import com.blockscope.indexer.feed.ChainEventFeed;
import com.blockscope.indexer.prevout.PrevoutResolver;
import com.blockscope.indexer.status.IndexerMetrics;
import com.blockscope.indexer.status.IndexerStatus;
import com.blockscope.indexer.status.IndexerStatusReporter;
import com.blockscope.indexer.store.AddressCredit;
import com.blockscope.indexer.store.AddressDebit;
import com.blockscope.indexer.store.AddressIndexStore;
import com.blockscope.indexer.store.BlockDelta;
import com.blockscope.indexer.store.TransactionDelta;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replays the chain from the node into the address index and keeps it current.
 * <p>
 * start() opens the store, reconciles the checkpoint with the stored rows, backfills every block above the
 * checkpoint in ascending order and then follows {@link BlockNewEvent}s. Live blocks are applied one at a time on
 * the sync executor. Blocks are applied idempotently, so replaying a block already in the index changes nothing.
 */
@Slf4j
public class AddressIndexer {

    private static final long DRAIN_POLL_MS = 50;

    private final AddressIndexProperties properties;
    private final BitcoinRpcClient rpcClient;
    private final ChainEventFeed feed;
    private final PrevoutResolver prevoutResolver;
    private final IndexerStatusReporter statusReporter;
    private final IndexerMetrics metrics;
    private final RetryPolicy blockFetchPolicy;
    private final Executor syncExecutor;

    private final AtomicBoolean syncInProgress = new AtomicBoolean();
    private final AtomicLong blocksProcessed = new AtomicLong();
    private final AtomicLong transactionsProcessed = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile IndexerLifecycleState state = IndexerLifecycleState.UNINITIALIZED;
    private volatile boolean stopping;
    private volatile AddressIndexStore store;
    private volatile ChainEventFeed.Subscription subscription;
    private volatile String lastError;

    public AddressIndexer(AddressIndexProperties properties,
                          BitcoinRpcClient rpcClient,
                          ChainEventFeed feed,
                          PrevoutResolver prevoutResolver,
                          IndexerStatusReporter statusReporter,
                          IndexerMetrics metrics,
                          RetryPolicy blockFetchPolicy,
                          Executor syncExecutor) {
        this.properties = properties;
        this.rpcClient = rpcClient;
        this.feed = feed;
        this.prevoutResolver = prevoutResolver;
        this.statusReporter = statusReporter;
        this.metrics = metrics;
        this.blockFetchPolicy = blockFetchPolicy;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Opens, reconciles, backfills and subscribes to live blocks. Blocks until backfill is done.
     * A failure leaves the indexer in FAILED and is rethrown.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != IndexerLifecycleState.UNINITIALIZED) {
                log.debug("Address indexer already started (state={})", state);
                return;
            }
            state = IndexerLifecycleState.OPENING;
        }
        try {
            open();
            state = IndexerLifecycleState.RECONCILING;
            reconcileCheckpoint();
            state = IndexerLifecycleState.BACKFILLING;
            initialSync();
            if (!stopping) {
                watchFeed();
                state = IndexerLifecycleState.LIVE;
                log.info("Address indexer live at height {}", store.getLastProcessedHeight());
            }
        } catch (RuntimeException e) {
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (!stopping) {
                state = IndexerLifecycleState.FAILED;
            }
            log.error("Address indexer failed to start: {}", lastError, e);
            throw e;
        }
    }

    void open() {
        Path path = Path.of(properties.getIndexPath());
        store = AddressIndexStore.open(path, properties.getStoreCacheBytes(), properties.getStoreWriteBufferBytes());
    }

    /**
     * Makes the checkpoint agree with the rows actually stored. The observed maximum height is a lower bound,
     * so the checkpoint may move backwards; blocks in between are replayed idempotently.
     */
    void reconcileCheckpoint() {
        AddressIndexStore s = requireStore();
        long checkpoint = s.getLastProcessedHeight();
        Long observed = s.maxObservedHeight();
        if (observed == null) {
            if (checkpoint >= 0) {
                log.warn("Checkpoint {} has no indexed data behind it; resetting to -1", checkpoint);
                s.setCheckpoint(-1, null);
            }
            return;
        }
        if (observed == checkpoint) {
            return;
        }
        log.warn("Checkpoint {} disagrees with indexed data (max height {}); resetting checkpoint", checkpoint, observed);
        String hash = null;
        try {
            hash = rpcClient.call("getblockhash", observed).asText(null);
        } catch (RpcException e) {
            log.warn("Could not fetch hash for reconciled height {}, clearing stored hash: {}", observed, e.getMessage());
        }
        s.setCheckpoint(observed, hash);
    }

    /**
     * Processes checkpoint+1 up to the node's block count in ascending order, committing every
     * batchBlockCount blocks. Stops early when shutdown begins; completed blocks of a partial batch are kept.
     */
    void initialSync() {
        AddressIndexStore s = requireStore();
        syncInProgress.set(true);
        try {
            long best = rpcClient.call("getblockcount").asLong();
            long next = s.getLastProcessedHeight() + 1;
            if (next > best) {
                log.info("Address index up to date at height {}", best);
                return;
            }
            log.info("Address index backfill from {} to {}", next, best);
            int batchSize = Math.max(1, properties.getBatchBlockCount());
            List<PreparedBlock> pending = new ArrayList<>(batchSize);
            try {
                for (long height = next; height <= best && !stopping; height++) {
                    String hash = rpcClient.call("getblockhash", height).asText();
                    pending.add(prepareBlock(fetchBlockWithRetry(hash), hash, height));
                    if (pending.size() >= batchSize) {
                        commit(pending);
                        pending.clear();
                    }
                    if (height % 100 == 0 || height == best) {
                        log.info("Address index progress {}/{}", height, best);
                    }
                }
            } catch (RuntimeException e) {
                if (!pending.isEmpty()) {
                    try {
                        commit(pending);
                    } catch (RuntimeException flushError) {
                        e.addSuppressed(flushError);
                    }
                    pending.clear();
                }
                throw e;
            }
            if (!pending.isEmpty()) {
                commit(pending);
            }
            if (stopping) {
                log.info("Address index backfill stopped at height {}", s.getLastProcessedHeight());
            }
        } finally {
            syncInProgress.set(false);
        }
    }

    public void processBlockHeight(long height) {
        String hash = rpcClient.call("getblockhash", height).asText();
        processBlockHash(hash, height);
    }

    /**
     * Fetches, resolves and commits one block. expectedHeight may be null, in which case the block's own height is used.
     */
    public void processBlockHash(String hash, Long expectedHeight) {
        if (stopping || store == null) {
            log.debug("Skipping block {}: {}", hash, store == null ? "index not open" : "stopping");
            return;
        }
        JsonNode block = fetchBlockWithRetry(hash);
        long height = expectedHeight != null ? expectedHeight : block.path("height").asLong();
        commit(List.of(prepareBlock(block, hash, height)));
    }

    JsonNode fetchBlockWithRetry(String hash) {
        int max = blockFetchPolicy.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return rpcClient.call("getblock", hash, 2);
            } catch (RpcNotFoundException e) {
                if (attempt >= max || stopping) {
                    throw e;
                }
                long delay = blockFetchPolicy.delayMs(attempt);
                log.debug("Block {} not available yet (attempt {}/{}), retrying in {}ms", hash, attempt, max, delay);
                sleep(delay);
            }
        }
    }

    private PreparedBlock prepareBlock(JsonNode block, String hash, long height) {
        long startedAt = System.currentTimeMillis();
        try {
            Long timestamp = block.hasNonNull("time") ? block.path("time").asLong() : null;
            List<JsonNode> txs = new ArrayList<>(block.path("tx").size());
            block.path("tx").forEach(txs::add);
            List<List<Prevout>> prevouts = prevoutResolver.fetchPrevouts(txs);
            List<TransactionDelta> deltas = new ArrayList<>(txs.size());
            for (int i = 0; i < txs.size(); i++) {
                TransactionDelta delta = processTransaction(txs.get(i), prevouts.get(i), height, timestamp);
                if (!delta.isEmpty()) {
                    deltas.add(delta);
                }
            }
            BlockDelta delta = new BlockDelta(height, hash, timestamp, txs.size(), deltas);
            return new PreparedBlock(delta, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            metrics.recordBlockDuration(System.currentTimeMillis() - startedAt, false);
            throw e;
        }
    }

    private void commit(List<PreparedBlock> blocks) {
        long startedAt = System.currentTimeMillis();
        List<BlockDelta> deltas = new ArrayList<>(blocks.size());
        blocks.forEach(b -> deltas.add(b.delta()));
        AddressIndexStore s = store;
        if (s == null) {
            throw new IndexerException("Address index is not open");
        }
        try {
            s.applyBlocks(deltas);
        } catch (RuntimeException e) {
            long commitMs = System.currentTimeMillis() - startedAt;
            blocks.forEach(b -> metrics.recordBlockDuration(b.prepareMs() + commitMs, false));
            log.error("Failed to commit blocks {}..{}: {}", deltas.get(0).height(),
                    deltas.get(deltas.size() - 1).height(), e.getMessage());
            throw e;
        }
        long commitMs = (System.currentTimeMillis() - startedAt) / blocks.size();
        for (PreparedBlock b : blocks) {
            long duration = b.prepareMs() + commitMs;
            metrics.recordBlockDuration(duration, true);
            statusReporter.recordSample(b.delta().height(), b.delta().hash(), b.delta().txCount(), duration);
            blocksProcessed.incrementAndGet();
            transactionsProcessed.addAndGet(b.delta().txCount());
            log.debug("Indexed block {} ({}) txs={} durationMs={}", b.delta().height(), b.delta().hash(),
                    b.delta().txCount(), duration);
        }
    }

    /**
     * Address effects of one transaction. prevouts holds one entry per input (null when coinbase or unresolved).
     * Every address of a multi-address output is credited the full output value.
     */
    public TransactionDelta processTransaction(JsonNode tx, List<Prevout> prevouts, long height, Long timestamp) {
        String txid = BitcoinJson.txid(tx);
        List<AddressCredit> credits = new ArrayList<>();
        JsonNode outputs = tx.path("vout");
        for (int i = 0; i < outputs.size(); i++) {
            JsonNode output = outputs.get(i);
            int n = output.has("n") ? output.path("n").asInt() : i;
            long value = BitcoinJson.toSatoshis(output.path("value"));
            for (String address : BitcoinJson.addressesOf(output.path("scriptPubKey"))) {
                credits.add(new AddressCredit(address, n, value));
            }
        }
        List<AddressDebit> debits = new ArrayList<>();
        JsonNode inputs = tx.path("vin");
        for (int i = 0; i < inputs.size(); i++) {
            JsonNode input = inputs.get(i);
            if (BitcoinJson.isCoinbase(input)) {
                continue;
            }
            Prevout prevout = prevouts != null && i < prevouts.size() ? prevouts.get(i) : null;
            if (prevout == null) {
                continue;
            }
            for (String address : prevout.addresses()) {
                debits.add(new AddressDebit(address, i, prevout.txid(), prevout.vout(), prevout.valueSat()));
            }
        }
        return new TransactionDelta(txid, credits, debits);
    }

    void watchFeed() {
        subscription = feed.subscribe(BlockNewEvent.class, this::onBlockNew);
        enqueue(this::catchUp, "catch-up");
    }

    private void onBlockNew(BlockNewEvent event) {
        enqueue(() -> handleNewBlock(event.hash()), "block " + event.hash());
    }

    private void enqueue(Runnable task, String description) {
        if (stopping) {
            return;
        }
        try {
            syncExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Live update {} rejected: {}", description, e.getMessage());
        }
    }

    /**
     * Applies a newly announced block. Blocks at or below the checkpoint are skipped; heights missing between the
     * checkpoint and the block are processed first. Failures are logged; the next event tries again from the checkpoint.
     */
    void handleNewBlock(String hash) {
        if (stopping || store == null) {
            return;
        }
        syncInProgress.set(true);
        try {
            JsonNode block = fetchBlockWithRetry(hash);
            long height = block.path("height").asLong();
            long checkpoint = store.getLastProcessedHeight();
            if (height <= checkpoint) {
                log.debug("Block {} at height {} already indexed (checkpoint {})", hash, height, checkpoint);
                return;
            }
            for (long h = checkpoint + 1; h < height && !stopping; h++) {
                processBlockHeight(h);
            }
            if (!stopping) {
                commit(List.of(prepareBlock(block, hash, height)));
            }
        } catch (RuntimeException e) {
            log.error("Live update for block {} failed: {}", hash, e.getMessage(), e);
        } finally {
            syncInProgress.set(false);
        }
    }

    private void catchUp() {
        if (stopping || store == null) {
            return;
        }
        syncInProgress.set(true);
        try {
            long best = rpcClient.call("getblockcount").asLong();
            for (long h = store.getLastProcessedHeight() + 1; h <= best && !stopping; h++) {
                processBlockHeight(h);
            }
        } catch (RuntimeException e) {
            log.error("Catch-up after backfill failed: {}", e.getMessage(), e);
        } finally {
            syncInProgress.set(false);
        }
    }

    /**
     * Idempotent. Stops new work, waits up to shutdownDrainTimeoutMs for the block in progress, then releases the
     * feed subscription, the prevout workers and the store.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (stopping) {
                return;
            }
            stopping = true;
            state = IndexerLifecycleState.STOPPING;
        }
        log.info("Address indexer shutting down");
        ChainEventFeed.Subscription sub = subscription;
        if (sub != null) {
            sub.cancel();
            subscription = null;
        }
        if (!awaitSyncDrain(properties.getShutdownDrainTimeoutMs())) {
            log.warn("Timed out after {}ms waiting for in-flight block processing", properties.getShutdownDrainTimeoutMs());
        }
        prevoutResolver.close();
        AddressIndexStore s = store;
        if (s != null) {
            s.close();
        }
        state = IndexerLifecycleState.CLOSED;
        log.info("Address indexer stopped");
    }

    boolean awaitSyncDrain(long timeoutMs) {
        long deadline = System.currentTimeMillis() + Math.max(0, timeoutMs);
        while (syncInProgress.get()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(DRAIN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public Optional<AddressSummary> getAddressSummary(String address) {
        return requireStore().getAddressSummary(address);
    }

    public AddressTransactionPage getAddressTransactions(String address, int page, int pageSize) {
        return requireStore().getAddressTransactions(address, page, pageSize);
    }

    public List<AddressUtxo> getAddressUtxos(String address) {
        return requireStore().getAddressUtxos(address);
    }

    public boolean hasAddressActivity(String address) {
        return requireStore().hasActivity(address);
    }

    public Optional<XpubRecord> findXpub(String xpub) {
        return requireStore().findXpub(xpub);
    }

    public List<DerivedAddress> loadDerivedAddresses(String xpub) {
        return requireStore().loadDerivedAddresses(xpub);
    }

    public void saveXpub(XpubRecord record, List<DerivedAddress> derived) {
        requireStore().saveXpub(record, derived);
    }

    public IndexerStatus getStatus(boolean refreshTip) {
        AddressIndexStore s = store;
        Long height = null;
        String hash = null;
        if (s != null && !stopping) {
            height = s.getLastProcessedHeight();
            hash = s.getLastProcessedHash();
        }
        return statusReporter.getStatus(refreshTip, height, hash, syncInProgress.get());
    }

    public SyncStats getSyncStats() {
        AddressIndexStore s = store;
        long last = s != null && !stopping ? s.getLastProcessedHeight() : -1;
        return new SyncStats(state, last, blocksProcessed.get(), transactionsProcessed.get(),
                prevoutResolver.getCacheHits(), prevoutResolver.getRpcCalls());
    }

    public IndexerLifecycleState getState() {
        return state;
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    public String getLastError() {
        return lastError;
    }

    private AddressIndexStore requireStore() {
        AddressIndexStore s = store;
        if (s == null || stopping) {
            throw new IndexerException("Address index is not open");
        }
        return s;
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexerException("Interrupted while waiting to retry block fetch", e);
        }
    }

    private record PreparedBlock(BlockDelta delta, long prepareMs) {
    }
}
