package com.blockscope.indexer.engine;

import com.blockscope.common.RetryPolicy;
import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.domain.BlockNewEvent;
import com.blockscope.domain.DerivedAddress;
import com.blockscope.domain.Prevout;
import com.blockscope.domain.XpubRecord;
import com.blockscope.indexer.adapter.RpcUnavailableException;
import com.blockscope.indexer.config.AddressIndexProperties;
import com.blockscope.indexer.feed.ChainEventFeed;
import com.blockscope.indexer.prevout.PrevoutResolver;
import com.blockscope.indexer.status.BlockSample;
import com.blockscope.indexer.status.IndexerMetrics;
import com.blockscope.indexer.status.IndexerStatus;
import com.blockscope.indexer.status.IndexerStatusReporter;
import com.blockscope.indexer.status.SyncState;
import com.blockscope.indexer.store.AddressIndexStore;
import com.blockscope.indexer.store.TransactionDelta;
import com.blockscope.testsupport.FakeBitcoinNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.cache.concurrent.ConcurrentMapCache;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static com.blockscope.testsupport.FakeBitcoinNode.coinbase;
import static com.blockscope.testsupport.FakeBitcoinNode.hashAt;
import static com.blockscope.testsupport.FakeBitcoinNode.spend;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class AddressIndexerTest {

    @TempDir
    Path tempDir;

    private FakeBitcoinNode node;
    private ChainEventFeed feed;
    private AddressIndexProperties properties;
    private IndexerStatusReporter reporter;
    private AddressIndexer indexer;

    @BeforeEach
    void setUp() {
        node = new FakeBitcoinNode();
        feed = new ChainEventFeed();
        properties = new AddressIndexProperties();
        properties.setIndexPath(tempDir.resolve("index").toString());
        properties.setShutdownDrainTimeoutMs(1_000);
    }

    @AfterEach
    void tearDown() {
        if (indexer != null) {
            indexer.shutdown();
        }
    }

    private AddressIndexer newIndexer() {
        IndexerMetrics metrics = new IndexerMetrics(new SimpleMeterRegistry());
        PrevoutResolver resolver = new PrevoutResolver(node, null, new ConcurrentMapCache("prevouts"), metrics);
        reporter = new IndexerStatusReporter(node, metrics, Clock.systemUTC(), 120);
        indexer = new AddressIndexer(properties, node, feed, resolver, reporter, metrics,
                new RetryPolicy(0, 0, 3), Runnable::run);
        return indexer;
    }

    /** Block 0 pays A 0.001; block 1 spends it to B 0.0006 with 0.0004 change back to A. */
    private void buildTwoTransactionChain() {
        node.addBlock(coinbase("t1", "addr-A", "0.001"));
        node.addBlock(coinbase("cb-1", "miner", "50"),
                spend("t2", List.of("t1:0"), "addr-B", "0.0006", "addr-A", "0.0004"));
    }

    @Test
    @DisplayName("payment with change: balances, tx counts and UTXO set follow the two transactions")
    void twoTransactionScenario() {
        buildTwoTransactionChain();
        newIndexer().start();

        AddressSummary a = indexer.getAddressSummary("addr-A").orElseThrow();
        assertThat(a.totalReceivedSat()).isEqualTo(140_000L);
        assertThat(a.totalSentSat()).isEqualTo(100_000L);
        assertThat(a.balanceSat()).isEqualTo(40_000L);
        assertThat(a.txCount()).isEqualTo(2);
        assertThat(a.firstSeenHeight()).isEqualTo(0L);
        assertThat(a.lastSeenHeight()).isEqualTo(1L);
        assertThat(a.utxoCount()).isEqualTo(1);
        assertThat(a.utxoValueSat()).isEqualTo(40_000L);

        AddressSummary b = indexer.getAddressSummary("addr-B").orElseThrow();
        assertThat(b.balanceSat()).isEqualTo(60_000L);
        assertThat(b.txCount()).isEqualTo(1);

        List<AddressUtxo> utxosA = indexer.getAddressUtxos("addr-A");
        assertThat(utxosA).extracting(AddressUtxo::txid, AddressUtxo::vout, AddressUtxo::valueSat)
                .containsExactly(tuple("t2", 1, 40_000L));
        assertThat(indexer.getAddressUtxos("addr-B")).extracting(AddressUtxo::txid).containsExactly("t2");

        assertThat(indexer.getAddressTransactions("addr-A", 1, 25).rows())
                .extracting(r -> r.txid() + "/" + r.direction().code() + "/" + r.ioIndex())
                .containsExactly("t2/out/0", "t2/in/1", "t1/in/0");
        assertThat(indexer.getState()).isEqualTo(IndexerLifecycleState.LIVE);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(1);
    }

    @Test
    @DisplayName("payment with change inside one block: UTXO created and spent in the same commit")
    void twoTransactionsInOneBlock() {
        node.addBlock(coinbase("t1", "addr-A", "0.001"),
                spend("t2", List.of("t1:0"), "addr-B", "0.0006", "addr-A", "0.0004"));
        newIndexer().start();

        AddressSummary a = indexer.getAddressSummary("addr-A").orElseThrow();
        assertThat(a.balanceSat()).isEqualTo(40_000L);
        assertThat(a.txCount()).isEqualTo(2);
        assertThat(a.firstSeenHeight()).isEqualTo(0L);
        assertThat(a.lastSeenHeight()).isEqualTo(0L);
        assertThat(indexer.getAddressSummary("addr-B").orElseThrow().balanceSat()).isEqualTo(60_000L);

        assertThat(indexer.getAddressUtxos("addr-A")).extracting(AddressUtxo::txid, AddressUtxo::vout, AddressUtxo::valueSat)
                .containsExactly(tuple("t2", 1, 40_000L));
        assertThat(indexer.getAddressUtxos("addr-B")).extracting(AddressUtxo::txid, AddressUtxo::vout, AddressUtxo::valueSat)
                .containsExactly(tuple("t2", 0, 60_000L));
        assertThat(indexer.getAddressUtxos("addr-A")).noneMatch(u -> u.txid().equals("t1"));
    }

    @Test
    @DisplayName("xpub writes from request threads do not fail a running backfill")
    void xpubWritesDuringBackfill() throws Exception {
        for (int h = 0; h < 400; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        newIndexer();
        Thread sync = new Thread(indexer::start, "backfill");
        sync.start();

        int written = 0;
        int i = 0;
        while (sync.isAlive()) {
            try {
                indexer.saveXpub(new XpubRecord("xpub-" + (i % 5), "regtest", 20, i, -1, i),
                        List.of(new DerivedAddress(0, i, "addr-" + i)));
                written++;
            } catch (IndexerException e) {
                Thread.onSpinWait();
            }
            i++;
        }
        sync.join();

        assertThat(indexer.getLastError()).isNull();
        assertThat(indexer.getState()).isEqualTo(IndexerLifecycleState.LIVE);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(399);
        assertThat(written).isPositive();
    }

    @Test
    @DisplayName("re-processing an indexed block changes nothing")
    void replayIsIdempotent() {
        buildTwoTransactionChain();
        newIndexer().start();
        AddressSummary before = indexer.getAddressSummary("addr-A").orElseThrow();
        long rowsBefore = indexer.getAddressTransactions("addr-A", 1, 25).pagination().totalRows();

        indexer.processBlockHeight(0);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(1);
        indexer.processBlockHeight(1);
        indexer.processBlockHeight(1);

        assertThat(indexer.getAddressSummary("addr-A")).contains(before);
        assertThat(indexer.getAddressTransactions("addr-A", 1, 25).pagination().totalRows()).isEqualTo(rowsBefore);
        assertThat(indexer.getAddressUtxos("addr-A")).hasSize(1);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(1);
    }

    @Test
    @DisplayName("backfill stays ascending while new-block events arrive out of order")
    void backfillOrderIgnoresFeedEvents() {
        for (int h = 0; h <= 98; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        newIndexer().start();
        indexer.shutdown();

        for (int h = 99; h <= 102; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        node.resetCallLog();
        node.onGetBlock(height -> {
            if (height == 99) {
                feed.publish(new BlockNewEvent(hashAt(101)));
                feed.publish(new BlockNewEvent(hashAt(100)));
                feed.publish(new BlockNewEvent(hashAt(102)));
            }
        });

        newIndexer().start();

        assertThat(node.fetchedBlockHeights()).containsExactly(99L, 100L, 101L, 102L);
        assertThat(reporter.getSamples()).extracting(BlockSample::height).containsExactly(99L, 100L, 101L, 102L);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(102);
    }

    @Test
    @DisplayName("checkpoint without any indexed rows is reset and the chain is replayed from genesis")
    void reconcileResetsCheckpointWhenStoreIsEmpty() {
        try (AddressIndexStore store = AddressIndexStore.open(Path.of(properties.getIndexPath()), 0, 0)) {
            store.setCheckpoint(5, "stale");
        }
        for (int h = 0; h <= 2; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }

        newIndexer().start();

        assertThat(node.fetchedBlockHeights()).containsExactly(0L, 1L, 2L);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(2);
    }

    @Test
    @DisplayName("checkpoint ahead of indexed data is pulled back to the highest indexed height")
    void reconcileCorrectsCheckpointAboveData() {
        for (int h = 0; h <= 2; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        newIndexer().start();
        indexer.shutdown();
        try (AddressIndexStore store = AddressIndexStore.open(Path.of(properties.getIndexPath()), 0, 0)) {
            store.setCheckpoint(10, "bogus");
        }
        node.resetCallLog();

        newIndexer().start();

        IndexerStatus status = indexer.getStatus(false);
        assertThat(status.lastProcessed().height()).isEqualTo(2L);
        assertThat(status.lastProcessed().hash()).isEqualTo(hashAt(2));
        assertThat(node.fetchedBlockHeights()).isEmpty();
    }

    @Test
    @DisplayName("reconcile keeps the corrected height when the block hash cannot be fetched")
    void reconcileToleratesHashLookupFailure() {
        for (int h = 0; h <= 2; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        newIndexer().start();
        indexer.shutdown();
        try (AddressIndexStore store = AddressIndexStore.open(Path.of(properties.getIndexPath()), 0, 0)) {
            store.setCheckpoint(7, "bogus");
        }
        node.failOn("getblockhash", "2", new RpcUnavailableException("node down"));

        newIndexer().start();

        IndexerStatus status = indexer.getStatus(false);
        assertThat(status.lastProcessed().height()).isEqualTo(2L);
        assertThat(status.lastProcessed().hash()).isNull();
        assertThat(indexer.getState()).isEqualTo(IndexerLifecycleState.LIVE);
    }

    @Test
    @DisplayName("RPC failure during backfill stops start-up with the checkpoint at the last committed block")
    void rpcFailureHaltsBackfill() {
        for (int h = 0; h <= 5; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        node.failOn("getblock", hashAt(3), new RpcUnavailableException("node down"));

        AddressIndexer idx = newIndexer();
        assertThatThrownBy(idx::start).isInstanceOf(RpcUnavailableException.class).hasMessage("node down");

        assertThat(idx.getState()).isEqualTo(IndexerLifecycleState.FAILED);
        assertThat(idx.getLastError()).isEqualTo("node down");
        assertThat(idx.getSyncStats().lastProcessedHeight()).isEqualTo(2);
        assertThat(idx.getAddressSummary("miner-3")).isEmpty();
    }

    @Test
    @DisplayName("batched backfill commits full batches and flushes the partial one when the loop fails")
    void batchedBackfillFlushesPendingBlocks() {
        properties.setBatchBlockCount(3);
        for (int h = 0; h <= 6; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }
        node.failOn("getblock", hashAt(4), new RpcUnavailableException("node down"));

        AddressIndexer idx = newIndexer();
        assertThatThrownBy(idx::start).isInstanceOf(RpcUnavailableException.class);
        assertThat(idx.getSyncStats().lastProcessedHeight()).isEqualTo(3);
        assertThat(idx.getAddressSummary("miner-3")).isPresent();
        idx.shutdown();

        node.clearFailures();
        newIndexer().start();
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(6);
        assertThat(indexer.getAddressSummary("miner-6").orElseThrow().balanceSat()).isEqualTo(5_000_000_000L);
    }

    @Test
    @DisplayName("block not yet served by the node is retried until it appears")
    void blockFetchRetriesNotFound() {
        node.addCoinbaseBlock("miner-0", "50");
        node.addCoinbaseBlock("miner-1", "50");
        node.notFoundTimes(hashAt(1), 2);

        newIndexer().start();

        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(1);
        assertThat(node.callCount("getblock")).isEqualTo(4);
    }

    @Test
    @DisplayName("live block ahead of the checkpoint fills the gap in ascending order")
    void liveUpdateFillsGap() {
        node.addCoinbaseBlock("miner-0", "50");
        node.addCoinbaseBlock("miner-1", "50");
        newIndexer().start();
        for (int h = 2; h <= 4; h++) {
            node.addCoinbaseBlock("miner-" + h, "50");
        }

        feed.publish(new BlockNewEvent(hashAt(4)));

        assertThat(reporter.getSamples()).extracting(BlockSample::height).containsExactly(0L, 1L, 2L, 3L, 4L);
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(4);

        feed.publish(new BlockNewEvent(hashAt(1)));
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(4);
        assertThat(reporter.getSamples()).hasSize(5);
        assertThat(indexer.isSyncInProgress()).isFalse();
    }

    @Test
    @DisplayName("failed live update is logged and the next event catches up")
    void liveUpdateFailureDoesNotStopFeed() {
        node.addCoinbaseBlock("miner-0", "50");
        newIndexer().start();
        node.addCoinbaseBlock("miner-1", "50");
        node.failOn("getblock", hashAt(1), new RpcUnavailableException("node down"));

        feed.publish(new BlockNewEvent(hashAt(1)));
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(0);

        node.clearFailures();
        node.addCoinbaseBlock("miner-2", "50");
        feed.publish(new BlockNewEvent(hashAt(2)));
        assertThat(indexer.getSyncStats().lastProcessedHeight()).isEqualTo(2);
    }

    @Test
    @DisplayName("status is synced once the index reaches the tip")
    void statusAfterSync() {
        buildTwoTransactionChain();
        newIndexer().start();

        IndexerStatus status = indexer.getStatus(true);

        assertThat(status.state()).isEqualTo(SyncState.SYNCED);
        assertThat(status.blocksRemaining()).isZero();
        assertThat(status.progressPercent()).isEqualTo(100.0);
        assertThat(status.chainTip().hash()).isEqualTo(hashAt(1));
    }

    @Test
    @DisplayName("shutdown closes the index, is idempotent and ignores later events")
    void shutdownIsIdempotent() {
        buildTwoTransactionChain();
        newIndexer().start();
        int subscribers = feed.subscriberCount();

        indexer.shutdown();
        indexer.shutdown();

        assertThat(indexer.getState()).isEqualTo(IndexerLifecycleState.CLOSED);
        assertThat(feed.subscriberCount()).isEqualTo(subscribers - 1);
        assertThatThrownBy(() -> indexer.getAddressSummary("addr-A")).isInstanceOf(IndexerException.class);
        assertThat(indexer.awaitSyncDrain(0)).isTrue();
    }

    @Test
    @DisplayName("address touched on both sides of a transaction counts it once")
    void processTransactionCountsSelfTransferOnce() {
        AddressIndexer idx = newIndexer();
        var tx = spend("t3", List.of("t1:0"), "addr-A", "0.0009");
        List<Prevout> prevouts = List.of(new Prevout("t1", 0, 100_000L, List.of("addr-A")));

        TransactionDelta delta = idx.processTransaction(tx, prevouts, 5, 1L);

        assertThat(delta.credits()).hasSize(1);
        assertThat(delta.debits()).hasSize(1);
        assertThat(delta.touchedAddresses()).containsExactly("addr-A");
    }

    @Test
    @DisplayName("unresolved prevouts and coinbase inputs produce no debits")
    void processTransactionSkipsUnresolvedInputs() {
        AddressIndexer idx = newIndexer();
        var tx = spend("t4", List.of("gone:0", "t1:1"), "addr-C", "1");
        List<Prevout> prevouts = Arrays.asList(null, new Prevout("t1", 1, 5L, List.of("addr-D")));

        TransactionDelta delta = idx.processTransaction(tx, prevouts, 7, null);

        assertThat(delta.debits()).singleElement().satisfies(d -> {
            assertThat(d.address()).isEqualTo("addr-D");
            assertThat(d.inputIndex()).isEqualTo(1);
            assertThat(d.prevTxid()).isEqualTo("t1");
        });
        assertThat(delta.credits()).extracting(c -> c.address() + "=" + c.valueSat()).containsExactly("addr-C=100000000");
    }
}
