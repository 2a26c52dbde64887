package com.blockscope.indexer.store;

import com.blockscope.domain.AddressTransaction;
import com.blockscope.domain.AddressTransactionPage;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.domain.DerivedAddress;
import com.blockscope.domain.XpubRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressIndexStoreTest {

    @TempDir
    Path tempDir;

    private AddressIndexStore store;

    @BeforeEach
    void setUp() {
        store = AddressIndexStore.open(tempDir.resolve("nested/index"), 8L * 1024 * 1024, 4L * 1024 * 1024);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static BlockDelta block(long height, TransactionDelta... txs) {
        return new BlockDelta(height, "hash-" + height, 1_000L + height, txs.length, List.of(txs));
    }

    private static TransactionDelta receive(String txid, String address, int vout, long value) {
        return new TransactionDelta(txid, List.of(new AddressCredit(address, vout, value)), List.of());
    }

    @Test
    @DisplayName("open creates the directory, the database file and an empty checkpoint")
    void openCreatesDatabase() {
        assertThat(Files.exists(tempDir.resolve("nested/index").resolve(AddressIndexStore.DB_FILE))).isTrue();
        assertThat(store.getLastProcessedHeight()).isEqualTo(-1);
        assertThat(store.maxObservedHeight()).isNull();
    }

    @Test
    @DisplayName("open on an unusable path fails with StoreOpenException")
    void openFailsOnFilePath() throws Exception {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        assertThatThrownBy(() -> AddressIndexStore.open(file, 0, 0)).isInstanceOf(StoreOpenException.class);
    }

    @Test
    @DisplayName("applyBlocks writes rows, summaries and the checkpoint together")
    void applyBlocksWritesCheckpoint() {
        store.applyBlocks(List.of(block(10, receive("a1", "addr-A", 0, 500)), block(11, receive("a2", "addr-A", 3, 700))));

        assertThat(store.getLastProcessedHeight()).isEqualTo(11);
        assertThat(store.getLastProcessedHash()).isEqualTo("hash-11");
        assertThat(store.maxObservedHeight()).isEqualTo(11L);
        var summary = store.getAddressSummary("addr-A").orElseThrow();
        assertThat(summary.totalReceivedSat()).isEqualTo(1_200);
        assertThat(summary.balanceSat()).isEqualTo(1_200);
        assertThat(summary.txCount()).isEqualTo(2);
        assertThat(summary.firstSeenHeight()).isEqualTo(10L);
        assertThat(summary.lastSeenHeight()).isEqualTo(11L);
        assertThat(summary.utxoCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failing write rolls back the whole batch including the checkpoint")
    void failureMidBlockRollsBack() {
        store.applyBlocks(List.of(block(1, receive("a1", "addr-A", 0, 500))));

        TransactionDelta good = receive("a2", "addr-B", 0, 100);
        TransactionDelta broken = new TransactionDelta("a3", List.of(new AddressCredit(null, 0, 1)), List.of());
        assertThatThrownBy(() -> store.applyBlocks(List.of(block(2, good, broken))))
                .isInstanceOf(RuntimeException.class);

        assertThat(store.getLastProcessedHeight()).isEqualTo(1);
        assertThat(store.getAddressSummary("addr-B")).isEmpty();
        assertThat(store.getAddressUtxos("addr-B")).isEmpty();
        assertThat(store.maxObservedHeight()).isEqualTo(1L);
    }

    @Test
    @DisplayName("re-applying a transaction for an address already holding it is a no-op")
    void reapplyIsNoOp() {
        TransactionDelta spend = new TransactionDelta("s1",
                List.of(new AddressCredit("addr-B", 0, 300)),
                List.of(new AddressDebit("addr-A", 0, "a1", 0, 500)));
        store.applyBlocks(List.of(block(1, receive("a1", "addr-A", 0, 500)), block(2, spend)));
        store.applyBlocks(List.of(block(2, spend)));

        var a = store.getAddressSummary("addr-A").orElseThrow();
        assertThat(a.totalSentSat()).isEqualTo(500);
        assertThat(a.balanceSat()).isZero();
        assertThat(a.txCount()).isEqualTo(2);
        assertThat(store.getAddressUtxos("addr-A")).isEmpty();
        assertThat(store.getAddressSummary("addr-B").orElseThrow().txCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("replaying an older block leaves the checkpoint where it was")
    void checkpointOnlyMovesForward() {
        for (int h = 1; h <= 4; h++) {
            store.applyBlocks(List.of(block(h, receive("tx" + h, "addr-A", 0, 10))));
        }

        store.applyBlocks(List.of(block(1, receive("tx1", "addr-A", 0, 10))));

        assertThat(store.getLastProcessedHeight()).isEqualTo(4);
        assertThat(store.getLastProcessedHash()).isEqualTo("hash-4");
        assertThat(store.getAddressSummary("addr-A").orElseThrow().txCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("balance is never clamped when sends exceed known receipts")
    void balanceCanGoNegative() {
        TransactionDelta spend = new TransactionDelta("s1", List.of(),
                List.of(new AddressDebit("addr-X", 0, "unknown", 2, 900)));
        store.applyBlocks(List.of(block(5, spend)));

        var x = store.getAddressSummary("addr-X").orElseThrow();
        assertThat(x.balanceSat()).isEqualTo(-900);
        assertThat(x.balanceSat()).isEqualTo(x.totalReceivedSat() - x.totalSentSat());
    }

    @Test
    @DisplayName("history is newest first and paginated; page and pageSize are clamped to 1")
    void historyPagination() {
        for (int h = 1; h <= 5; h++) {
            store.applyBlocks(List.of(block(h, receive("tx" + h, "addr-A", 0, h * 10L))));
        }

        AddressTransactionPage page2 = store.getAddressTransactions("addr-A", 2, 2);
        assertThat(page2.rows()).extracting(AddressTransaction::txid).containsExactly("tx3", "tx2");
        assertThat(page2.pagination().totalRows()).isEqualTo(5);
        assertThat(page2.pagination().totalPages()).isEqualTo(3);

        AddressTransactionPage clamped = store.getAddressTransactions("addr-A", 0, 0);
        assertThat(clamped.pagination().page()).isEqualTo(1);
        assertThat(clamped.pagination().pageSize()).isEqualTo(1);
        assertThat(clamped.rows()).extracting(AddressTransaction::txid).containsExactly("tx5");
        assertThat(clamped.rows().get(0).timestamp()).isEqualTo(1_005L);
    }

    @Test
    @DisplayName("UTXOs are listed by value, largest first")
    void utxosByValue() {
        store.applyBlocks(List.of(block(1,
                new TransactionDelta("m1", List.of(
                        new AddressCredit("addr-A", 0, 10),
                        new AddressCredit("addr-A", 1, 30),
                        new AddressCredit("addr-A", 2, 20)), List.of()))));

        assertThat(store.getAddressUtxos("addr-A")).extracting(AddressUtxo::vout).containsExactly(1, 2, 0);
        assertThat(store.getAddressSummary("addr-A").orElseThrow().txCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("metadata and xpub state round-trip")
    void metadataAndXpub() {
        store.setMetadata("k", "v");
        assertThat(store.getMetadata("k", "fallback")).isEqualTo("v");
        assertThat(store.getMetadata("missing", "fallback")).isEqualTo("fallback");

        store.saveXpub(new XpubRecord("xpub1", "mainnet", 20, 3, -1, 42L),
                List.of(new DerivedAddress(0, 0, "bc1a"), new DerivedAddress(1, 0, "bc1b")));
        store.saveXpub(new XpubRecord("xpub1", "mainnet", 20, 4, 0, 43L), List.of(new DerivedAddress(0, 1, "bc1c")));

        assertThat(store.findXpub("xpub1")).hasValueSatisfying(r -> {
            assertThat(r.lastReceiveIndex()).isEqualTo(4);
            assertThat(r.lastChangeIndex()).isZero();
        });
        assertThat(store.loadDerivedAddresses("xpub1")).extracting(DerivedAddress::address)
                .containsExactly("bc1a", "bc1c", "bc1b");
    }
}
