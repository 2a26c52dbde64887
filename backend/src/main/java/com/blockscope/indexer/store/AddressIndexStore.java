package com.blockscope.indexer.store;

import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.AddressTransaction;
import com.blockscope.domain.AddressTransactionPage;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.domain.DerivedAddress;
import com.blockscope.domain.Direction;
import com.blockscope.domain.Pagination;
import com.blockscope.domain.XpubRecord;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Embedded SQLite index of address activity. One writer at a time (the indexer); WAL mode lets readers
 * query concurrently. Block data and the checkpoint are always written in the same transaction.
 */
@Slf4j
public class AddressIndexStore implements AutoCloseable {

    public static final String DB_FILE = "address-index.db";
    public static final String LAST_PROCESSED_HEIGHT = "last_processed_height";
    public static final String LAST_PROCESSED_HASH = "last_processed_hash";

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS metadata (key TEXT PRIMARY KEY, value TEXT)",
            "CREATE TABLE IF NOT EXISTS addresses ("
                    + "address TEXT PRIMARY KEY, first_seen_height INTEGER, last_seen_height INTEGER, "
                    + "total_received_sat INTEGER NOT NULL DEFAULT 0, total_sent_sat INTEGER NOT NULL DEFAULT 0, "
                    + "balance_sat INTEGER NOT NULL DEFAULT 0, tx_count INTEGER NOT NULL DEFAULT 0)",
            "CREATE TABLE IF NOT EXISTS address_utxos ("
                    + "address TEXT NOT NULL, txid TEXT NOT NULL, vout INTEGER NOT NULL, "
                    + "value_sat INTEGER NOT NULL, height INTEGER NOT NULL, PRIMARY KEY (address, txid, vout))",
            "CREATE INDEX IF NOT EXISTS idx_address_utxos_height ON address_utxos (height)",
            "CREATE INDEX IF NOT EXISTS idx_address_utxos_outpoint ON address_utxos (txid, vout)",
            "CREATE TABLE IF NOT EXISTS address_txs ("
                    + "address TEXT NOT NULL, txid TEXT NOT NULL, direction TEXT NOT NULL, io_index INTEGER NOT NULL, "
                    + "height INTEGER NOT NULL, value_sat INTEGER NOT NULL, timestamp INTEGER, "
                    + "PRIMARY KEY (address, txid, direction, io_index))",
            "CREATE INDEX IF NOT EXISTS idx_address_txs_address_height ON address_txs (address, height DESC)",
            "CREATE INDEX IF NOT EXISTS idx_address_txs_height ON address_txs (height)",
            "CREATE TABLE IF NOT EXISTS xpubs ("
                    + "xpub TEXT PRIMARY KEY, network TEXT NOT NULL, gap_limit INTEGER NOT NULL, "
                    + "last_receive_index INTEGER NOT NULL, last_change_index INTEGER NOT NULL, updated_at INTEGER NOT NULL)",
            "CREATE TABLE IF NOT EXISTS xpub_addresses ("
                    + "xpub TEXT NOT NULL, branch INTEGER NOT NULL, derivation_index INTEGER NOT NULL, address TEXT NOT NULL, "
                    + "PRIMARY KEY (xpub, branch, derivation_index))",
            "CREATE INDEX IF NOT EXISTS idx_xpub_addresses_address ON xpub_addresses (address)"
    );

    private static final String UPSERT_SUMMARY =
            "INSERT INTO addresses (address, first_seen_height, last_seen_height, total_received_sat, total_sent_sat, balance_sat, tx_count) "
                    + "VALUES (?, ?, ?, ?, ?, ?, 1) "
                    + "ON CONFLICT(address) DO UPDATE SET "
                    + "first_seen_height = CASE WHEN first_seen_height IS NULL OR excluded.first_seen_height < first_seen_height "
                    + "THEN excluded.first_seen_height ELSE first_seen_height END, "
                    + "last_seen_height = CASE WHEN last_seen_height IS NULL OR excluded.last_seen_height > last_seen_height "
                    + "THEN excluded.last_seen_height ELSE last_seen_height END, "
                    + "total_received_sat = total_received_sat + excluded.total_received_sat, "
                    + "total_sent_sat = total_sent_sat + excluded.total_sent_sat, "
                    + "balance_sat = (total_received_sat + excluded.total_received_sat) - (total_sent_sat + excluded.total_sent_sat), "
                    + "tx_count = tx_count + 1";

    private static final RowMapper<AddressTransaction> TX_ROW = (rs, i) -> new AddressTransaction(
            rs.getString("address"),
            rs.getString("txid"),
            rs.getLong("height"),
            Direction.fromCode(rs.getString("direction")),
            rs.getLong("value_sat"),
            rs.getInt("io_index"),
            nullableLong(rs, "timestamp"));

    private static final RowMapper<AddressUtxo> UTXO_ROW = (rs, i) -> new AddressUtxo(
            rs.getString("address"),
            rs.getString("txid"),
            rs.getInt("vout"),
            rs.getLong("value_sat"),
            rs.getLong("height"));

    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    private AddressIndexStore(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbc = new JdbcTemplate(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Creates indexPath if needed and opens (or creates) the database inside it.
     *
     * @param cacheBytes       page cache size; 0 or less keeps the driver default
     * @param writeBufferBytes WAL size before auto-checkpoint; 0 or less keeps the driver default
     * @throws StoreOpenException when the directory, database or schema cannot be set up
     */
    public static AddressIndexStore open(Path indexPath, long cacheBytes, long writeBufferBytes) {
        HikariDataSource ds = null;
        try {
            Files.createDirectories(indexPath);
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl("jdbc:sqlite:" + indexPath.resolve(DB_FILE).toAbsolutePath());
            config.setPoolName("address-index");
            config.setMaximumPoolSize(4);
            config.addDataSourceProperty("journal_mode", "WAL");
            config.addDataSourceProperty("synchronous", "NORMAL");
            config.addDataSourceProperty("busy_timeout", "10000");
            config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
            if (cacheBytes > 0) {
                config.addDataSourceProperty("cache_size", String.valueOf(-(cacheBytes / 1024)));
            }
            if (writeBufferBytes > 0) {
                config.setConnectionInitSql("PRAGMA wal_autocheckpoint=" + Math.max(1, writeBufferBytes / 4096));
            }
            ds = new HikariDataSource(config);
            AddressIndexStore store = new AddressIndexStore(ds);
            store.migrate();
            log.info("Address index opened at {}", indexPath.toAbsolutePath());
            return store;
        } catch (IOException | RuntimeException e) {
            if (ds != null) {
                ds.close();
            }
            throw new StoreOpenException("Failed to open address index at " + indexPath, e);
        }
    }

    private void migrate() {
        for (String ddl : SCHEMA) {
            jdbc.execute(ddl);
        }
    }

    /**
     * Applies the blocks in order inside one transaction and moves the checkpoint to the last one.
     * Transactions already recorded for an address are skipped for that address, so re-applying a block is a no-op.
     * The checkpoint only moves forward.
     */
    public void applyBlocks(List<BlockDelta> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        tx.executeWithoutResult(status -> {
            for (BlockDelta block : blocks) {
                for (TransactionDelta t : block.transactions()) {
                    applyTransaction(block, t);
                }
            }
            BlockDelta last = blocks.get(blocks.size() - 1);
            if (last.height() > getLastProcessedHeight()) {
                setMetadata(LAST_PROCESSED_HEIGHT, String.valueOf(last.height()));
                setMetadata(LAST_PROCESSED_HASH, last.hash());
            }
        });
    }

    private void applyTransaction(BlockDelta block, TransactionDelta t) {
        for (String address : t.touchedAddresses()) {
            if (hasTransaction(address, t.txid())) {
                continue;
            }
            long received = 0;
            long sent = 0;
            for (AddressCredit c : t.credits()) {
                if (!c.address().equals(address)) {
                    continue;
                }
                received += c.valueSat();
                jdbc.update("INSERT OR IGNORE INTO address_utxos (address, txid, vout, value_sat, height) VALUES (?, ?, ?, ?, ?)",
                        address, t.txid(), c.vout(), c.valueSat(), block.height());
                jdbc.update("INSERT OR IGNORE INTO address_txs (address, txid, direction, io_index, height, value_sat, timestamp) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                        address, t.txid(), Direction.IN.code(), c.vout(), block.height(), c.valueSat(), block.timestamp());
            }
            for (AddressDebit d : t.debits()) {
                if (!d.address().equals(address)) {
                    continue;
                }
                sent += d.valueSat();
                jdbc.update("DELETE FROM address_utxos WHERE address = ? AND txid = ? AND vout = ?",
                        address, d.prevTxid(), d.prevVout());
                jdbc.update("INSERT OR IGNORE INTO address_txs (address, txid, direction, io_index, height, value_sat, timestamp) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                        address, t.txid(), Direction.OUT.code(), d.inputIndex(), block.height(), d.valueSat(), block.timestamp());
            }
            jdbc.update(UPSERT_SUMMARY, address, block.height(), block.height(), received, sent, received - sent);
        }
    }

    private boolean hasTransaction(String address, String txid) {
        Integer found = jdbc.query("SELECT 1 FROM address_txs WHERE address = ? AND txid = ? LIMIT 1",
                rs -> rs.next() ? 1 : null, address, txid);
        return found != null;
    }

    public Optional<AddressSummary> getAddressSummary(String address) {
        List<AddressSummary> rows = jdbc.query(
                "SELECT a.*, "
                        + "(SELECT COUNT(*) FROM address_utxos u WHERE u.address = a.address) AS utxo_count, "
                        + "(SELECT COALESCE(SUM(value_sat), 0) FROM address_utxos u WHERE u.address = a.address) AS utxo_value "
                        + "FROM addresses a WHERE a.address = ?",
                (rs, i) -> new AddressSummary(
                        rs.getString("address"),
                        nullableLong(rs, "first_seen_height"),
                        nullableLong(rs, "last_seen_height"),
                        rs.getLong("total_received_sat"),
                        rs.getLong("total_sent_sat"),
                        rs.getLong("balance_sat"),
                        rs.getLong("tx_count"),
                        rs.getLong("utxo_count"),
                        rs.getLong("utxo_value")),
                address);
        return rows.stream().findFirst();
    }

    /** Newest first: height, direction, ioIndex and txid all descending. page and pageSize are clamped to at least 1. */
    public AddressTransactionPage getAddressTransactions(String address, int page, int pageSize) {
        int p = Math.max(1, page);
        int size = Math.max(1, pageSize);
        Long total = jdbc.queryForObject("SELECT COUNT(*) FROM address_txs WHERE address = ?", Long.class, address);
        List<AddressTransaction> rows = jdbc.query(
                "SELECT * FROM address_txs WHERE address = ? "
                        + "ORDER BY height DESC, direction DESC, io_index DESC, txid DESC LIMIT ? OFFSET ?",
                TX_ROW, address, size, (long) (p - 1) * size);
        return new AddressTransactionPage(rows, new Pagination(p, size, total != null ? total : 0));
    }

    /** Unspent outputs by value, largest first. */
    public List<AddressUtxo> getAddressUtxos(String address) {
        return jdbc.query("SELECT * FROM address_utxos WHERE address = ? ORDER BY value_sat DESC, height ASC, txid ASC, vout ASC",
                UTXO_ROW, address);
    }

    public boolean hasActivity(String address) {
        Integer found = jdbc.query("SELECT 1 FROM addresses WHERE address = ? LIMIT 1",
                rs -> rs.next() ? 1 : null, address);
        return found != null;
    }

    public String getMetadata(String key, String fallback) {
        List<String> values = jdbc.queryForList("SELECT value FROM metadata WHERE key = ?", String.class, key);
        return values.isEmpty() || values.get(0) == null ? fallback : values.get(0);
    }

    public void setMetadata(String key, String value) {
        if (value == null) {
            jdbc.update("DELETE FROM metadata WHERE key = ?", key);
        } else {
            jdbc.update("INSERT INTO metadata (key, value) VALUES (?, ?) ON CONFLICT(key) DO UPDATE SET value = excluded.value",
                    key, value);
        }
    }

    /** Stored checkpoint height, -1 when nothing has been processed. */
    public long getLastProcessedHeight() {
        String raw = getMetadata(LAST_PROCESSED_HEIGHT, null);
        if (raw == null) {
            return -1;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed checkpoint value '{}'", raw);
            return -1;
        }
    }

    public String getLastProcessedHash() {
        return getMetadata(LAST_PROCESSED_HASH, null);
    }

    public void setCheckpoint(long height, String hash) {
        tx.executeWithoutResult(status -> {
            setMetadata(LAST_PROCESSED_HEIGHT, String.valueOf(height));
            setMetadata(LAST_PROCESSED_HASH, hash);
        });
    }

    /** Highest block height with any indexed row, or null when the index holds no rows. */
    public Long maxObservedHeight() {
        return jdbc.queryForObject(
                "SELECT MAX(h) FROM (SELECT MAX(height) AS h FROM address_txs UNION ALL SELECT MAX(height) AS h FROM address_utxos)",
                Long.class);
    }

    public Optional<XpubRecord> findXpub(String xpub) {
        List<XpubRecord> rows = jdbc.query("SELECT * FROM xpubs WHERE xpub = ?",
                (rs, i) -> new XpubRecord(
                        rs.getString("xpub"),
                        rs.getString("network"),
                        rs.getInt("gap_limit"),
                        rs.getInt("last_receive_index"),
                        rs.getInt("last_change_index"),
                        rs.getLong("updated_at")),
                xpub);
        return rows.stream().findFirst();
    }

    /** Upserts the scan state and the derived addresses in one transaction. */
    public void saveXpub(XpubRecord record, List<DerivedAddress> derived) {
        tx.executeWithoutResult(status -> {
            jdbc.update("INSERT INTO xpubs (xpub, network, gap_limit, last_receive_index, last_change_index, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT(xpub) DO UPDATE SET network = excluded.network, "
                            + "gap_limit = excluded.gap_limit, last_receive_index = excluded.last_receive_index, "
                            + "last_change_index = excluded.last_change_index, updated_at = excluded.updated_at",
                    record.xpub(), record.network(), record.gapLimit(), record.lastReceiveIndex(),
                    record.lastChangeIndex(), record.updatedAt());
            for (DerivedAddress d : derived) {
                jdbc.update("INSERT OR REPLACE INTO xpub_addresses (xpub, branch, derivation_index, address) VALUES (?, ?, ?, ?)",
                        record.xpub(), d.branch(), d.index(), d.address());
            }
        });
    }

    public List<DerivedAddress> loadDerivedAddresses(String xpub) {
        return jdbc.query("SELECT branch, derivation_index, address FROM xpub_addresses WHERE xpub = ? "
                        + "ORDER BY branch, derivation_index",
                (rs, i) -> new DerivedAddress(rs.getInt("branch"), rs.getInt("derivation_index"), rs.getString("address")),
                xpub);
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Address index closed");
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
