package com.blockscope.explorer;

import com.blockscope.domain.AddressSummary;
import com.blockscope.domain.AddressTransactionPage;
import com.blockscope.domain.AddressUtxo;
import com.blockscope.indexer.config.AddressIndexProperties;
import com.blockscope.indexer.engine.AddressIndexer;
import com.blockscope.indexer.engine.IndexerLifecycleState;
import com.blockscope.indexer.status.IndexerMetrics;
import com.blockscope.indexer.status.IndexerStatus;
import com.blockscope.indexer.status.SyncState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the address explorer: address details, xpub details and indexer status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddressExplorerService {

    public static final int DEFAULT_PAGE_SIZE = 25;
    public static final int MAX_PAGE_SIZE = 200;

    private final AddressIndexer indexer;
    private final XpubService xpubService;
    private final AddressIndexProperties properties;
    private final IndexerMetrics metrics;

    /**
     * @throws BadRequestException          address missing or feature disabled
     * @throws AddressNotFoundException     address has no indexed activity
     * @throws IndexerUnavailableException  index not open yet or failed
     */
    public AddressDetails getAddressDetails(String address, int page, int pageSize) {
        if (address == null || address.isBlank()) {
            throw new BadRequestException("Address is required");
        }
        ensureQueryable();
        String addr = address.trim();
        AddressSummary summary = indexer.getAddressSummary(addr)
                .orElseThrow(() -> new AddressNotFoundException(addr));
        int size = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
        AddressTransactionPage txs = indexer.getAddressTransactions(addr, page, size);
        List<AddressUtxo> utxos = indexer.getAddressUtxos(addr);
        return new AddressDetails(summary, utxos, txs.rows(), txs.pagination());
    }

    public XpubDetails getXpubDetails(String xpub) {
        ensureQueryable();
        return xpubService.getXpubDetails(xpub);
    }

    /**
     * Never throws: disabled, failed and not-yet-running indexers are reported through the state field.
     */
    public IndexerStatus getIndexerStatus(boolean refreshTip) {
        if (!properties.isEnabled()) {
            return report(IndexerStatus.empty(false, SyncState.DISABLED, false, null));
        }
        IndexerLifecycleState lifecycle = indexer.getState();
        switch (lifecycle) {
            case FAILED:
                return report(IndexerStatus.empty(true, SyncState.ERROR, false,
                        indexer.getLastError() != null ? indexer.getLastError() : "Failed to start address indexer"));
            case STOPPING:
            case CLOSED:
                return report(IndexerStatus.empty(true, SyncState.ERROR, false, "Address indexer is stopped"));
            case UNINITIALIZED:
            case OPENING:
                return report(IndexerStatus.empty(true, SyncState.STARTING, true, null));
            default:
                break;
        }
        try {
            return indexer.getStatus(refreshTip);
        } catch (RuntimeException e) {
            log.warn("Indexer status unavailable: {}", e.getMessage());
            return report(IndexerStatus.empty(true, SyncState.ERROR, false,
                    e.getMessage() != null ? e.getMessage() : "Failed to retrieve indexer status"));
        }
    }

    private IndexerStatus report(IndexerStatus status) {
        metrics.recordSyncStatus(status);
        return status;
    }

    private void ensureQueryable() {
        if (!properties.isEnabled()) {
            throw new BadRequestException("Address explorer feature is disabled");
        }
        switch (indexer.getState()) {
            case RECONCILING:
            case BACKFILLING:
            case LIVE:
                return;
            case FAILED:
                throw new IndexerUnavailableException("Address indexer failed: " + indexer.getLastError());
            default:
                throw new IndexerUnavailableException("Address indexer is not ready (" + indexer.getState() + ")");
        }
    }
}
