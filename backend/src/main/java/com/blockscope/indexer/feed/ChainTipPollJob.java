package com.blockscope.indexer.feed;

import com.blockscope.domain.BlockNewEvent;
import com.blockscope.domain.TxNewEvent;
import com.blockscope.indexer.adapter.BitcoinRpcClient;
import com.blockscope.indexer.adapter.RpcException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls getbestblockhash and publishes BlockNewEvent when the tip changes.
 * The first observed tip is published too; the indexer skips blocks it already holds.
 * <p>
 * getrawmempool is polled alongside; txids absent from the previous snapshot are published as TxNewEvent.
 * The first snapshot only seeds the set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "blockscope.address-index", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChainTipPollJob {

    private final BitcoinRpcClient rpcClient;
    private final ChainEventFeed feed;
    private final AtomicReference<String> lastTip = new AtomicReference<>();
    private Set<String> lastMempool;

    @Scheduled(fixedDelayString = "${blockscope.address-index.tip-poll-interval-ms:5000}")
    public void runScheduled() {
        pollTip();
        pollMempool();
    }

    private void pollTip() {
        String tip;
        try {
            tip = rpcClient.call("getbestblockhash").asText(null);
        } catch (RpcException e) {
            log.debug("Tip poll failed: {}", e.getMessage());
            return;
        }
        if (tip == null || tip.isEmpty()) {
            return;
        }
        String previous = lastTip.getAndSet(tip);
        if (!tip.equals(previous)) {
            log.debug("New chain tip {}", tip);
            feed.publish(new BlockNewEvent(tip));
        }
    }

    private synchronized void pollMempool() {
        JsonNode txids;
        try {
            txids = rpcClient.call("getrawmempool");
        } catch (RpcException e) {
            log.debug("Mempool poll failed: {}", e.getMessage());
            return;
        }
        if (txids == null || !txids.isArray()) {
            return;
        }
        Set<String> current = new HashSet<>();
        txids.forEach(t -> current.add(t.asText()));
        Set<String> previous = lastMempool;
        lastMempool = current;
        if (previous == null) {
            log.debug("Mempool snapshot seeded with {} txids", current.size());
            return;
        }
        for (String txid : current) {
            if (!previous.contains(txid)) {
                feed.publish(new TxNewEvent(txid));
            }
        }
    }
}
