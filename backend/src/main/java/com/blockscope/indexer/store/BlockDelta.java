package com.blockscope.indexer.store;

import java.util.List;

/**
 * Everything one block changes in the index. timestamp is the block time in seconds; txCount counts all
 * transactions of the block, including those without address effects.
 */
public record BlockDelta(long height, String hash, Long timestamp, int txCount, List<TransactionDelta> transactions) {

    public BlockDelta {
        transactions = List.copyOf(transactions);
    }
}
