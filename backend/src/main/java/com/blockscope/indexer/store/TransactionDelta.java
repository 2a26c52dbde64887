package com.blockscope.indexer.store;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Address effects of one transaction. Each touched address counts once towards txCount.
 */
public record TransactionDelta(String txid, List<AddressCredit> credits, List<AddressDebit> debits) {

    public TransactionDelta {
        credits = List.copyOf(credits);
        debits = List.copyOf(debits);
    }

    /** Addresses touched by this transaction, credits first, each once. */
    public Set<String> touchedAddresses() {
        Set<String> out = new LinkedHashSet<>();
        credits.forEach(c -> out.add(c.address()));
        debits.forEach(d -> out.add(d.address()));
        return out;
    }

    public boolean isEmpty() {
        return credits.isEmpty() && debits.isEmpty();
    }
}
