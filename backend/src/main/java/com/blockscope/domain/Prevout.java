package com.blockscope.domain;

import java.util.List;

/**
 * Resolved previous output spent by an input: its value and the addresses it paid.
 */
public record Prevout(String txid, int vout, long valueSat, List<String> addresses) {

    public Prevout {
        addresses = addresses != null ? List.copyOf(addresses) : List.of();
    }

    /** First address paid by the output, or null for non-standard scripts. */
    public String primaryAddress() {
        return addresses.isEmpty() ? null : addresses.get(0);
    }
}
