package com.blockscope.domain;

/**
 * Reference to a transaction output (txid, vout).
 */
public record OutPoint(String txid, int vout) {

    /** Cache key "txid:vout". */
    public String key() {
        return txid + ":" + vout;
    }
}
