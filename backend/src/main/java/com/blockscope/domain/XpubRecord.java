package com.blockscope.domain;

/**
 * Persisted scan state of an extended public key. Indices are -1 when no address of the branch was used.
 */
public record XpubRecord(
        String xpub,
        String network,
        int gapLimit,
        int lastReceiveIndex,
        int lastChangeIndex,
        long updatedAt
) {
}
