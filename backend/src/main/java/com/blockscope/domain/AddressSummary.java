package com.blockscope.domain;

/**
 * Aggregated activity of one address. balanceSat is always totalReceivedSat - totalSentSat.
 */
public record AddressSummary(
        String address,
        Long firstSeenHeight,
        Long lastSeenHeight,
        long totalReceivedSat,
        long totalSentSat,
        long balanceSat,
        long txCount,
        long utxoCount,
        long utxoValueSat
) {
}
