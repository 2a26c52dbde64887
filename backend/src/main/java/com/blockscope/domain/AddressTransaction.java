package com.blockscope.domain;

/**
 * One history row of an address. ioIndex is the output index for IN rows and the input index for OUT rows.
 * timestamp is the block time in seconds.
 */
public record AddressTransaction(
        String address,
        String txid,
        long height,
        Direction direction,
        long valueSat,
        int ioIndex,
        Long timestamp
) {
}
