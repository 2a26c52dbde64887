package com.blockscope.indexer.store;

/**
 * Output vout of a transaction paying valueSat to address.
 */
public record AddressCredit(String address, int vout, long valueSat) {
}
