package com.blockscope.indexer.store;

/**
 * Input inputIndex of a transaction spending prevTxid:prevVout, which paid valueSat to address.
 */
public record AddressDebit(String address, int inputIndex, String prevTxid, int prevVout, long valueSat) {
}
