package com.blockscope.domain;

public record AddressUtxo(String address, String txid, int vout, long valueSat, long height) {
}
