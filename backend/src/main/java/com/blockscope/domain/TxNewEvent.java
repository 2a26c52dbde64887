package com.blockscope.domain;

public record TxNewEvent(String txid) implements ChainEvent {
}
