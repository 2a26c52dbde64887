package com.blockscope.domain;

/**
 * A block with this hash was announced as the new chain tip.
 */
public record BlockNewEvent(String hash) implements ChainEvent {
}
