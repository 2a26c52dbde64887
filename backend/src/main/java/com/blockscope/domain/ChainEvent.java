package com.blockscope.domain;

/**
 * Marker for events published on the in-process chain feed.
 */
public interface ChainEvent {
}
