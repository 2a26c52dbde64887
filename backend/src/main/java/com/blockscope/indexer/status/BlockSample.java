package com.blockscope.indexer.status;

/**
 * One processed block as seen by the status reporter. timestampMs is the wall-clock completion time.
 */
public record BlockSample(long height, String hash, int txCount, long durationMs, long timestampMs) {
}
