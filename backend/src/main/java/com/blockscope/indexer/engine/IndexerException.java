package com.blockscope.indexer.engine;

/**
 * Indexer failure that is not an RPC or store-open error, e.g. querying before the index is open.
 */
public class IndexerException extends RuntimeException {

    public IndexerException(String message) {
        super(message);
    }

    public IndexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
