package com.blockscope.indexer.store;

/**
 * The index database could not be created, opened or migrated.
 */
public class StoreOpenException extends RuntimeException {

    public StoreOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
