package com.blockscope.explorer;

/**
 * The address index cannot serve queries right now (starting, failed or stopped).
 */
public class IndexerUnavailableException extends RuntimeException {

    public IndexerUnavailableException(String message) {
        super(message);
    }

    public IndexerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
