package com.blockscope.indexer.adapter;

/**
 * Node unreachable, timed out, refused credentials or returned an unexpected error. Callers may retry later.
 */
public class RpcUnavailableException extends RpcException {

    public RpcUnavailableException(String message) {
        super(message);
    }

    public RpcUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
