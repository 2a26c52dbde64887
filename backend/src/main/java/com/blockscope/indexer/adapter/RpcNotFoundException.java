package com.blockscope.indexer.adapter;

/**
 * Node does not know the requested block or transaction (RPC code -5).
 */
public class RpcNotFoundException extends RpcException {

    public RpcNotFoundException(String message) {
        super(message);
    }
}
