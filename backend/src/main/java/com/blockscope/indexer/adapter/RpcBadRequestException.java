package com.blockscope.indexer.adapter;

/**
 * Node rejected the call parameters (RPC code -8 or -32602).
 */
public class RpcBadRequestException extends RpcException {

    public RpcBadRequestException(String message) {
        super(message);
    }
}
