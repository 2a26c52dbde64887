package com.blockscope.indexer.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Bitcoin Core JSON-RPC call contract.
 */
public interface BitcoinRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param method e.g. "getblock"
     * @param params positional params
     * @return the "result" member of the response
     * @throws RpcNotFoundException    when the node reports the object is unknown (code -5)
     * @throws RpcBadRequestException  when the node rejects the parameters (code -8, -32602)
     * @throws RpcUnavailableException on transport, auth, timeout or any other RPC error
     */
    JsonNode call(String method, Object... params);
}
