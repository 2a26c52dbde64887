package com.blockscope.indexer.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bitcoin Core JSON-RPC endpoint. Either cookiePath or username/password must be set.
 */
@ConfigurationProperties(prefix = "blockscope.rpc")
@NoArgsConstructor
@Getter
@Setter
public class BitcoinRpcProperties {

    private String url = "http://127.0.0.1:8332";

    private String username;

    private String password;

    /** Path to the node's .cookie file; takes precedence over username/password. */
    private String cookiePath;

    private long timeoutMs = 3_000;

    /** Local RPC budget (requests per second) shared by all indexer threads. */
    private int maxRequestsPerSecond = 500;

    /** How long a caller may wait for a local rate-limit permit. */
    private long limiterTimeoutMs = 5_000;
}
