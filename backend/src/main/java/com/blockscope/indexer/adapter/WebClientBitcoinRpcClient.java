package com.blockscope.indexer.adapter;

import com.blockscope.indexer.config.BitcoinRpcProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bitcoin Core JSON-RPC client using WebClient. Calls block the caller; never invoke from an event-loop thread.
 * Credentials come from the cookie file when configured (re-read once on HTTP 401) or from username/password.
 */
@Slf4j
public class WebClientBitcoinRpcClient implements BitcoinRpcClient {

    static final int CODE_NOT_FOUND = -5;
    static final int CODE_INVALID_PARAMETER = -8;
    static final int CODE_INVALID_PARAMS = -32602;
    private static final String COOKIE_USER = "__cookie__";

    private final WebClient webClient;
    private final BitcoinRpcProperties properties;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();
    private volatile Credentials credentials;

    public WebClientBitcoinRpcClient(WebClient.Builder builder, BitcoinRpcProperties properties,
                                     RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode call(String method, Object... params) {
        long startedAt = System.nanoTime();
        try {
            JsonNode result = callWithAuthRetry(method, params);
            log.debug("rpc.success method={} durationMs={}", method, elapsedMs(startedAt));
            return result;
        } catch (RpcUnavailableException e) {
            log.error("rpc.failure method={} durationMs={}: {}", method, elapsedMs(startedAt), e.getMessage());
            throw e;
        } catch (RpcException e) {
            log.warn("rpc.warning method={} durationMs={}: {}", method, elapsedMs(startedAt), e.getMessage());
            throw e;
        }
    }

    private JsonNode callWithAuthRetry(String method, Object[] params) {
        if (rateLimiter != null && !rateLimiter.acquirePermission()) {
            throw new RpcUnavailableException("Local RPC rate limit exceeded for " + method);
        }
        RawResponse response = post(method, params);
        if (response.status() == 401 && usesCookie()) {
            log.warn("rpc.auth.retry method={}: reloading cookie credentials", method);
            credentials = null;
            response = post(method, params);
        }
        if (response.status() == 401 || response.status() == 403) {
            throw new RpcUnavailableException("Bitcoin RPC authentication failed");
        }
        return parse(method, response);
    }

    private RawResponse post(String method, Object[] params) {
        Credentials creds = resolveCredentials();
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? Arrays.asList(params) : new Object[]{}
        );
        try {
            RawResponse response = webClient.post()
                    .uri(properties.getUrl())
                    .headers(h -> h.setBasicAuth(creds.username(), creds.password(), StandardCharsets.UTF_8))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(b -> new RawResponse(r.statusCode().value(), b)))
                    .timeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
                    .block();
            if (response == null) {
                throw new RpcUnavailableException("Empty response from Bitcoin RPC");
            }
            return response;
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcUnavailableException("Bitcoin RPC unreachable or timed out", e);
        }
    }

    private JsonNode parse(String method, RawResponse response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RpcUnavailableException("Unexpected RPC response for " + method + " (HTTP " + response.status() + ")", e);
        }
        if (root == null || !root.isObject()) {
            throw new RpcUnavailableException("Unexpected RPC response for " + method + " (HTTP " + response.status() + ")");
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw mapRpcError(error);
        }
        return root.path("result");
    }

    static RpcException mapRpcError(JsonNode error) {
        JsonNode codeNode = error.path("code");
        String message = error.path("message").asText("");
        if (!codeNode.isNumber()) {
            return new RpcUnavailableException("Unexpected RPC error response");
        }
        int code = codeNode.asInt();
        if (code == CODE_NOT_FOUND) {
            return new RpcNotFoundException(message.isBlank() ? "Resource not found" : message);
        }
        if (code == CODE_INVALID_PARAMETER || code == CODE_INVALID_PARAMS) {
            return new RpcBadRequestException(message.isBlank() ? "Invalid parameters" : message);
        }
        return new RpcUnavailableException(message.isBlank() ? "Bitcoin RPC error " + code : message);
    }

    private Credentials resolveCredentials() {
        Credentials current = credentials;
        if (current != null) {
            return current;
        }
        Credentials resolved;
        if (usesCookie()) {
            resolved = readCookie(Path.of(properties.getCookiePath()));
        } else if (properties.getUsername() != null && properties.getPassword() != null) {
            resolved = new Credentials(properties.getUsername(), properties.getPassword());
        } else {
            throw new RpcUnavailableException("Bitcoin RPC credentials are not configured");
        }
        credentials = resolved;
        return resolved;
    }

    private boolean usesCookie() {
        return properties.getCookiePath() != null && !properties.getCookiePath().isBlank();
    }

    static Credentials readCookie(Path cookiePath) {
        String raw;
        try {
            raw = Files.readString(cookiePath, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new RpcUnavailableException("Cannot read Bitcoin RPC cookie file " + cookiePath, e);
        }
        if (raw.isEmpty()) {
            throw new RpcUnavailableException("Bitcoin RPC cookie file is empty");
        }
        int colon = raw.indexOf(':');
        if (colon >= 0) {
            return new Credentials(raw.substring(0, colon), raw.substring(colon + 1));
        }
        return new Credentials(COOKIE_USER, raw);
    }

    private static double elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000.0;
    }

    record Credentials(String username, String password) {}

    private record RawResponse(int status, String body) {}
}
