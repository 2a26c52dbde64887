package com.blockscope.indexer.config;

import com.blockscope.common.RetryPolicy;
import com.blockscope.config.AsyncConfig;
import com.blockscope.config.CaffeineConfig;
import com.blockscope.indexer.adapter.BitcoinRpcClient;
import com.blockscope.indexer.adapter.WebClientBitcoinRpcClient;
import com.blockscope.indexer.engine.AddressIndexer;
import com.blockscope.indexer.feed.ChainEventFeed;
import com.blockscope.indexer.prevout.PrevoutResolver;
import com.blockscope.indexer.prevout.PrevoutWorkerPool;
import com.blockscope.indexer.status.IndexerMetrics;
import com.blockscope.indexer.status.IndexerStatusReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the RPC client and the address indexer with its collaborators.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({AddressIndexProperties.class, BitcoinRpcProperties.class})
public class IndexerConfig {

    @Bean
    public RateLimiter bitcoinRpcRateLimiter(BitcoinRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofMillis(Math.max(0, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("bitcoin-rpc", config);
    }

    @Bean
    public BitcoinRpcClient bitcoinRpcClient(WebClient.Builder builder, BitcoinRpcProperties properties,
                                             RateLimiter bitcoinRpcRateLimiter, ObjectMapper objectMapper) {
        return new WebClientBitcoinRpcClient(builder, properties, bitcoinRpcRateLimiter, objectMapper);
    }

    @Bean
    public RetryPolicy blockFetchRetryPolicy(AddressIndexProperties properties) {
        return new RetryPolicy(properties.getBlockFetchBaseDelayMs(), 0, Math.max(1, properties.getBlockFetchMaxAttempts()));
    }

    @Bean
    public PrevoutResolver prevoutResolver(BitcoinRpcClient rpcClient, AddressIndexProperties properties,
                                           @Qualifier(AsyncConfig.PREVOUT_EXECUTOR) Executor prevoutExecutor,
                                           CacheManager cacheManager, IndexerMetrics metrics) {
        PrevoutWorkerPool pool = null;
        int requested = properties.getPrevoutConcurrency();
        if (properties.isParallelPrevoutEnabled() && requested > 1) {
            if (requested > PrevoutResolver.MAX_RECOMMENDED_CONCURRENCY) {
                log.warn("prevout-concurrency {} above recommended maximum {}, capping",
                        requested, PrevoutResolver.MAX_RECOMMENDED_CONCURRENCY);
            }
            pool = new PrevoutWorkerPool(rpcClient, prevoutExecutor,
                    Math.min(requested, PrevoutResolver.MAX_RECOMMENDED_CONCURRENCY));
        }
        return new PrevoutResolver(rpcClient, pool, cacheManager.getCache(CaffeineConfig.PREVOUT_CACHE), metrics);
    }

    @Bean
    public IndexerStatusReporter indexerStatusReporter(BitcoinRpcClient rpcClient, IndexerMetrics metrics,
                                                       AddressIndexProperties properties) {
        return new IndexerStatusReporter(rpcClient, metrics, Clock.systemUTC(), properties.getStatusSampleWindow());
    }

    @Bean
    public AddressIndexer addressIndexer(AddressIndexProperties properties, BitcoinRpcClient rpcClient,
                                         ChainEventFeed feed, PrevoutResolver prevoutResolver,
                                         IndexerStatusReporter indexerStatusReporter, IndexerMetrics metrics,
                                         RetryPolicy blockFetchRetryPolicy,
                                         @Qualifier(AsyncConfig.INDEXER_SYNC_EXECUTOR) Executor syncExecutor) {
        return new AddressIndexer(properties, rpcClient, feed, prevoutResolver, indexerStatusReporter, metrics,
                blockFetchRetryPolicy, syncExecutor);
    }
}
