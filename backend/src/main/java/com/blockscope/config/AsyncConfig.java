package com.blockscope.config;

import com.blockscope.indexer.config.AddressIndexProperties;
import com.blockscope.indexer.prevout.PrevoutResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: prevout-executor (RPC fan-out for spent outputs), indexer-sync-executor (the single
 * writer for live block application) and indexer-coordinator-executor (runs start-up and backfill).
 */
@Configuration
public class AsyncConfig {

    public static final String PREVOUT_EXECUTOR = "prevout-executor";
    public static final String INDEXER_SYNC_EXECUTOR = "indexer-sync-executor";
    public static final String INDEXER_COORDINATOR_EXECUTOR = "indexer-coordinator-executor";

    @Bean(name = PREVOUT_EXECUTOR)
    public ThreadPoolTaskExecutor prevoutExecutor(AddressIndexProperties properties) {
        int workers = Math.max(1, Math.min(properties.getPrevoutConcurrency(), PrevoutResolver.MAX_RECOMMENDED_CONCURRENCY));
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setThreadNamePrefix("prevout-");
        e.initialize();
        return e;
    }

    /** Single thread so two block applications can never overlap. */
    @Bean(name = INDEXER_SYNC_EXECUTOR)
    public ThreadPoolTaskExecutor indexerSyncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("indexer-sync-");
        e.initialize();
        return e;
    }

    @Bean(name = INDEXER_COORDINATOR_EXECUTOR)
    public ThreadPoolTaskExecutor indexerCoordinatorExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("indexer-coord-");
        e.initialize();
        return e;
    }
}
