package com.blockscope.indexer.engine;

import com.blockscope.config.AsyncConfig;
import com.blockscope.indexer.config.AddressIndexProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Starts the address indexer once the application is ready on the coordinator executor
 * and shuts it down with the context.
 */
@Slf4j
@Component
public class AddressIndexerLifecycle {

    private final AddressIndexer indexer;
    private final AddressIndexProperties properties;
    private final Executor coordinatorExecutor;

    public AddressIndexerLifecycle(AddressIndexer indexer,
                                   AddressIndexProperties properties,
                                   @Qualifier(AsyncConfig.INDEXER_COORDINATOR_EXECUTOR) Executor coordinatorExecutor) {
        this.indexer = indexer;
        this.properties = properties;
        this.coordinatorExecutor = coordinatorExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("Address indexer disabled (blockscope.address-index.enabled=false)");
            return;
        }
        coordinatorExecutor.execute(this::startIndexer);
    }

    void startIndexer() {
        try {
            indexer.start();
        } catch (RuntimeException e) {
            log.warn("Address indexer not running, status will report error: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        indexer.shutdown();
    }
}
