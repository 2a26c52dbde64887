package com.blockscope.config;

import com.blockscope.indexer.config.AddressIndexProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. The prevout cache is sized from blockscope.address-index.prevout-cache-*.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PREVOUT_CACHE = "prevoutCache";

    @Bean
    public CacheManager caffeineCacheManager(AddressIndexProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PREVOUT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(Math.max(1, properties.getPrevoutCacheTtlMs()), TimeUnit.MILLISECONDS)
                .maximumSize(Math.max(1, properties.getPrevoutCacheMax()))
                .build());
        return manager;
    }
}
