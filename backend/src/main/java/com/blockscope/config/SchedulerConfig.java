package com.blockscope.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for ChainTipPollJob. Polls never overlap, and a failed poll is logged
 * without cancelling the next one.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String CHAIN_TIP_SCHEDULER = "chain-tip-scheduler";

    @Bean(name = CHAIN_TIP_SCHEDULER)
    public ThreadPoolTaskScheduler chainTipScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("chain-tip-poll-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.setErrorHandler(e -> log.warn("Chain tip poll failed: {}", e.getMessage(), e));
        s.initialize();
        return s;
    }
}
