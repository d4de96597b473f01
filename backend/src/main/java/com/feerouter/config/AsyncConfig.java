package com.feerouter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: distribution events are recorded off the crank path, the keeper runs vaults in parallel.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String EVENTS_EXECUTOR = "distribution-events-executor";
    public static final String KEEPER_EXECUTOR = "keeper-executor";

    @Bean(name = EVENTS_EXECUTOR)
    public Executor distributionEventsExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("dist-events-");
        e.initialize();
        return e;
    }

    /** One crank loop per vault at a time; vaults are independent. */
    @Bean(name = KEEPER_EXECUTOR)
    public Executor keeperExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("keeper-");
        e.initialize();
        return e;
    }
}
