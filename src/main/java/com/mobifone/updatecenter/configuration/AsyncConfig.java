package com.mobifone.updatecenter.configuration;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ReconcilerProperties properties;

    // one long-lived task per executing batch; no queue, so every accepted batch gets its own thread
    // and the pool rejects instead of parking a batch past maxPoolSize
    @Bean(name = "reconcilerExecutor")
    public Executor reconcilerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("reconciler-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
