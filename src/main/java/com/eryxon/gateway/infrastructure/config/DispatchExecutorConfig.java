package com.eryxon.gateway.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool used to fan one event out to its brokers concurrently.
 * Each subscribed broker of a dispatch call gets its own task.
 */
@Configuration
public class DispatchExecutorConfig {

    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor(GatewayProperties properties) {
        GatewayProperties.Dispatch dispatch = properties.getDispatch();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(dispatch.getCorePoolSize(), dispatch.getMaxPoolSize()));
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("broker-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
