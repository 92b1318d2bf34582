package com.kmg.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfiguration {

    /**
     * Runs the request pipeline off the servlet thread so a timed-out HTTP request can be answered
     * while its pipeline still settles credits.
     */
    @Bean(name = "gatewayRequestExecutor", destroyMethod = "shutdown")
    public ExecutorService gatewayRequestExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getWorkerThreads(), named("gateway-request-"));
    }

    @Bean(name = "providerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(properties.getPipeline().getProviderThreads(), named("gateway-provider-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
