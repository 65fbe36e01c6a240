package com.sgr.runtime.executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    // graph nodes block on their children, so the pool must not be bounded
    @Bean(name = "graphExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService graphExecutorService() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("graph-exec-"));
    }

    @Bean(name = "jobExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutorService() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("job-exec-"));
    }
}
