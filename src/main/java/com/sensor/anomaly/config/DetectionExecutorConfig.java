package com.sensor.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DetectionExecutorConfig {

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionConfig config) {
        AtomicInteger threadIndex = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(config.getWorkerThreads(), 1), r -> {
            Thread t = new Thread(r, "anomaly-detect-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
