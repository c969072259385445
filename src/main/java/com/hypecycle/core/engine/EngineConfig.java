package com.hypecycle.core.engine;

import com.hypecycle.core.model.NicheDetector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared executors and collaborators for the classification pipeline.
 * Executors are shut down by Spring when the context closes.
 */
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectorExecutor(HypeCycleProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getCollectorThreads(),
                namedDaemonThreads("collector"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService classifierExecutor(HypeCycleProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getClassifierThreads(),
                namedDaemonThreads("classifier"));
    }

    @Bean
    public NicheDetector nicheDetector(HypeCycleProperties properties) {
        return new NicheDetector(properties.getRecentVolumeThreshold(), properties.getTotalVolumeThreshold());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    public static ThreadFactory namedDaemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
