package com.hypecycle.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Orchestration settings bound from {@code hypecycle.*}.
 */
@Component
@ConfigurationProperties(prefix = "hypecycle")
public class HypeCycleProperties {

    private Classification classification = new Classification();
    private Cache cache = new Cache();
    private Niche niche = new Niche();
    private Executor executor = new Executor();

    // -- Flat accessors (delegate to nested) --
    public int getMinimumSources() { return classification.minimumSources; }
    public int getCollectorTimeoutSeconds() { return classification.collectorTimeoutSeconds; }
    public int getCacheTtlHours() { return cache.ttlHours; }
    public long getRecentVolumeThreshold() { return niche.recentVolumeThreshold; }
    public long getTotalVolumeThreshold() { return niche.totalVolumeThreshold; }

    public Classification getClassification() { return classification; }
    public void setClassification(Classification classification) { this.classification = classification; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Niche getNiche() { return niche; }
    public void setNiche(Niche niche) { this.niche = niche; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public static class Classification {
        private int minimumSources = 3;
        private int collectorTimeoutSeconds = 120;

        public int getMinimumSources() { return minimumSources; }
        public void setMinimumSources(int minimumSources) { this.minimumSources = minimumSources; }
        public int getCollectorTimeoutSeconds() { return collectorTimeoutSeconds; }
        public void setCollectorTimeoutSeconds(int collectorTimeoutSeconds) { this.collectorTimeoutSeconds = collectorTimeoutSeconds; }
    }

    public static class Cache {
        private int ttlHours = 24;

        public int getTtlHours() { return ttlHours; }
        public void setTtlHours(int ttlHours) { this.ttlHours = ttlHours; }
    }

    public static class Niche {
        private long recentVolumeThreshold = 50;
        private long totalVolumeThreshold = 100;

        public long getRecentVolumeThreshold() { return recentVolumeThreshold; }
        public void setRecentVolumeThreshold(long recentVolumeThreshold) { this.recentVolumeThreshold = recentVolumeThreshold; }
        public long getTotalVolumeThreshold() { return totalVolumeThreshold; }
        public void setTotalVolumeThreshold(long totalVolumeThreshold) { this.totalVolumeThreshold = totalVolumeThreshold; }
    }

    public static class Executor {
        private int collectorThreads = 10;
        private int classifierThreads = 5;

        public int getCollectorThreads() { return collectorThreads; }
        public void setCollectorThreads(int collectorThreads) { this.collectorThreads = collectorThreads; }
        public int getClassifierThreads() { return classifierThreads; }
        public void setClassifierThreads(int classifierThreads) { this.classifierThreads = classifierThreads; }
    }
}
