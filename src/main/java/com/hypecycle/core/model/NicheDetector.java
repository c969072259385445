package com.hypecycle.core.model;

/**
 * Decides whether social signal is too sparse to classify on the raw keyword alone.
 * <p>
 * A keyword is niche when recent Hacker News mentions fall below {@code recentThreshold}
 * or all-time mentions fall below {@code totalThreshold}. Without social metrics the
 * detector never fires.
 */
public final class NicheDetector {

    public static final long DEFAULT_RECENT_THRESHOLD = 50;
    public static final long DEFAULT_TOTAL_THRESHOLD = 100;

    private final long recentThreshold;
    private final long totalThreshold;

    public NicheDetector(long recentThreshold, long totalThreshold) {
        this.recentThreshold = recentThreshold;
        this.totalThreshold = totalThreshold;
    }

    public static NicheDetector withDefaults() {
        return new NicheDetector(DEFAULT_RECENT_THRESHOLD, DEFAULT_TOTAL_THRESHOLD);
    }

    public boolean isNiche(SourceMetrics social) {
        if (social == null || social.source() != SourceName.SOCIAL) {
            return false;
        }
        return social.recentVolume() < recentThreshold || social.totalVolume() < totalThreshold;
    }

    public long recentThreshold() {
        return recentThreshold;
    }

    public long totalThreshold() {
        return totalThreshold;
    }
}
