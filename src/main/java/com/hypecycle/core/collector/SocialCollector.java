package com.hypecycle.core.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hacker News discussion volume and engagement via the Algolia search API.
 * <p>
 * Stories are counted over three disjoint windows: the last 30 days, 30 to 180 days ago,
 * and 180 to 365 days ago. With expansion terms every window is queried once per term
 * and the hit counts are summed.
 */
@Component
public class SocialCollector extends AbstractHttpCollector {

    static final int HITS_PER_PAGE = 20;

    public SocialCollector(HttpClient collectorHttpClient, ObjectMapper objectMapper,
                           CollectorProperties properties, Clock clock) {
        super(collectorHttpClient, objectMapper, properties, clock);
    }

    @Override
    public SourceName source() {
        return SourceName.SOCIAL;
    }

    @Override
    public CollectorOutcome fetch(String keyword, List<String> expansionTerms) {
        Instant now = clock.instant();
        long thirtyDaysAgo = now.minus(30, ChronoUnit.DAYS).getEpochSecond();
        long sixMonthsAgo = now.minus(180, ChronoUnit.DAYS).getEpochSecond();
        long oneYearAgo = now.minus(365, ChronoUnit.DAYS).getEpochSecond();

        List<String> errors = new ArrayList<>();
        List<String> queries = searchTerms(keyword, expansionTerms);
        Period recent = fetchPeriod(queries, thirtyDaysAgo, null, errors);
        Period middle = fetchPeriod(queries, sixMonthsAgo, thirtyDaysAgo, errors);
        Period old = fetchPeriod(queries, oneYearAgo, sixMonthsAgo, errors);
        if (recent == null && middle == null && old == null) {
            return allRequestsFailed(errors);
        }

        long mentions30d = recent != null ? recent.hits() : 0;
        long mentions6m = middle != null ? middle.hits() : 0;
        long mentions1y = old != null ? old.hits() : 0;
        long total = mentions30d + mentions6m + mentions1y;

        double avgPoints30d = recent != null ? average(recent.stories(), "points") : 0.0;
        double avgComments30d = recent != null ? average(recent.stories(), "num_comments") : 0.0;
        double avgPoints6m = middle != null ? average(middle.stories(), "points") : 0.0;
        double avgComments6m = middle != null ? average(middle.stories(), "num_comments") : 0.0;

        Map<String, Object> extra = orderedMap();
        extra.put("mentions_30d", mentions30d);
        extra.put("mentions_6m", mentions6m);
        extra.put("mentions_1y", mentions1y);
        extra.put("mentions_total", total);
        extra.put("avg_points_30d", round(avgPoints30d, 2));
        extra.put("avg_comments_30d", round(avgComments30d, 2));
        extra.put("avg_points_6m", round(avgPoints6m, 2));
        extra.put("avg_comments_6m", round(avgComments6m, 2));
        extra.put("sentiment", round(sentiment(avgPoints30d), 3));
        extra.put("recency", recency(mentions30d, mentions6m, mentions1y));
        extra.put("growth_trend", growthTrend(mentions30d, mentions6m, mentions1y));
        extra.put("momentum", momentum(mentions30d, mentions6m, mentions1y));
        extra.put("top_stories", topStories(recent, now));

        return CollectorOutcome.ok(new SourceMetrics(SourceName.SOCIAL, keyword, now,
                mentions30d, total, extra, errors));
    }

    private Period fetchPeriod(List<String> queries, long startTs, Long endTs, List<String> errors) {
        String numericFilter = endTs == null
                ? "created_at_i>" + startTs
                : "created_at_i>" + startTs + ",created_at_i<" + endTs;
        long hits = 0;
        List<JsonNode> stories = new ArrayList<>();
        List<String> seenIds = new ArrayList<>();
        boolean anySucceeded = false;
        for (String query : queries) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("query", query);
            params.put("tags", "story");
            params.put("numericFilters", numericFilter);
            params.put("hitsPerPage", String.valueOf(HITS_PER_PAGE));
            var body = getJson(properties.getSocialUrl(), params, Map.of(), errors);
            if (body.isEmpty()) {
                continue;
            }
            anySucceeded = true;
            hits += body.get().path("nbHits").asLong(0);
            for (JsonNode story : body.get().path("hits")) {
                String id = story.path("objectID").asText("");
                if (id.isEmpty() || !seenIds.contains(id)) {
                    seenIds.add(id);
                    stories.add(story);
                }
            }
        }
        return anySucceeded ? new Period(hits, stories) : null;
    }

    private static double average(List<JsonNode> stories, String field) {
        if (stories.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (JsonNode story : stories) {
            sum += story.path(field).asDouble(0);
        }
        return sum / stories.size();
    }

    private static List<Map<String, Object>> topStories(Period recent, Instant now) {
        List<Map<String, Object>> top = new ArrayList<>();
        if (recent == null) {
            return top;
        }
        for (JsonNode story : recent.stories().subList(0, Math.min(5, recent.stories().size()))) {
            long createdAt = story.path("created_at_i").asLong(now.getEpochSecond());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("title", story.path("title").asText(""));
            entry.put("points", story.path("points").asLong(0));
            entry.put("comments", story.path("num_comments").asLong(0));
            entry.put("age_days", (now.getEpochSecond() - createdAt) / 86_400);
            top.add(entry);
        }
        return top;
    }

    /** Community reception in [-1, 1]; 50 average points is neutral. */
    static double sentiment(double avgPoints) {
        return Math.tanh((avgPoints - 50) / 100);
    }

    static String recency(long mentions30d, long mentions6m, long mentions1y) {
        long total = mentions30d + mentions6m + mentions1y;
        if (total == 0) {
            return "low";
        }
        double recentRatio = (double) mentions30d / total;
        if (recentRatio > 0.5) {
            return "high";
        }
        return recentRatio > 0.2 ? "medium" : "low";
    }

    /** Last 30 days against the monthly average of the preceding eleven months, with a 30% band. */
    static String growthTrend(long mentions30d, long mentions6m, long mentions1y) {
        double avgPerMonth = (mentions6m + mentions1y) / 11.0;
        if (mentions30d > avgPerMonth * 1.3) {
            return "increasing";
        }
        if (mentions30d < avgPerMonth * 0.7) {
            return "decreasing";
        }
        return "stable";
    }

    static String momentum(long mentions30d, long mentions6m, long mentions1y) {
        if (mentions30d == 0 && mentions6m == 0) {
            return "steady";
        }
        double recentAvg = mentions30d;
        double midAvg = mentions6m / 5.0;
        double oldAvg = mentions1y / 6.0;

        double midGrowth = oldAvg > 0 ? (midAvg - oldAvg) / oldAvg : (midAvg > 0 ? 1.0 : 0.0);
        double recentGrowth = midAvg > 0 ? (recentAvg - midAvg) / midAvg : (recentAvg > 0 ? 1.0 : 0.0);

        if (recentGrowth > midGrowth * 1.2) {
            return "accelerating";
        }
        if (recentGrowth < midGrowth * 0.8) {
            return "decelerating";
        }
        return "steady";
    }

    private record Period(long hits, List<JsonNode> stories) {}
}
