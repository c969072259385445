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
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * News coverage signals from the GDELT DOC 2.0 API.
 * <p>
 * Each of three windows (last 30 days, 30 to 90 days ago, 90 to 365 days ago) is read in
 * three modes: the article list, the volume timeline and, for the recent window, the tone
 * histogram. A window counts as failed if any of its requests fails.
 */
@Component
public class NewsCollector extends AbstractHttpCollector {

    private static final DateTimeFormatter GDELT_TIME =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    public NewsCollector(HttpClient collectorHttpClient, ObjectMapper objectMapper,
                         CollectorProperties properties, Clock clock) {
        super(collectorHttpClient, objectMapper, properties, clock);
    }

    @Override
    public SourceName source() {
        return SourceName.NEWS;
    }

    @Override
    public CollectorOutcome fetch(String keyword, List<String> expansionTerms) {
        Instant now = clock.instant();
        Instant start30d = now.minus(30, ChronoUnit.DAYS);
        Instant start3m = now.minus(90, ChronoUnit.DAYS);
        Instant start1y = now.minus(365, ChronoUnit.DAYS);
        String query = expansionTerms == null || expansionTerms.isEmpty()
                ? "\"" + keyword + "\""
                : "(" + phraseQuery(keyword, expansionTerms, " OR ") + ")";

        List<String> errors = new ArrayList<>();
        Window recent = fetchWindow(query, start30d, now, true, errors);
        Window middle = fetchWindow(query, start3m, start30d, false, errors);
        Window old = fetchWindow(query, start1y, start3m, false, errors);
        if (recent == null && middle == null && old == null) {
            return allRequestsFailed(errors);
        }

        long articles30d = recent != null ? recent.articles().size() : 0;
        long articles3m = middle != null ? middle.articles().size() : 0;
        long articles1y = old != null ? old.articles().size() : 0;
        long total = articles30d + articles3m + articles1y;

        Map<String, Integer> countries = new LinkedHashMap<>();
        Set<String> domains = new HashSet<>();
        for (Window window : new Window[] {recent, middle, old}) {
            if (window == null) {
                continue;
            }
            for (JsonNode article : window.articles()) {
                countries.merge(article.path("sourcecountry").asText("Unknown"), 1, Integer::sum);
                String domain = article.path("domain").asText("");
                if (!domain.isEmpty()) {
                    domains.add(domain);
                }
            }
        }

        double avgTone = recent != null ? averageTone(recent.tone()) : 0.0;
        double intensity30d = recent != null ? recent.volumeIntensity() : 0.0;
        double intensity3m = middle != null ? middle.volumeIntensity() : 0.0;
        double intensity1y = old != null ? old.volumeIntensity() : 0.0;

        Map<String, Object> extra = orderedMap();
        extra.put("articles_30d", articles30d);
        extra.put("articles_3m", articles3m);
        extra.put("articles_1y", articles1y);
        extra.put("articles_total", total);
        extra.put("geographic_diversity", countries.size());
        extra.put("unique_domains", domains.size());
        extra.put("avg_tone", round(avgTone, 3));
        extra.put("volume_intensity_30d", round(intensity30d, 3));
        extra.put("volume_intensity_3m", round(intensity3m, 3));
        extra.put("volume_intensity_1y", round(intensity1y, 3));
        extra.put("media_attention", mediaAttention(total));
        extra.put("coverage_trend", coverageTrend(intensity30d, intensity3m, intensity1y));
        extra.put("sentiment_trend", sentimentTrend(avgTone));
        extra.put("mainstream_adoption", mainstreamAdoption(domains.size(), total));

        return CollectorOutcome.ok(new SourceMetrics(SourceName.NEWS, keyword, now,
                articles30d, total, extra, errors));
    }

    private Window fetchWindow(String query, Instant start, Instant end, boolean withTone, List<String> errors) {
        Map<String, String> base = new LinkedHashMap<>();
        base.put("query", query);
        base.put("format", "json");
        base.put("startdatetime", GDELT_TIME.format(start));
        base.put("enddatetime", GDELT_TIME.format(end));

        var articles = getJson(properties.getNewsUrl(), withMode(base, "ArtList", "250"), Map.of(), errors);
        if (articles.isEmpty()) {
            return null;
        }
        var timeline = getJson(properties.getNewsUrl(), withMode(base, "timelinevol", null), Map.of(), errors);
        if (timeline.isEmpty()) {
            return null;
        }
        JsonNode tone = null;
        if (withTone) {
            tone = getJson(properties.getNewsUrl(), withMode(base, "ToneChart", null), Map.of(), errors).orElse(null);
            if (tone == null) {
                return null;
            }
        }

        List<JsonNode> list = new ArrayList<>();
        articles.get().path("articles").forEach(list::add);
        return new Window(list, volumeIntensity(timeline.get()), tone);
    }

    private static Map<String, String> withMode(Map<String, String> base, String mode, String maxRecords) {
        Map<String, String> params = new LinkedHashMap<>(base);
        params.put("mode", mode);
        if (maxRecords != null) {
            params.put("maxrecords", maxRecords);
        }
        return params;
    }

    /** Mean of the first timeline series. */
    static double volumeIntensity(JsonNode timeline) {
        JsonNode points = timeline.path("timeline").path(0).path("data");
        if (!points.isArray() || points.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (JsonNode point : points) {
            sum += point.path("value").asDouble(0);
        }
        return sum / points.size();
    }

    /** Weighted mean tone bin rescaled to [-1, 1]; bin 5 is neutral. */
    static double averageTone(JsonNode toneChart) {
        if (toneChart == null) {
            return 0.0;
        }
        long totalCount = 0;
        double weighted = 0;
        for (JsonNode bin : toneChart.path("tonechart")) {
            long count = bin.path("count").asLong(0);
            totalCount += count;
            weighted += bin.path("bin").asDouble(5) * count;
        }
        return totalCount > 0 ? (weighted / totalCount - 5) / 5.0 : 0.0;
    }

    static String mediaAttention(long totalArticles) {
        if (totalArticles >= 500) {
            return "high";
        }
        return totalArticles >= 100 ? "medium" : "low";
    }

    static String coverageTrend(double volume30d, double volume3m, double volume1y) {
        if (volume3m == 0 && volume1y == 0) {
            return volume30d > 0 ? "stable" : "unknown";
        }
        double historical = (volume3m + volume1y) / 2;
        if (volume30d > historical * 1.3) {
            return "increasing";
        }
        return volume30d < historical * 0.7 ? "decreasing" : "stable";
    }

    static String sentimentTrend(double avgTone) {
        if (avgTone > 0.2) {
            return "positive";
        }
        return avgTone < -0.2 ? "negative" : "neutral";
    }

    static String mainstreamAdoption(int uniqueDomains, long totalArticles) {
        if (totalArticles == 0) {
            return "niche";
        }
        double diversity = (double) uniqueDomains / totalArticles;
        if (uniqueDomains >= 50 && diversity > 0.3) {
            return "mainstream";
        }
        return uniqueDomains >= 20 ? "emerging" : "niche";
    }

    private record Window(List<JsonNode> articles, double volumeIntensity, JsonNode tone) {}
}
