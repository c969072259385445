package com.hypecycle.core.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hypecycle.core.model.CollectorOutcome;
import com.hypecycle.core.model.SourceMetrics;
import com.hypecycle.core.model.SourceName;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Patent filing signals from the PatentsView search API.
 * <p>
 * Three windows are queried by grant date: the last two years, three to seven years
 * ago and eight to twelve years ago. Requests require an API key; without one the
 * collector fails.
 */
@Component
public class PatentsCollector extends AbstractHttpCollector {

    static final List<String> FIELDS = List.of(
            "patent_id", "patent_title", "patent_date",
            "patent_num_times_cited_by_us_patents", "assignees");

    public PatentsCollector(HttpClient collectorHttpClient, ObjectMapper objectMapper,
                            CollectorProperties properties, Clock clock) {
        super(collectorHttpClient, objectMapper, properties, clock);
    }

    @Override
    public SourceName source() {
        return SourceName.PATENTS;
    }

    @Override
    public CollectorOutcome fetch(String keyword, List<String> expansionTerms) {
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();
        if (!properties.hasPatentsviewApiKey()) {
            errors.add("Missing PatentsView API key");
            return allRequestsFailed(errors);
        }

        int currentYear = LocalDate.ofInstant(now, ZoneOffset.UTC).getYear();
        List<String> terms = searchTerms(keyword, expansionTerms);
        JsonNode recent = fetchPeriod(terms, currentYear - 2, currentYear - 1, errors);
        JsonNode middle = fetchPeriod(terms, currentYear - 7, currentYear - 3, errors);
        JsonNode old = fetchPeriod(terms, currentYear - 12, currentYear - 8, errors);
        if (recent == null && middle == null && old == null) {
            return allRequestsFailed(errors);
        }

        long patents2y = totalHits(recent);
        long patents5y = totalHits(middle);
        long patents10y = totalHits(old);
        long total = patents2y + patents5y + patents10y;

        Map<String, Integer> assigneeCounts = new LinkedHashMap<>();
        Map<String, Integer> countryCounts = new LinkedHashMap<>();
        for (JsonNode response : new JsonNode[] {recent, middle, old}) {
            for (JsonNode patent : patents(response)) {
                for (JsonNode assignee : patent.path("assignees")) {
                    String organization = assignee.path("assignee_organization").asText("");
                    assigneeCounts.merge(organization.isEmpty() ? "Individual" : organization, 1, Integer::sum);
                    String country = assignee.path("assignee_country").asText("");
                    if (!country.isEmpty() && !"Unknown".equals(country)) {
                        countryCounts.merge(country, 1, Integer::sum);
                    }
                }
            }
        }

        double avgCitations2y = averageCitations(patents(recent));
        double avgCitations5y = averageCitations(patents(middle));

        Map<String, Object> extra = orderedMap();
        extra.put("patents_2y", patents2y);
        extra.put("patents_5y", patents5y);
        extra.put("patents_10y", patents10y);
        extra.put("patents_total", total);
        extra.put("unique_assignees", assigneeCounts.size());
        extra.put("countries", new LinkedHashMap<>(countryCounts));
        extra.put("geographic_diversity", countryCounts.size());
        extra.put("avg_citations_2y", round(avgCitations2y, 2));
        extra.put("avg_citations_5y", round(avgCitations5y, 2));
        extra.put("filing_velocity", round(filingVelocity(patents2y, patents5y), 3));
        extra.put("assignee_concentration", assigneeConcentration(assigneeCounts, total));
        extra.put("geographic_reach", geographicReach(countryCounts));
        extra.put("patent_maturity", maturity(total, avgCitations2y));
        extra.put("patent_momentum", momentum(patents2y, patents5y));

        return CollectorOutcome.ok(new SourceMetrics(SourceName.PATENTS, keyword, now,
                patents2y, total, extra, errors));
    }

    private JsonNode fetchPeriod(List<String> terms, int yearStart, int yearEnd, List<String> errors) {
        Map<String, String> params = new LinkedHashMap<>();
        try {
            params.put("q", objectMapper.writeValueAsString(buildQuery(terms, yearStart, yearEnd)));
            params.put("f", objectMapper.writeValueAsString(FIELDS));
            params.put("o", objectMapper.writeValueAsString(Map.of("size", 100)));
        } catch (JsonProcessingException e) {
            errors.add("Could not encode query: " + e.getOriginalMessage());
            return null;
        }
        JsonNode body = getJson(properties.getPatentsUrl(), params,
                Map.of("X-Api-Key", properties.getPatentsviewApiKey()), errors).orElse(null);
        if (body != null && body.path("error").asBoolean(false)) {
            errors.add("API returned error flag");
            return null;
        }
        return body;
    }

    /** Title-or-abstract match for any of the terms, restricted to the grant-date window. */
    ObjectNode buildQuery(List<String> terms, int yearStart, int yearEnd) {
        ObjectNode query = objectMapper.createObjectNode();
        ArrayNode and = query.putArray("_and");
        ArrayNode or = and.addObject().putArray("_or");
        for (String term : terms) {
            or.addObject().putObject("_text_all").put("patent_title", term);
            or.addObject().putObject("_text_all").put("patent_abstract", term);
        }
        and.addObject().putObject("_gte").put("patent_date", yearStart + "-01-01");
        and.addObject().putObject("_lte").put("patent_date", yearEnd + "-12-31");
        return query;
    }

    private static long totalHits(JsonNode response) {
        return response != null ? response.path("total_hits").asLong(0) : 0;
    }

    private static List<JsonNode> patents(JsonNode response) {
        List<JsonNode> patents = new ArrayList<>();
        if (response != null) {
            response.path("patents").forEach(patents::add);
        }
        return patents;
    }

    private static double averageCitations(List<JsonNode> patents) {
        if (patents.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (JsonNode patent : patents) {
            sum += patent.path("patent_num_times_cited_by_us_patents").asDouble(0);
        }
        return sum / patents.size();
    }

    static double filingVelocity(long patents2y, long patents5y) {
        double recentRate = patents2y / 2.0;
        double historicalRate = patents5y / 5.0;
        if (historicalRate == 0) {
            return recentRate == 0 ? 0.0 : 1.0;
        }
        return (recentRate - historicalRate) / historicalRate;
    }

    /** Share of all filings held by the three largest assignees. */
    static String assigneeConcentration(Map<String, Integer> assigneeCounts, long totalPatents) {
        if (totalPatents == 0 || assigneeCounts.isEmpty()) {
            return "unknown";
        }
        int topThree = assigneeCounts.values().stream()
                .sorted((a, b) -> Integer.compare(b, a))
                .limit(3)
                .mapToInt(Integer::intValue)
                .sum();
        double share = (double) topThree / totalPatents;
        if (share > 0.5) {
            return "concentrated";
        }
        return share > 0.25 ? "moderate" : "diverse";
    }

    /** Counts countries holding more than 5% of assignments. */
    static String geographicReach(Map<String, Integer> countryCounts) {
        int total = countryCounts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return "unknown";
        }
        long significant = countryCounts.values().stream()
                .filter(count -> (double) count / total > 0.05)
                .count();
        if (significant <= 1) {
            return "domestic";
        }
        return significant <= 3 ? "regional" : "global";
    }

    static String maturity(long totalPatents, double avgCitations2y) {
        if (totalPatents > 500 || avgCitations2y > 15) {
            return "mature";
        }
        if (totalPatents < 50 && avgCitations2y < 5) {
            return "emerging";
        }
        return "developing";
    }

    static String momentum(long patents2y, long patents5y) {
        double recentRate = patents2y / 2.0;
        double historicalRate = patents5y / 5.0;
        if (historicalRate == 0) {
            return recentRate == 0 ? "steady" : "accelerating";
        }
        double ratio = recentRate / historicalRate;
        if (ratio > 1.5) {
            return "accelerating";
        }
        return ratio < 0.5 ? "decelerating" : "steady";
    }
}
