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
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Academic publication and citation signals from the Semantic Scholar bulk search API.
 * <p>
 * Two windows are queried: the last two full years and the three years before that.
 * Expansion terms are OR-ed into the phrase query with Semantic Scholar's {@code |} operator.
 */
@Component
public class PapersCollector extends AbstractHttpCollector {

    static final String FIELDS = "paperId,title,year,citationCount,influentialCitationCount,authors,venue";

    public PapersCollector(HttpClient collectorHttpClient, ObjectMapper objectMapper,
                           CollectorProperties properties, Clock clock) {
        super(collectorHttpClient, objectMapper, properties, clock);
    }

    @Override
    public SourceName source() {
        return SourceName.PAPERS;
    }

    @Override
    public CollectorOutcome fetch(String keyword, List<String> expansionTerms) {
        Instant now = clock.instant();
        int currentYear = LocalDate.ofInstant(now, ZoneOffset.UTC).getYear();
        String query = phraseQuery(keyword, expansionTerms, " | ");

        List<String> errors = new ArrayList<>();
        JsonNode recent = fetchPeriod(query, currentYear - 2, currentYear - 1, errors);
        JsonNode older = fetchPeriod(query, currentYear - 5, currentYear - 3, errors);
        if (recent == null && older == null) {
            return allRequestsFailed(errors);
        }

        long publications2y = recent != null ? recent.path("total").asLong(0) : 0;
        long publications5y = older != null ? older.path("total").asLong(0) : 0;
        long total = publications2y + publications5y;

        List<JsonNode> recentPapers = papers(recent);
        List<JsonNode> olderPapers = papers(older);
        double avgCitations2y = average(recentPapers, "citationCount");
        double avgCitations5y = average(olderPapers, "citationCount");

        Set<String> authors = new HashSet<>();
        Set<String> venues = new HashSet<>();
        for (JsonNode paper : olderPapers) {
            for (JsonNode author : paper.path("authors")) {
                String authorId = author.path("authorId").asText("");
                if (!authorId.isEmpty()) {
                    authors.add(authorId);
                }
            }
            String venue = paper.path("venue").asText("");
            if (!venue.isEmpty()) {
                venues.add(venue);
            }
        }

        Map<String, Object> extra = orderedMap();
        extra.put("publications_2y", publications2y);
        extra.put("publications_5y", publications5y);
        extra.put("publications_total", total);
        extra.put("avg_citations_2y", round(avgCitations2y, 2));
        extra.put("avg_citations_5y", round(avgCitations5y, 2));
        extra.put("avg_influential_citations_2y", round(average(recentPapers, "influentialCitationCount"), 2));
        extra.put("avg_influential_citations_5y", round(average(olderPapers, "influentialCitationCount"), 2));
        extra.put("citation_velocity", round(citationVelocity(avgCitations2y, avgCitations5y), 3));
        extra.put("author_diversity", authors.size());
        extra.put("venue_diversity", venues.size());
        extra.put("research_maturity", maturity(total, avgCitations2y));
        extra.put("research_momentum", momentum(publications2y, publications5y));
        extra.put("research_trend", trend(publications2y, publications5y));
        extra.put("research_breadth", breadth(authors.size(), venues.size(), total));
        extra.put("top_papers", topPapers(recentPapers));

        return CollectorOutcome.ok(new SourceMetrics(SourceName.PAPERS, keyword, now,
                publications2y, total, extra, errors));
    }

    private JsonNode fetchPeriod(String query, int yearStart, int yearEnd, List<String> errors) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("year", yearStart + "-" + yearEnd);
        params.put("fields", FIELDS);
        params.put("limit", "100");
        Map<String, String> headers = properties.hasSemanticScholarApiKey()
                ? Map.of("x-api-key", properties.getSemanticScholarApiKey())
                : Map.of();
        return getJson(properties.getPapersUrl(), params, headers, errors).orElse(null);
    }

    private static List<JsonNode> papers(JsonNode response) {
        List<JsonNode> papers = new ArrayList<>();
        if (response != null) {
            response.path("data").forEach(papers::add);
        }
        return papers;
    }

    private static double average(List<JsonNode> papers, String field) {
        if (papers.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (JsonNode paper : papers) {
            sum += paper.path(field).asDouble(0);
        }
        return sum / papers.size();
    }

    private static List<Map<String, Object>> topPapers(List<JsonNode> papers) {
        List<Map<String, Object>> top = new ArrayList<>();
        papers.stream()
                .sorted(Comparator.comparingLong((JsonNode p) -> p.path("citationCount").asLong(0)).reversed())
                .limit(5)
                .forEach(paper -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("title", paper.path("title").asText(""));
                    entry.put("year", paper.path("year").asInt(0));
                    entry.put("citations", paper.path("citationCount").asLong(0));
                    entry.put("venue", paper.path("venue").asText(""));
                    top.add(entry);
                });
        return top;
    }

    /** Relative growth of average citations, recent window against the older one. */
    static double citationVelocity(double avgCitations2y, double avgCitations5y) {
        if (avgCitations5y == 0) {
            return avgCitations2y == 0 ? 0.0 : 1.0;
        }
        return (avgCitations2y - avgCitations5y) / avgCitations5y;
    }

    static String maturity(long totalPublications, double avgCitations2y) {
        if (totalPublications > 50 || avgCitations2y > 20) {
            return "mature";
        }
        if (totalPublications < 10 && avgCitations2y < 5) {
            return "emerging";
        }
        return "developing";
    }

    static String momentum(long publications2y, long publications5y) {
        double recentRate = publications2y / 2.0;
        double historicalRate = publications5y / 3.0;
        if (historicalRate == 0) {
            return recentRate == 0 ? "steady" : "accelerating";
        }
        double ratio = recentRate / historicalRate;
        if (ratio > 1.5) {
            return "accelerating";
        }
        return ratio < 0.5 ? "decelerating" : "steady";
    }

    static String trend(long publications2y, long publications5y) {
        double recentRate = publications2y / 2.0;
        double historicalRate = publications5y / 3.0;
        if (historicalRate == 0) {
            return recentRate == 0 ? "stable" : "increasing";
        }
        double diff = (recentRate - historicalRate) / historicalRate;
        if (diff > 0.3) {
            return "increasing";
        }
        return diff < -0.3 ? "decreasing" : "stable";
    }

    static String breadth(int authorDiversity, int venueDiversity, long totalPublications) {
        if (totalPublications == 0) {
            return "narrow";
        }
        double authorRatio = (double) authorDiversity / totalPublications;
        double venueRatio = (double) venueDiversity / totalPublications;
        if (authorRatio > 2.0 && venueRatio > 0.3) {
            return "broad";
        }
        if (authorRatio < 1.5 || venueRatio < 0.1) {
            return "narrow";
        }
        return "moderate";
    }
}
