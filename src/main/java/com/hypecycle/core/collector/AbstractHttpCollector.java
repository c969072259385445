package com.hypecycle.core.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypecycle.core.model.CollectorOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shared HTTP plumbing for collectors: JSON GET requests with a per-request timeout,
 * and translation of transport and status failures into short error-list entries.
 */
public abstract class AbstractHttpCollector implements Collector {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpCollector.class);

    private final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final CollectorProperties properties;
    protected final Clock clock;

    protected AbstractHttpCollector(HttpClient httpClient, ObjectMapper objectMapper,
                                    CollectorProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a GET and decodes the JSON body.
     *
     * @param errors receives a short description of any failure
     * @return the decoded body, or empty if the request failed
     */
    protected Optional<JsonNode> getJson(String baseUrl, Map<String, String> params,
                                         Map<String, String> headers, List<String> errors) {
        String url = params.isEmpty() ? baseUrl : baseUrl + "?" + encodeParams(params);
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Accept", "application/json")
                .header("User-Agent", properties.getUserAgent())
                .GET();
        headers.forEach(builder::header);

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 400) {
                errors.add(describeStatus(status, response));
                log.debug("{} GET {} failed with HTTP {}", source().key(), baseUrl, status);
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            errors.add("Invalid JSON response");
            return Optional.empty();
        } catch (HttpTimeoutException e) {
            errors.add("Request timeout");
            return Optional.empty();
        } catch (IOException e) {
            errors.add("Network error: " + e.getClass().getSimpleName());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Interrupted");
            return Optional.empty();
        }
    }

    private static String describeStatus(int status, HttpResponse<String> response) {
        return switch (status) {
            case 429 -> response.headers().firstValue("Retry-After")
                    .map(retryAfter -> "Rate limited (retry after " + retryAfter + "s)")
                    .orElse("Rate limited");
            case 401, 403 -> "Authentication failed - invalid API key";
            case 400 -> "Invalid query parameters";
            default -> "HTTP " + status;
        };
    }

    /** Outcome for a run in which no upstream request returned data. */
    protected CollectorOutcome allRequestsFailed(List<String> errors) {
        String detail = errors.isEmpty() ? "" : ": " + String.join("; ", errors.stream().distinct().toList());
        return CollectorOutcome.failed(source(), "All API requests failed" + detail);
    }

    protected static String encodeParams(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** The keyword followed by the expansion terms. */
    protected static List<String> searchTerms(String keyword, List<String> expansionTerms) {
        List<String> terms = new ArrayList<>();
        terms.add(keyword);
        if (expansionTerms != null) {
            terms.addAll(expansionTerms);
        }
        return terms;
    }

    /** Quoted phrases joined by {@code separator}, e.g. {@code "a" OR "b"}. */
    protected static String phraseQuery(String keyword, List<String> expansionTerms, String separator) {
        return searchTerms(keyword, expansionTerms).stream()
                .map(term -> "\"" + term + "\"")
                .collect(Collectors.joining(separator));
    }

    protected static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    protected static Map<String, Object> orderedMap() {
        return new LinkedHashMap<>();
    }
}
