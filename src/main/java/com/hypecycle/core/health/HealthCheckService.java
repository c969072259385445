package com.hypecycle.core.health;

import com.hypecycle.core.cache.CacheStore;
import com.hypecycle.core.cache.InMemoryCacheStore;
import com.hypecycle.core.graph.ClassificationGraph;
import com.hypecycle.core.llm.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ClassificationGraph classificationGraph;
    private final CacheStore cacheStore;
    private final DataSource dataSource;
    private final LlmProperties llmProperties;

    public HealthCheckService(
            @Autowired(required = false) ClassificationGraph classificationGraph,
            @Autowired(required = false) CacheStore cacheStore,
            @Autowired(required = false) DataSource dataSource,
            LlmProperties llmProperties) {
        this.classificationGraph = classificationGraph;
        this.cacheStore = cacheStore;
        this.dataSource = dataSource;
        this.llmProperties = llmProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkDatabase());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkGraph() {
        if (classificationGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            if (cacheStore instanceof InMemoryCacheStore) {
                return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                        "No DataSource configured; using in-memory cache", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("product", conn.getMetaData().getDatabaseProductName()));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLlm() {
        if (!llmProperties.hasApiKey()) {
            return new HealthStatus("llm", HealthStatus.Status.DOWN,
                    "DEEPSEEK_API_KEY not configured", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.UP,
                "API key configured", Map.of("model", String.valueOf(llmProperties.getModel())));
    }
}
