package com.hypecycle.dispatch.cli;

import com.hypecycle.core.health.HealthCheckService;
import com.hypecycle.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: hypecycle health
 * <p>
 * Exit code 0 when every component is up, 1 when classification can still run
 * with reduced capability (only DEGRADED components), 2 when any component is DOWN
 * or no health service is wired.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check whether the classification pipeline can run")
@Component
public class HealthCommand implements Callable<Integer> {

    static final int HEALTHY = 0;
    static final int REDUCED = 1;
    static final int UNAVAILABLE = 2;

    private final HealthCheckService healthCheckService;

    @Option(names = {"--component", "-c"}, description = "Only report this component (graph, database, llm)")
    String component;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return UNAVAILABLE;
        }

        List<HealthStatus> checks = healthCheckService.checkAll().stream()
                .filter(check -> component == null || check.component().equalsIgnoreCase(component))
                .toList();
        if (checks.isEmpty()) {
            ConsoleOutput.error("Unknown component: " + component);
            return UNAVAILABLE;
        }

        var counts = new EnumMap<HealthStatus.Status, Integer>(HealthStatus.Status.class);
        for (HealthStatus check : checks) {
            counts.merge(check.status(), 1, Integer::sum);
            String line = describe(check);
            switch (check.status()) {
                case UP -> ConsoleOutput.success(line);
                case DEGRADED -> ConsoleOutput.warn(line);
                case DOWN -> ConsoleOutput.error(line);
            }
        }

        System.out.println("──────────────────────────────────");
        int down = counts.getOrDefault(HealthStatus.Status.DOWN, 0);
        int degraded = counts.getOrDefault(HealthStatus.Status.DEGRADED, 0);
        if (down > 0) {
            ConsoleOutput.error("Classification unavailable: " + namesWith(checks, HealthStatus.Status.DOWN) + " down");
            return UNAVAILABLE;
        }
        if (degraded > 0) {
            ConsoleOutput.warn("Classification runs with reduced capability: "
                    + namesWith(checks, HealthStatus.Status.DEGRADED) + " degraded");
            return REDUCED;
        }
        ConsoleOutput.success("Classification ready (" + checks.size() + " components up)");
        return HEALTHY;
    }

    static String describe(HealthStatus check) {
        String line = check.component() + ": " + check.detail();
        Map<String, String> metadata = check.metadata();
        if (metadata == null || metadata.isEmpty()) {
            return line;
        }
        return line + metadata.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining(", ", " [", "]"));
    }

    private static String namesWith(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream()
                .filter(check -> check.status() == status)
                .map(HealthStatus::component)
                .collect(Collectors.joining(", "));
    }
}
