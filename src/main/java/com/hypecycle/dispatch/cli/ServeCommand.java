package com.hypecycle.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hypecycle serve
 * <p>
 * Starts HypeCycle as a long-running HTTP server exposing the REST API. The web server is
 * enabled by {@link com.hypecycle.HypeCycleApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The startup banner is printed once the
 * embedded server is ready.
 * <p>
 * Configure port via: {@code PORT=9090 hypecycle serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HypeCycle HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8000}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("HypeCycle server running on port " + port);
        System.out.println();
        System.out.println("  Analyze:  POST http://localhost:" + port + "/api/analyze");
        System.out.println("  Health:   GET  http://localhost:" + port + "/api/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
