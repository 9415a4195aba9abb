package com.lidm.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: lidm serve
 * <p>
 * Starts LIDM as a long-running HTTP server exposing the query and health API.
 * The web server is enabled by {@link com.lidm.LidmApplication#main} detecting
 * "serve" in args, and {@link CliRunner} skips picocli in that mode. The banner
 * is printed once the embedded server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 lidm serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the LIDM HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("LIDM server running on port " + port);
        System.out.println();
        System.out.println("  Query:   POST http://localhost:" + port + "/api/v1/query");
        System.out.println("  Health:  GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
