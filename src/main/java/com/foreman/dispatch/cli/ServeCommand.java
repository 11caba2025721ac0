package com.foreman.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: foreman serve
 * <p>
 * Starts the read-only dashboard API. The web server is enabled by
 * {@link com.foreman.ForemanApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 foreman serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the read-only dashboard API")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Foreman dashboard API running on port " + port);
        System.out.println();
        System.out.println("  Sessions:  http://localhost:" + port + "/api/v1/sessions");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
