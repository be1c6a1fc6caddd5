package com.smartroute.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: smartroute serve
 * <p>
 * Starts SmartRoute as a long-running HTTP server. The web server is enabled by
 * {@link com.smartroute.SmartRouteApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 smartroute serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the SmartRoute HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via picocli (e.g. tests); normal serve mode bypasses it.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("SmartRoute server running on port " + port);
        System.out.println();
        System.out.println("  Route:   POST http://localhost:" + port + "/api/v1/route");
        System.out.println("  Report:  GET  http://localhost:" + port + "/api/v1/report");
        System.out.println("  Health:  GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
