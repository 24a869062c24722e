package com.teamflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: teamflow serve
 * <p>
 * Starts the HTTP server (tracker webhooks, epic and health endpoints). The web
 * server is enabled by {@link com.teamflow.TeamflowApplication#main} detecting
 * "serve" in the arguments; {@link CliRunner} then skips picocli, so {@link #run()}
 * only runs for {@code --help} style invocations.
 */
@Command(name = "serve", mixinStandardHelpOptions = true, description = "Start the Teamflow HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Teamflow server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Webhooks: http://localhost:" + port + "/api/v1/webhooks/tracker");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
