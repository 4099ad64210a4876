package com.taskweaver.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskweaver serve
 * <p>
 * Runs TaskWeaver as an HTTP server exposing the plan endpoints. The web server is
 * switched on by {@link com.taskweaver.TaskWeaverApplication#main} when "serve" is in
 * the arguments, and {@link CliRunner} then skips picocli so the server keeps the JVM alive.
 * <p>
 * Port: {@code SERVER_PORT=9090 taskweaver serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the TaskWeaver HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not reached in serve mode: CliRunner skips picocli there.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("TaskWeaver server listening on port " + port);
        System.out.println();
        System.out.println("  Schedule:  POST http://localhost:" + port + "/api/v1/plans/schedule");
        System.out.println("  Validate:  POST http://localhost:" + port + "/api/v1/plans/validate");
        System.out.println("  Health:    GET  http://localhost:" + port + "/actuator/health");
        System.out.println();
    }

    public int getPort() {
        return port;
    }
}
