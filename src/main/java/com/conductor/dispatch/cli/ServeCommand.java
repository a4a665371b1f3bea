package com.conductor.dispatch.cli;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.config.ConductorProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: conductor serve
 * <p>
 * Starts the HTTP server exposing the REST API. The web server is enabled by
 * {@link com.conductor.ConductorApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * {@code serve --help} prints usage instead of starting the server.
 * Once the server is up, every project with an up command is started when
 * {@code conductor.supervisor.start-on-boot} is set.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the conductor HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final OrchestratorContext context;
    private final ConductorProperties properties;

    public ServeCommand(OrchestratorContext context, ConductorProperties properties) {
        this.context = context;
        this.properties = properties;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for picocli subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
        if (properties.getSupervisor().isStartOnBoot()) {
            var started = context.supervisor().startAll(context.projects().all());
            started.forEach(p -> ConsoleOutput.success("Started " + p.project() + " (PID " + p.pid() + ")"));
        }
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Conductor server running on port " + port);
        ConsoleOutput.info("Projects: " + String.join(", ", context.projects().names()));
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
