package com.cadforge.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: cadforge serve
 * <p>
 * Placeholder in the command tree for the HTTP mode. {@link com.cadforge.CadforgeApplication}
 * starts the servlet container when "serve" is among the arguments and
 * {@link CliRunner} never dispatches it, so the endpoint summary is printed from
 * the {@link WebServerInitializedEvent} once the real port is known.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Cadforge HTTP server (REST API on SERVER_PORT, default 8080)")
@Component
public class ServeCommand implements Runnable {

    private static final List<String> ENDPOINTS = List.of(
            "/api/v1/workspaces",
            "/api/v1/workspaces/{id}/entities",
            "/api/v1/workspaces/{id}/constraints",
            "/api/v1/workspaces/{id}/history",
            "/api/v1/locks",
            "/api/v1/health");

    @Value("${cadforge.workspace.root-id:main}")
    private String rootWorkspaceId;

    @Override
    public void run() {
        // unreachable from main, which starts the servlet container instead
        ConsoleOutput.warn("HTTP mode is selected at launch: run 'cadforge serve'");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Cadforge server running on port " + port + ", root workspace '" + rootWorkspaceId + "'");
        System.out.println();
        ENDPOINTS.forEach(path -> System.out.println("  http://localhost:" + port + path));
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
