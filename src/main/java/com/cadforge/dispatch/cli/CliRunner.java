package com.cadforge.dispatch.cli;

import com.cadforge.CadforgeApplication;
import com.cadforge.core.error.CadforgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and reports its
 * exit code back to {@link CadforgeApplication}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    /** Exit code for a command that failed with a domain error. */
    static final int DOMAIN_ERROR_EXIT_CODE = 2;

    private final CadforgeCommand cadforgeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CadforgeCommand cadforgeCommand, IFactory factory) {
        this.cadforgeCommand = cadforgeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (CadforgeApplication.isServeMode(args)) {
            // the embedded server owns the process; picocli would return at once
            log.debug("Serve mode, skipping CLI dispatch");
            return;
        }
        exitCode = commandLine(cadforgeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line with domain errors reported as one line instead of a stack trace.
     */
    static CommandLine commandLine(CadforgeCommand command, IFactory factory) {
        var commandLine = new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            if (ex instanceof CadforgeException domain) {
                ConsoleOutput.error(domain.kind() + ": " + domain.getMessage());
                return DOMAIN_ERROR_EXIT_CODE;
            }
            throw ex;
        });
        return commandLine;
    }
}
