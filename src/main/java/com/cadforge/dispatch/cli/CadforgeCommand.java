package com.cadforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the picocli tree. Agents normally talk to {@code rpc}; operators use
 * {@code health} and {@code serve}. Without a subcommand it prints usage.
 */
@Command(
        name = "cadforge",
        mixinStandardHelpOptions = true,
        version = "Cadforge 0.1.0",
        description = "Multi-agent parametric CAD collaboration core",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
                "0:Success",
                "1:A health check found a component down",
                "2:A command failed with a domain error"
        },
        subcommands = {
                RpcCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CadforgeCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
