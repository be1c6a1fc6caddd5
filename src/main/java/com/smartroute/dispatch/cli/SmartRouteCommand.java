package com.smartroute.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for SmartRoute.
 * Routes to subcommands: route, report, health, serve.
 */
@Command(
        name = "smartroute",
        mixinStandardHelpOptions = true,
        version = "SmartRoute 0.1.0",
        description = "Privacy-aware request router with cost accounting",
        subcommands = {
                RouteCommand.class,
                ReportCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SmartRouteCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
