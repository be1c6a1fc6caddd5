package com.smartroute.dispatch.cli;

import com.smartroute.core.engine.SmartRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: smartroute report
 * <p>
 * Statistics live in memory, so a one-shot CLI process only reports on
 * requests routed within it. Use the HTTP report endpoint of a running
 * server for cumulative numbers.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Show cost and privacy statistics")
@Component
public class ReportCommand implements Runnable {

    private final SmartRouter router;

    public ReportCommand(SmartRouter router) {
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.report(router.report());
    }
}
