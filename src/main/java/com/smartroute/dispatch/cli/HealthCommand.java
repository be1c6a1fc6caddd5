package com.smartroute.dispatch.cli;

import com.smartroute.core.health.HealthCheckService;
import com.smartroute.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: smartroute health
 * <p>
 * Shows which venues have a backend registered and whether accounting is live.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check venue availability")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warning(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        switch (HealthStatus.overall(checks)) {
            case DOWN -> ConsoleOutput.error("Overall: local venue unavailable");
            case DEGRADED -> ConsoleOutput.info("Overall: operational, some remote venues not configured");
            case UP -> ConsoleOutput.success("Overall: all venues operational");
        }
    }
}
