package com.smartroute.dispatch.cli;

import com.smartroute.core.model.AccountingSnapshot;
import com.smartroute.core.model.AttemptRecord;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.Venue;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the SmartRoute CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SMARTROUTE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SMARTROUTE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void decision(RoutingDecision d) {
        String strategyColor = d.strategy().isLocal() ? "fg(green)" : "fg(magenta)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Decision|@ " + d.requestId() + ": @|" + strategyColor + " " + d.strategy() + "|@"
                + " -> " + d.primaryVenue()));
        if (!d.fallbackChain().isEmpty()) {
            System.out.println("  Fallbacks:   " + d.fallbackChain().stream()
                    .map(Venue::name).collect(Collectors.joining(" -> ")));
        }
        System.out.println("  Sensitivity: " + d.sensitivity()
                + " | Complexity: " + d.complexity() + " | Tier: " + d.tier());
        System.out.println(String.format("  Confidence:  %.2f | Privacy: %.2f", d.confidence(), d.privacyScore()));
        System.out.println(String.format("  Cost:        $%.6f (baseline $%.6f, saves $%.6f)",
                d.costImpact(), d.baselineCost(), d.estimatedSavings()));
        System.out.println("  Reasoning:   " + d.reasoning());
    }

    public static void result(ExecutionResult r) {
        System.out.println("──────────────────────────────────");
        for (AttemptRecord attempt : r.attempts()) {
            String color = attempt.succeeded() ? "fg(green)" : "fg(red)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|" + color + " " + attempt.outcome() + "|@ " + attempt.venue()
                    + " (" + attempt.latencyMs() + "ms)"
                    + (attempt.detail() == null || attempt.detail().isBlank() ? "" : " " + attempt.detail())));
        }
        for (String warning : r.warnings()) {
            warning(warning);
        }
        if (r.isSuccess()) {
            success(String.format("Executed on %s in %dms (quality %.2f, cost $%.6f)",
                    r.venueUsed(), r.latencyMs(), r.qualityScore(), r.actualCost()));
            System.out.println();
            System.out.println(r.output());
        } else {
            error("Execution failed: " + r.error());
        }
    }

    public static void report(AccountingSnapshot s) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Routing Report|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Requests: " + s.totalRequests() + " total, @|fg(green) " + s.successfulRequests()
                + " succeeded|@, @|fg(red) " + s.failedRequests() + " failed|@"
                + " (" + s.failedAttempts() + " failed attempts)"));
        if (!s.perVenueCounts().isEmpty()) {
            System.out.println("  Venues:   " + s.perVenueCounts().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        System.out.println(String.format("  Cost:     $%.6f actual, $%.6f baseline, $%.6f saved (%.1f%%)",
                s.totalActualCost(), s.totalBaselineCost(), s.totalCostSaved(), s.savingsRate() * 100));
        System.out.println("  Local:    " + s.tokensKeptLocal() + " tokens kept local");
        String violations = s.privacyViolations() == 0
                ? "@|fg(green) 0 violations|@"
                : "@|fg(red) " + s.privacyViolations() + " violations|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  Privacy:  %s (%.1f%% compliant)", violations, s.privacyComplianceRate() * 100)));
        System.out.println(String.format("  Averages: %.0fms latency, %.2f quality",
                s.averageLatencyMs(), s.averageQuality()));
    }
}
