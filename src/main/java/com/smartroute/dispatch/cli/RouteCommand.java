package com.smartroute.dispatch.cli;

import com.smartroute.core.engine.SmartRouter;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.PrivacyMode;
import com.smartroute.core.model.RoutingPreferences;
import com.smartroute.core.model.RoutingRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: smartroute route "&lt;content&gt;"
 * <p>
 * Prints the routing decision for the given content. With {@code --execute}
 * the request is also run through the fallback chain and the output shown.
 * Exits with 2 on an invalid option value and 1 when execution fails.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Route a request")
@Component
public class RouteCommand implements Callable<Integer> {

    static final int EXIT_EXECUTION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Parameters(index = "0", description = "Content to route")
    private String content;

    @Option(names = {"--task-type", "-t"}, description = "Task type, e.g. syntax_checking",
            defaultValue = RoutingRequest.DEFAULT_TASK_TYPE)
    private String taskType;

    @Option(names = "--cost-priority", description = "Cost priority between 0 and 1")
    private Double costPriority;

    @Option(names = "--privacy-mode", description = "Privacy mode: STRICT, BALANCED, PERMISSIVE")
    private String privacyMode;

    @Option(names = {"--execute", "-x"}, description = "Execute the request after routing it")
    private boolean execute;

    private final SmartRouter router;

    public RouteCommand(SmartRouter router) {
        this.router = router;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Map<String, Object> preferences = new LinkedHashMap<>();
        if (privacyMode != null) {
            try {
                preferences.put(RoutingPreferences.PRIVACY_MODE, PrivacyMode.parse(privacyMode).name());
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid privacy mode: " + privacyMode
                        + ". Valid modes: STRICT, BALANCED, PERMISSIVE");
                return EXIT_USAGE;
            }
        }
        if (costPriority != null) {
            preferences.put(RoutingPreferences.COST_PRIORITY, costPriority);
        }

        RoutingRequest request = router.newRequest(content, taskType, preferences);
        ConsoleOutput.info("Routing " + request.id() + " (" + request.taskType() + ")");

        if (!execute) {
            ConsoleOutput.decision(router.route(request));
            return 0;
        }

        ExecutionResult result = router.routeAndExecute(request);
        ConsoleOutput.result(result);
        return result.isSuccess() ? 0 : EXIT_EXECUTION_FAILED;
    }
}
