package com.opsassistant.dispatch.cli;

import com.opsassistant.core.engine.PipelineEngine;
import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.model.ExecutionStrategy;
import com.opsassistant.core.model.PipelineResult;
import com.opsassistant.core.planner.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: ops-assistant query "&lt;request&gt;"
 * <p>
 * Runs the request through the pipeline and prints the plan, the step
 * outcomes and the verified output. With {@code --follow}, step progress is
 * printed from the event bus while the pipeline runs. Exits with 1 when no
 * plan could be made.
 */
@Command(name = "query", mixinStandardHelpOptions = true, description = "Plan, execute and verify a request")
@Component
public class QueryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--strategy", "-s"},
            description = "Execution strategy: SEQUENTIAL or PARALLEL (default: configured)")
    private String strategy;

    @Option(names = {"--log"}, description = "Print the execution log")
    private boolean showLog;

    @Option(names = {"--follow", "-f"}, description = "Print step progress, retries included, as it happens")
    private boolean follow;

    private final PipelineEngine pipelineEngine;
    private final EventBus eventBus;

    public QueryCommand(PipelineEngine pipelineEngine, EventBus eventBus) {
        this.pipelineEngine = pipelineEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExecutionStrategy executionStrategy = null;
        if (strategy != null) {
            try {
                executionStrategy = ExecutionStrategy.valueOf(strategy.toUpperCase());
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid strategy: " + strategy + ". Valid strategies: SEQUENTIAL, PARALLEL");
                return 2;
            }
        }

        ConsoleOutput.info("Planning request...");
        PipelineResult result;
        EventBus.Subscription progress = follow ? eventBus.subscribeAll(ConsoleOutput::progress) : null;
        try {
            result = pipelineEngine.processQuery(request, executionStrategy);
        } catch (PlanningException e) {
            ConsoleOutput.error("Planning failed (" + e.reason() + "): " + e.getMessage());
            for (String detail : e.details()) {
                ConsoleOutput.error("  " + detail);
            }
            return 1;
        } finally {
            if (progress != null) {
                progress.unsubscribe();
            }
        }

        var plan = result.plan();
        System.out.println();
        System.out.println("QUERY " + result.queryId() + " (" + ConsoleOutput.formatDuration(result.totalTimeMs()) + ")");
        System.out.println("Task: " + plan.taskDescription());
        System.out.println("Intent: " + plan.intent().wireName()
                + (plan.comparisonMode() ? " (comparing " + String.join(", ", plan.entities()) + ")" : ""));
        System.out.println();
        System.out.println("PLAN:");
        plan.steps().forEach(ConsoleOutput::planStep);

        System.out.println();
        System.out.println("EXECUTION:");
        result.execution().results().forEach(ConsoleOutput::stepResult);
        if (showLog) {
            System.out.println();
            result.execution().executionLog().forEach(line -> System.out.println("  " + line));
        }

        var verification = result.verification();
        System.out.println();
        System.out.println(verification.formattedOutput());
        System.out.println();
        ConsoleOutput.info(verification.summary());

        if (!verification.issues().isEmpty()) {
            System.out.println();
            ConsoleOutput.warn("Issues (" + verification.issues().size() + "):");
            verification.issues().forEach(issue -> ConsoleOutput.warn("  " + issue));
        }
        if (!verification.recommendations().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Recommendations:");
            verification.recommendations().forEach(r -> System.out.println("  - " + r));
        }

        System.out.println();
        String confidence = String.format("confidence %.2f", verification.confidenceScore());
        if (verification.isComplete() && verification.isCorrect()) {
            ConsoleOutput.success("Complete and verified (" + confidence + ").");
        } else if (verification.isComplete()) {
            ConsoleOutput.warn("Complete, but verification raised concerns (" + confidence + ").");
        } else {
            ConsoleOutput.error("Incomplete: " + result.execution().stepsFailed() + " step(s) failed ("
                    + confidence + ").");
        }
        return 0;
    }
}
