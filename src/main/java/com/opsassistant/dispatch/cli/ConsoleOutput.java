package com.opsassistant.dispatch.cli;

import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OPS-ASSISTANT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OPS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tool(String name, String purpose) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold,fg(blue) " + name + "|@  " + purpose));
    }

    public static void planStep(PlanStep step) {
        System.out.printf("  %d. [%-9s] %s%s%n", step.stepNumber(), step.tool().wireName(), step.action(),
                step.critical() ? "" : " (optional)");
    }

    public static void stepResult(StepResult result) {
        String status = switch (result.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS|@";
            case PARTIAL -> "@|fg(yellow) PARTIAL|@";
            case FAILED -> "@|fg(red) FAILED |@";
        };
        String detail = result.error() != null ? " " + result.error() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " step " + result.stepNumber() + " (" + result.attempts() + " attempt"
                        + (result.attempts() != 1 ? "s" : "") + ", " + formatDuration(result.executionTimeMs()) + ")"
                        + detail));
    }

    /**
     * Prints one line of live progress for a pipeline event. Events without a
     * progress line (such as {@code query.received}) are ignored.
     */
    public static void progress(PipelineEvent event) {
        var p = event.payload();
        Integer step = event.stepNumber();
        switch (event.eventType()) {
            case "plan.created" -> info("Plan ready: " + p.get("steps") + " step(s), intent " + p.get("intent"));
            case "step.started" -> info("  step " + step + " started (" + p.get("tool") + ")");
            case "step.retrying" -> warn("  step " + step + " hit " + p.get("fault") + " on attempt "
                    + p.get("attempt") + ", retrying in " + p.get("delayMs") + "ms");
            case "step.completed" -> success("  step " + step + " " + p.get("status") + " after "
                    + p.get("attempts") + " attempt(s)");
            case "step.failed" -> error("  step " + step + " failed (" + p.get("errorCode") + ") after "
                    + p.get("attempts") + " attempt(s)");
            case "verification.completed", "verification.degraded" -> info("Verifying results...");
            default -> { }
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
