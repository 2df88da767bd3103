package com.opsassistant.core.execution;

import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.logging.MdcContext;
import com.opsassistant.core.metrics.PipelineMetrics;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import com.opsassistant.tools.FaultCode;
import com.opsassistant.tools.Tool;
import com.opsassistant.tools.ToolFaultException;
import com.opsassistant.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one plan step against its tool, retrying transient faults.
 * <p>
 * Never throws for a tool problem: every outcome, including unexpected
 * runtime exceptions and interruption, is reported as a {@link StepResult}.
 * A fault carrying partial data ends as PARTIAL once retrying is over.
 */
@Service
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ToolRegistry toolRegistry;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    @Autowired
    public StepExecutor(ToolRegistry toolRegistry, ExecutionProperties properties,
                        EventBus eventBus, PipelineMetrics metrics) {
        this(toolRegistry, properties.retryPolicy(), Sleeper.THREAD, eventBus, metrics);
    }

    StepExecutor(ToolRegistry toolRegistry, RetryPolicy retryPolicy, Sleeper sleeper) {
        this(toolRegistry, retryPolicy, sleeper, new EventBus(), null);
    }

    StepExecutor(ToolRegistry toolRegistry, RetryPolicy retryPolicy, Sleeper sleeper,
                 EventBus eventBus, PipelineMetrics metrics) {
        this.toolRegistry = toolRegistry;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public StepResult executeStep(PlanStep step) {
        long start = System.nanoTime();
        int n = step.stepNumber();

        Optional<Tool> found = toolRegistry.find(step.tool());
        if (found.isEmpty()) {
            log.error("Step {}: no tool registered for '{}'", n, step.tool().wireName());
            return StepResult.failed(n, FaultCode.INVALID_PARAMETERS,
                    "No tool registered for '" + step.tool().wireName() + "'", 0, elapsedMs(start));
        }
        Tool tool = found.get();
        var machine = new RetryStateMachine(retryPolicy);

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                machine.abort(FaultCode.CANCELLED);
                return StepResult.failed(n, FaultCode.CANCELLED, "Step cancelled before attempt "
                        + (machine.attempts() + 1), machine.attempts(), elapsedMs(start));
            }
            int attempt = machine.beginAttempt();
            log.info("Step {} attempt {}/{} using {}", n, attempt, retryPolicy.maxAttempts(), tool.kind().wireName());

            ToolFaultException fault;
            try {
                Object data = tool.invoke(step.parameters());
                machine.onSuccess();
                return StepResult.success(n, data, attempt, elapsedMs(start));
            } catch (ToolFaultException e) {
                fault = e;
            } catch (RuntimeException e) {
                log.error("Step {} attempt {} raised an unexpected {}: {}", n, attempt,
                        e.getClass().getSimpleName(), e.getMessage(), e);
                machine.abort(FaultCode.INTERNAL_ERROR);
                return StepResult.failed(n, FaultCode.INTERNAL_ERROR,
                        "Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage(), attempt, elapsedMs(start));
            }

            if (fault.code() == FaultCode.CANCELLED) {
                machine.abort(FaultCode.CANCELLED);
                return StepResult.failed(n, FaultCode.CANCELLED, fault.getMessage(), attempt, elapsedMs(start));
            }

            RetryState next = machine.onFault(fault.code());
            if (next == RetryState.EXHAUSTED) {
                return exhausted(step, fault, attempt, start);
            }

            Duration delay = machine.nextDelay();
            log.warn("Step {} attempt {} hit {} ({}); retry {}/{} in {} ms", n, attempt, fault.code(),
                    fault.getMessage(), attempt, retryPolicy.maxRetries(), delay.toMillis());
            eventBus.publish(PipelineEvent.forStep("step.retrying", MdcContext.currentQueryId(), n,
                    Map.of("attempt", attempt, "fault", fault.code().name(), "delayMs", delay.toMillis())));
            if (metrics != null) {
                metrics.recordRetry(tool.kind().wireName(), fault.code().name());
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                machine.abort(FaultCode.CANCELLED);
                log.warn("Step {} cancelled while backing off", n);
                return StepResult.failed(n, FaultCode.CANCELLED,
                        "Cancelled while waiting to retry after " + fault.code(), attempt, elapsedMs(start));
            }
            machine.resume();
        }
    }

    private StepResult exhausted(PlanStep step, ToolFaultException fault, int attempts, long start) {
        int n = step.stepNumber();
        if (fault.hasPartialData()) {
            log.warn("Step {} returned partial data after {} attempt(s): {}", n, attempts, fault.getMessage());
            return StepResult.partial(n, fault.partialData(), fault.code(), fault.getMessage(),
                    attempts, elapsedMs(start));
        }
        log.error("Step {} failed after {} attempt(s) with {}: {}", n, attempts, fault.code(), fault.getMessage());
        return StepResult.failed(n, fault.code(), fault.getMessage(), attempts, elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
