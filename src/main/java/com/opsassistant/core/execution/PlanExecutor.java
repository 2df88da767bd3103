package com.opsassistant.core.execution;

import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.logging.MdcContext;
import com.opsassistant.core.metrics.PipelineMetrics;
import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.ExecutionStrategy;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import com.opsassistant.core.validation.PlanValidator;
import com.opsassistant.tools.FaultCode;
import com.opsassistant.tools.ToolFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs every step of a plan and aggregates the outcomes.
 * <p>
 * Steps are dispatched in waves of steps whose dependencies have finished;
 * a wave runs concurrently on a worker pool created for this invocation.
 * Each worker writes its result into the slot of its step, so the result
 * list is in planned order whatever the completion order. Failures never
 * stop the plan: a step whose dependency failed is recorded as
 * {@code DEPENDENCY_FAILED}, and on deadline expiry or interruption every
 * unfinished step is recorded as {@code CANCELLED}.
 */
@Service
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PlanValidator validator;
    private final StepExecutor stepExecutor;
    private final StepScheduler scheduler;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final int maxParallel;
    private final Duration timeout;
    private final ExecutionStrategy defaultStrategy;

    @Autowired
    public PlanExecutor(PlanValidator validator, StepExecutor stepExecutor, StepScheduler scheduler,
                        EventBus eventBus, PipelineMetrics metrics, ExecutionProperties properties) {
        this(validator, stepExecutor, scheduler, eventBus, metrics,
                properties.getMaxParallel(), properties.getTimeout(), properties.getStrategy());
    }

    PlanExecutor(PlanValidator validator, StepExecutor stepExecutor, StepScheduler scheduler,
                 EventBus eventBus, PipelineMetrics metrics,
                 int maxParallel, Duration timeout, ExecutionStrategy defaultStrategy) {
        this.validator = validator;
        this.stepExecutor = stepExecutor;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallel = Math.max(1, maxParallel);
        this.timeout = timeout;
        this.defaultStrategy = defaultStrategy;
    }

    public ExecutionResult execute(Plan plan) {
        return execute(plan, defaultStrategy);
    }

    /**
     * @throws com.opsassistant.core.validation.PlanValidationException when the plan breaks a structural rule
     */
    public ExecutionResult execute(Plan plan, ExecutionStrategy strategy) {
        validator.precheck(plan);

        var run = new Run(plan, MdcContext.currentQueryId(), MdcContext.snapshot());
        Map<Integer, Set<Integer>> dependencies = StepReferences.dependencyGraph(plan);
        Set<Integer> finished = new HashSet<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        String cancelReason = null;

        log.info("Executing plan: {} steps, strategy={}, maxParallel={}, timeout={}s",
                plan.steps().size(), strategy, maxParallel, timeout.toSeconds());

        ExecutorService pool = Executors.newFixedThreadPool(maxParallel, workerThreads(run.queryId));
        try {
            while (finished.size() < plan.steps().size() && cancelReason == null) {
                List<Integer> wave = scheduler.computeNextWave(plan.steps(), finished, dependencies, strategy);
                if (wave.isEmpty()) {
                    // unreachable for validated plans: references only point backwards
                    throw new IllegalStateException("No schedulable step among unfinished steps of the plan");
                }
                if (metrics != null) {
                    metrics.recordWave(wave.size(), strategy.name().toLowerCase());
                }

                Map<Integer, Future<?>> inFlight = new LinkedHashMap<>();
                for (int n : wave) {
                    PlanStep step = plan.step(n);
                    Integer failedDependency = firstFailed(dependencies.get(n), run);
                    if (failedDependency != null) {
                        run.record(StepResult.failed(n, FaultCode.DEPENDENCY_FAILED,
                                "Step " + failedDependency + " did not produce data", 0, 0));
                        finished.add(n);
                        continue;
                    }
                    Map<Integer, Object> inputs = dependencyData(dependencies.get(n), run);
                    inFlight.put(n, pool.submit(() -> runStep(run, step, inputs)));
                }

                cancelReason = await(inFlight, deadline);
                if (cancelReason == null) {
                    finished.addAll(inFlight.keySet());
                } else {
                    inFlight.values().forEach(f -> f.cancel(true));
                }
            }
        } finally {
            pool.shutdownNow();
        }

        if (cancelReason != null) {
            log.warn("Plan execution cancelled: {}", cancelReason);
        }
        FaultCode unresolvedCode = cancelReason != null ? FaultCode.CANCELLED : FaultCode.INTERNAL_ERROR;
        String unresolvedReason = cancelReason != null ? cancelReason : "Worker ended without producing a result";
        for (PlanStep step : plan.steps()) {
            run.record(StepResult.failed(step.stepNumber(), unresolvedCode, unresolvedReason, 0, 0));
        }

        ExecutionResult result = ExecutionResult.of(run.results(), run.executionLog);
        log.info("Plan execution complete: {} completed, {} failed", result.stepsCompleted(), result.stepsFailed());
        return result;
    }

    /**
     * Waits for the wave to finish; returns a cancellation reason, or null when every step finished.
     */
    private String await(Map<Integer, Future<?>> inFlight, long deadline) {
        for (var entry : inFlight.entrySet()) {
            try {
                entry.getValue().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return "Execution deadline of " + timeout.toSeconds() + "s exceeded";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "Execution interrupted";
            } catch (ExecutionException | CancellationException e) {
                // runStep records its own outcome; reaching here means it could not
                log.error("Worker for step {} ended abnormally: {}", entry.getKey(), e.getMessage());
            }
        }
        return null;
    }

    private void runStep(Run run, PlanStep step, Map<Integer, Object> inputs) {
        int n = step.stepNumber();
        MdcContext.restore(run.mdc);
        MdcContext.setStep(run.queryId, n, step.tool().wireName());
        try {
            eventBus.publish(PipelineEvent.forStep("step.started", run.queryId, n,
                    Map.of("tool", step.tool().wireName(), "action", step.action())));

            StepResult result;
            try {
                PlanStep resolved = inputs.isEmpty()
                        ? step
                        : step.withParameters(StepReferences.resolve(step.parameters(), inputs));
                result = stepExecutor.executeStep(resolved);
            } catch (ToolFaultException e) {
                log.error("Step {}: {}", n, e.getMessage());
                result = StepResult.failed(n, e.code(), e.getMessage(), 0, 0);
            } catch (RuntimeException e) {
                log.error("Step {} could not be executed: {}", n, e.getMessage(), e);
                result = StepResult.failed(n, FaultCode.INTERNAL_ERROR, e.getMessage(), 0, 0);
            }

            if (run.record(result)) {
                if (metrics != null) {
                    metrics.recordStepExecution(step.tool().wireName(), result.status().name(), result.executionTimeMs());
                }
                eventBus.publish(PipelineEvent.forStep(result.isFailed() ? "step.failed" : "step.completed",
                        run.queryId, n, eventPayload(result)));
            }
        } finally {
            MdcContext.restore(run.mdc);
        }
    }

    private static Integer firstFailed(Collection<Integer> dependencies, Run run) {
        for (int dep : dependencies) {
            StepResult r = run.slot(dep);
            if (r == null || r.isFailed()) return dep;
        }
        return null;
    }

    private static Map<Integer, Object> dependencyData(Collection<Integer> dependencies, Run run) {
        var data = new HashMap<Integer, Object>();
        for (int dep : dependencies) {
            data.put(dep, run.slot(dep).data());
        }
        return data;
    }

    private static Map<String, Object> eventPayload(StepResult result) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("attempts", result.attempts());
        payload.put("executionTimeMs", result.executionTimeMs());
        if (result.errorCode() != null) {
            payload.put("errorCode", result.errorCode().name());
        }
        return payload;
    }

    private static ThreadFactory workerThreads(String queryId) {
        var counter = new AtomicInteger();
        String prefix = "step-worker-" + (queryId != null ? queryId + "-" : "");
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * One-line description of a step's data for the execution log.
     */
    static String summarize(Object data) {
        if (data == null) return "No data";
        if (data instanceof Collection<?> items) return "Retrieved " + items.size() + " items";
        if (data instanceof Map<?, ?> map) {
            if (map.containsKey("city")) return "Weather data for " + map.get("city");
            if (map.containsKey("name")) return "Data for " + map.get("name");
            if (map.containsKey("title")) return "Article: " + map.get("title");
            return "Object with " + map.size() + " fields";
        }
        String text = data.toString();
        return "Data: " + (text.length() > 50 ? text.substring(0, 50) : text);
    }

    /**
     * State of one invocation. Slots are written at most once; the first
     * writer wins, so a worker finishing after cancellation cannot overwrite
     * the CANCELLED result and vice versa.
     */
    private static final class Run {
        private final Plan plan;
        private final String queryId;
        private final Map<String, String> mdc;
        private final AtomicReferenceArray<StepResult> slots;
        private final List<String> executionLog = Collections.synchronizedList(new ArrayList<>());

        Run(Plan plan, String queryId, Map<String, String> mdc) {
            this.plan = plan;
            this.queryId = queryId;
            this.mdc = mdc;
            this.slots = new AtomicReferenceArray<>(plan.steps().size());
        }

        StepResult slot(int stepNumber) {
            return slots.get(stepNumber - 1);
        }

        boolean record(StepResult result) {
            if (!slots.compareAndSet(result.stepNumber() - 1, null, result)) {
                return false;
            }
            String detail = switch (result.status()) {
                case SUCCESS -> summarize(result.data());
                case PARTIAL -> summarize(result.data()) + " (" + result.error() + ")";
                case FAILED -> result.error();
            };
            String line = "[" + LocalDateTime.now().format(LOG_TIMESTAMP) + "] Step " + result.stepNumber()
                    + ": " + result.status() + " - " + detail;
            executionLog.add(line);
            log.debug(line);
            return true;
        }

        List<StepResult> results() {
            var out = new ArrayList<StepResult>(plan.steps().size());
            for (int i = 0; i < slots.length(); i++) {
                out.add(slots.get(i));
            }
            return out;
        }
    }
}
