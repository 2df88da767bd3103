package com.opsassistant.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the plan / execute / verify pipeline.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    @Autowired
    public PipelineMetrics(ObjectProvider<MeterRegistry> registry) {
        this(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("ops.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanningFailure(String reason) {
        Counter.builder("ops.planning.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPlanSize(int steps) {
        DistributionSummary.builder("ops.plan.steps")
                .description("Number of steps per plan")
                .register(registry)
                .record(steps);
    }

    public void recordStepExecution(String tool, String status, long ms) {
        Timer.builder("ops.step.duration")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String tool, String faultCode) {
        Counter.builder("ops.step.retries")
                .description("Retries after transient tool faults")
                .tag("tool", tool)
                .tag("fault", faultCode)
                .register(registry)
                .increment();
    }

    /**
     * @param width    number of steps dispatched together
     * @param strategy "parallel" or "sequential"
     */
    public void recordWave(int width, String strategy) {
        DistributionSummary.builder("ops.wave.width")
                .description("Number of steps per wave")
                .tag("strategy", strategy)
                .register(registry)
                .record(width);
    }

    public void recordVerification(boolean complete, boolean correct, boolean qualityAssessed) {
        Counter.builder("ops.verification.total")
                .tag("complete", String.valueOf(complete))
                .tag("correct", String.valueOf(correct))
                .tag("assessed", String.valueOf(qualityAssessed))
                .register(registry)
                .increment();
    }

    MeterRegistry registry() {
        return registry;
    }
}
