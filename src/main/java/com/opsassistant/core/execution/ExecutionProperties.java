package com.opsassistant.core.execution;

import com.opsassistant.core.model.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Plan execution settings, bound from {@code ops.execution.*}.
 */
@Component
@ConfigurationProperties(prefix = "ops.execution")
public class ExecutionProperties {

    /** Worker threads per plan execution. */
    private int maxParallel = 4;

    /** Deadline for a whole plan execution. */
    private Duration timeout = Duration.ofSeconds(120);

    private ExecutionStrategy strategy = ExecutionStrategy.PARALLEL;

    private Retry retry = new Retry();

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public ExecutionStrategy getStrategy() { return strategy; }
    public void setStrategy(ExecutionStrategy strategy) { this.strategy = strategy; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.getMaxRetries(), retry.getInitialDelay(),
                retry.getMultiplier(), retry.getMaxDelay());
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }
}
