package com.opsassistant.core.execution;

import com.opsassistant.tools.FaultClass;
import com.opsassistant.tools.FaultCode;

import java.time.Duration;

/**
 * Exponential backoff policy for transient tool faults.
 *
 * @param maxRetries   retries after the first attempt
 * @param initialDelay delay before the first retry
 * @param multiplier   growth factor between consecutive delays
 * @param maxDelay     upper bound for any single delay
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
    }

    public static FaultClass classifyFault(FaultCode code) {
        return code.faultClass();
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before the given retry: {@code initialDelay * multiplier^(retry-1)}, capped at {@code maxDelay}.
     *
     * @param retry 1-based retry number
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) throw new IllegalArgumentException("retry is 1-based, got " + retry);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis((long) millis);
    }
}
