package org.caureq.gpufleet.service;

import org.caureq.gpufleet.config.AppProps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** delay(n) = min(max, initial * multiplier^(n-1)); after {@code maxRetries} the failure is final. */
@Component
public class RetryBackoff {
    private final int maxRetries;
    private final Duration initial;
    private final Duration max;
    private final double multiplier;

    @Autowired
    public RetryBackoff(AppProps props) {
        this(props.retry());
    }

    public RetryBackoff(AppProps.RetryProps retry) {
        this.maxRetries = retry.maxRetries();
        this.initial = retry.initialBackoff();
        this.max = retry.maxBackoff();
        this.multiplier = retry.multiplier();
    }

    /** @param attempt 1-based number of the failed attempt */
    public Duration delayFor(int attempt) {
        int n = Math.max(1, attempt);
        double millis = initial.toMillis() * Math.pow(multiplier, n - 1);
        if (Double.isInfinite(millis) || millis >= max.toMillis()) return max;
        return Duration.ofMillis((long) millis);
    }

    /** True once {@code retryCount} failed attempts leave no retry budget. */
    public boolean exhausted(int retryCount) {
        return retryCount >= maxRetries;
    }

    public int maxRetries() { return maxRetries; }
}
