package org.caureq.gpufleet.service;

import org.caureq.gpufleet.config.AppProps;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    private final RetryBackoff backoff = new RetryBackoff(
            new AppProps.RetryProps(5, Duration.ofSeconds(30), Duration.ofMinutes(10), 2.0));

    @Test
    void delaysGrowGeometrically() {
        assertEquals(Duration.ofSeconds(30), backoff.delayFor(1));
        assertEquals(Duration.ofSeconds(60), backoff.delayFor(2));
        assertEquals(Duration.ofSeconds(120), backoff.delayFor(3));
        assertEquals(Duration.ofSeconds(240), backoff.delayFor(4));
    }

    @Test
    void delaysAreCappedAtMax() {
        assertEquals(Duration.ofMinutes(10), backoff.delayFor(6));
        assertEquals(Duration.ofMinutes(10), backoff.delayFor(5000));
    }

    @Test
    void attemptBelowOneIsTreatedAsFirst() {
        assertEquals(Duration.ofSeconds(30), backoff.delayFor(0));
    }

    @Test
    void budgetRunsOutAtMaxRetries() {
        assertFalse(backoff.exhausted(4));
        assertTrue(backoff.exhausted(5));
        assertEquals(5, backoff.maxRetries());
    }

    @Test
    void missingConfigurationUsesDefaults() {
        var defaults = new RetryBackoff(new AppProps(null, null, null, null, null));

        assertEquals(5, defaults.maxRetries());
        assertEquals(Duration.ofSeconds(30), defaults.delayFor(1));
        assertEquals(Duration.ofMinutes(10), defaults.delayFor(10));
    }
}
