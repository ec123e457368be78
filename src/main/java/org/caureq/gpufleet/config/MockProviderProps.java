package org.caureq.gpufleet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * In-memory provider used for local runs and tests.
 * {@code outOfStockTypes} lists instance types whose create call is refused.
 */
@ConfigurationProperties(prefix = "providers.mock")
public record MockProviderProps(boolean enabled, List<String> zones, Duration deleteAfter,
                                List<String> outOfStockTypes) {}
