package org.caureq.gpufleet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "providers.scaleway")
public record ScalewayProps(boolean enabled, String baseUrl, String secretKey, String projectId,
                            String image, List<String> zones, Duration timeout) {}
