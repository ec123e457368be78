package org.caureq.gpufleet.service.provider;

import java.time.Instant;

/** A server as listed by the provider. {@code status} is the provider's own state string. */
public record RemoteInstance(String providerId, String name, String zone, String status,
                             String ipAddress, Instant createdAt) {

    public boolean isGone() {
        return "terminated".equalsIgnoreCase(status) || "deleted".equalsIgnoreCase(status);
    }
}
