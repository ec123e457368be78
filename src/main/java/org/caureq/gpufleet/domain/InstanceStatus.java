package org.caureq.gpufleet.domain;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle status of an {@link Instance}, persisted as its lowercase code. */
public enum InstanceStatus {
    PROVISIONING("provisioning"),
    BOOTING("booting"),
    READY("ready"),
    DRAINING("draining"),
    TERMINATING("terminating"),
    TERMINATED("terminated"),
    STARTUP_FAILED("startup_failed"),
    PROVISIONING_FAILED("provisioning_failed"),
    ARCHIVED("archived");

    /** Statuses in which a worker may serve traffic (ip + inference port must be unique). */
    public static final Set<InstanceStatus> ACTIVE = EnumSet.of(BOOTING, READY, DRAINING);

    private final String code;

    InstanceStatus(String code) { this.code = code; }

    public String code() { return code; }

    public boolean isActive() { return ACTIVE.contains(this); }

    public static InstanceStatus fromCode(String code) {
        if (code == null) return null;
        for (var s : values()) {
            if (s.code.equalsIgnoreCase(code.trim())) return s;
        }
        throw new IllegalArgumentException("Unknown instance status: " + code);
    }
}
