package org.caureq.gpufleet.domain;

public enum ActionStatus {
    IN_PROGRESS("in_progress"),
    SUCCESS("success"),
    FAILED("failed");

    private final String code;

    ActionStatus(String code) { this.code = code; }

    public String code() { return code; }

    public static ActionStatus fromCode(String code) {
        if (code == null) return null;
        for (var s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown action status: " + code);
    }
}
