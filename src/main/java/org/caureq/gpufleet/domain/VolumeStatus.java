package org.caureq.gpufleet.domain;

public enum VolumeStatus {
    ATTACHED("attached"),
    DETACHING("detaching"),
    /** Released from a terminated server but left alive (not owned). */
    DETACHED("detached"),
    DELETED("deleted"),
    ERROR("error");

    private final String code;

    VolumeStatus(String code) { this.code = code; }

    public String code() { return code; }

    public static VolumeStatus fromCode(String code) {
        if (code == null) return null;
        for (var s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown volume status: " + code);
    }
}
