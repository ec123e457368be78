package org.caureq.gpufleet.bus;

import java.util.Optional;

public enum CommandType {
    PROVISION("CMD:PROVISION"),
    TERMINATE("CMD:TERMINATE"),
    SYNC_CATALOG("CMD:SYNC_CATALOG"),
    RECONCILE("CMD:RECONCILE"),
    REINSTALL("CMD:REINSTALL");

    private final String wire;

    CommandType(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static Optional<CommandType> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (var t : values()) {
            if (t.wire.equalsIgnoreCase(value.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }
}
