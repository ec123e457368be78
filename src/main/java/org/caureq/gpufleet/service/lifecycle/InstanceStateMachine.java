package org.caureq.gpufleet.service.lifecycle;

import org.caureq.gpufleet.domain.InstanceStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.caureq.gpufleet.domain.InstanceStatus.*;

/**
 * Legal lifecycle moves, computed from (current status, event) only.
 * Nothing here touches the ledger; {@link InstanceTransitions} applies the result.
 */
public final class InstanceStateMachine {

    private record Rule(Set<InstanceStatus> from, InstanceStatus to) {}

    private static final Map<LifecycleEvent, Rule> RULES = new EnumMap<>(LifecycleEvent.class);

    static {
        RULES.put(LifecycleEvent.PROVIDER_STARTED, new Rule(EnumSet.of(PROVISIONING), BOOTING));
        RULES.put(LifecycleEvent.PROVISIONING_FAILED, new Rule(EnumSet.of(PROVISIONING), PROVISIONING_FAILED));
        RULES.put(LifecycleEvent.WORKER_READY, new Rule(EnumSet.of(BOOTING), READY));
        RULES.put(LifecycleEvent.STARTUP_TIMED_OUT, new Rule(EnumSet.of(BOOTING), STARTUP_FAILED));
        RULES.put(LifecycleEvent.DRAIN_REQUESTED, new Rule(EnumSet.of(READY), DRAINING));
        // failed rows may still own a remote server, so they can be sent to the terminator too
        RULES.put(LifecycleEvent.TERMINATE_REQUESTED, new Rule(
                EnumSet.of(PROVISIONING, BOOTING, READY, DRAINING, STARTUP_FAILED, PROVISIONING_FAILED), TERMINATING));
        RULES.put(LifecycleEvent.TERMINATION_CONFIRMED, new Rule(EnumSet.of(TERMINATING), TERMINATED));
        RULES.put(LifecycleEvent.PROVIDER_DELETED, new Rule(EnumSet.of(BOOTING, READY, DRAINING), TERMINATED));
        RULES.put(LifecycleEvent.ARCHIVE_REQUESTED, new Rule(EnumSet.of(TERMINATED), ARCHIVED));
    }

    private InstanceStateMachine() {}

    /** Next status, or empty when the event does not apply to {@code current}. */
    public static Optional<InstanceStatus> next(InstanceStatus current, LifecycleEvent event) {
        var rule = RULES.get(event);
        if (current == null || rule == null || !rule.from().contains(current)) return Optional.empty();
        return Optional.of(rule.to());
    }

    public static Set<InstanceStatus> sources(LifecycleEvent event) {
        return Collections.unmodifiableSet(RULES.get(event).from());
    }

    public static InstanceStatus target(LifecycleEvent event) {
        return RULES.get(event).to();
    }

    public static boolean isLegal(InstanceStatus from, InstanceStatus to) {
        for (var rule : RULES.values()) {
            if (rule.to() == to && rule.from().contains(from)) return true;
        }
        return false;
    }
}
