package com.qqsuccubus.autoscale.controller.k8s;

import lombok.Getter;

/**
 * The orchestrator rejected, or did not answer, a replica update.
 * <p>
 * A conflict means the workload was modified concurrently; it is transient and resolved by
 * re-evaluating on the next tick with fresh state.
 * </p>
 */
@Getter
public class ScaleActionException extends RuntimeException {
    private final String serviceId;
    private final boolean conflict;

    public ScaleActionException(String serviceId, String message, boolean conflict, Throwable cause) {
        super(message, cause);
        this.serviceId = serviceId;
        this.conflict = conflict;
    }

    public ScaleActionException(String serviceId, String message) {
        this(serviceId, message, false, null);
    }
}
