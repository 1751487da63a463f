package com.qqsuccubus.autoscale.controller.k8s;

/**
 * The orchestrator could not be asked for its services.
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
