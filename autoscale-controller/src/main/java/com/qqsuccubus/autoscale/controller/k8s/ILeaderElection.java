package com.qqsuccubus.autoscale.controller.k8s;

/**
 * Tells whether this controller instance may evaluate and scale.
 */
@FunctionalInterface
public interface ILeaderElection {

    /**
     * Always-leader election for single-instance deployments.
     */
    ILeaderElection ALWAYS = () -> true;

    boolean isLeader();
}
