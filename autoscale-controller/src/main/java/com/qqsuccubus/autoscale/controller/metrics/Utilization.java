package com.qqsuccubus.autoscale.controller.metrics;

import com.qqsuccubus.autoscale.controller.k8s.NodeCapacity;
import com.qqsuccubus.autoscale.core.model.Replica;

import java.util.OptionalDouble;

/**
 * Converts raw usage into percentages of a replica's limit.
 */
public final class Utilization {
    private Utilization() {
    }

    /**
     * CPU usage as a percentage of the replica's CPU limit.
     * <p>
     * Unlimited replicas are measured against the allocatable CPU of their node, or against one
     * core when the node capacity is unknown.
     * </p>
     *
     * @param usageCores CPU usage rate in cores
     * @param replica    replica the usage belongs to
     * @param node       capacity of the replica's node, may be null
     * @return utilization percentage, not capped at 100
     */
    public static double cpuPercent(double usageCores, Replica replica, NodeCapacity node) {
        double limit;
        if (replica.hasCpuLimit()) {
            limit = replica.getCpuLimitCores();
        } else if (node != null && node.getCpuCores() > 0) {
            limit = node.getCpuCores();
        } else {
            limit = 1.0;
        }
        return usageCores / limit * 100.0;
    }

    /**
     * Working-set memory as a percentage of the replica's memory limit.
     * <p>
     * Unlimited replicas are measured against their node's allocatable memory; without it there is
     * nothing meaningful to divide by and the sample is dropped.
     * </p>
     *
     * @return utilization percentage, or empty when no denominator is known
     */
    public static OptionalDouble memoryPercent(long workingSetBytes, Replica replica, NodeCapacity node) {
        long limit;
        if (replica.hasMemoryLimit()) {
            limit = replica.getMemoryLimitBytes();
        } else if (node != null && node.getMemoryBytes() > 0) {
            limit = node.getMemoryBytes();
        } else {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) workingSetBytes / limit * 100.0);
    }
}
