package com.qqsuccubus.autoscale.controller.k8s;

import lombok.Value;

/**
 * Allocatable resources of a cluster node.
 */
@Value
public class NodeCapacity {
    String nodeName;
    double cpuCores;
    long memoryBytes;
}
