package com.qqsuccubus.autoscale.controller.k8s;

import com.qqsuccubus.autoscale.core.model.Replica;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KubernetesOrchestratorClientTest {

    private static Pod pod(String cpuA, String memA, String cpuB, String memB) {
        return new PodBuilder()
            .withNewMetadata().withName("web-7f9c-abcde").withNamespace("shop").endMetadata()
            .withNewSpec()
                .withNodeName("node-1")
                .addNewContainer()
                    .withName("app")
                    .withNewResources().withLimits(limits(cpuA, memA)).endResources()
                .endContainer()
                .addNewContainer()
                    .withName("sidecar")
                    .withNewResources().withLimits(limits(cpuB, memB)).endResources()
                .endContainer()
            .endSpec()
            .withNewStatus().withPhase("Running").endStatus()
            .build();
    }

    private static Map<String, Quantity> limits(String cpu, String memory) {
        Map<String, Quantity> limits = new HashMap<>();
        if (cpu != null) {
            limits.put("cpu", new Quantity(cpu));
        }
        if (memory != null) {
            limits.put("memory", new Quantity(memory));
        }
        return limits;
    }

    @Test
    void testToReplica_SumsContainerLimits() {
        Replica replica = KubernetesOrchestratorClient.toReplica(pod("500m", "256Mi", "250m", "128Mi"));

        assertEquals("web-7f9c-abcde", replica.getReplicaId());
        assertEquals("shop", replica.getNamespace());
        assertEquals("node-1", replica.getNodeName());
        assertEquals(0.75, replica.getCpuLimitCores(), 1e-9);
        assertEquals(384L * 1024 * 1024, replica.getMemoryLimitBytes());
    }

    @Test
    void testToReplica_OneUnlimitedContainerMakesPodUnlimited() {
        Replica replica = KubernetesOrchestratorClient.toReplica(pod("500m", "256Mi", null, "128Mi"));

        assertFalse(replica.hasCpuLimit());
        assertTrue(replica.hasMemoryLimit());
    }

    @Test
    void testIsRunning_TerminatingPodExcluded() {
        Pod running = pod("1", "1Gi", "1", "1Gi");
        Pod terminating = new PodBuilder(running)
            .editMetadata().withDeletionTimestamp("2024-05-01T10:00:00Z").endMetadata()
            .build();
        Pod pending = new PodBuilder(running)
            .editStatus().withPhase("Pending").endStatus()
            .build();

        assertTrue(KubernetesOrchestratorClient.isRunning(running));
        assertFalse(KubernetesOrchestratorClient.isRunning(terminating));
        assertFalse(KubernetesOrchestratorClient.isRunning(pending));
    }

    @Test
    void testToDiscovered_LabelsWinOverAnnotations() {
        Deployment deployment = new DeploymentBuilder()
            .withNewMetadata()
                .withName("web")
                .withNamespace("shop")
                .withResourceVersion("4711")
                .withGeneration(9L)
                .withCreationTimestamp("2024-05-01T09:00:00Z")
                .addToLabels("autoscale", "true")
                .addToLabels("autoscale.max", "8")
                .addToAnnotations("autoscale.max", "20")
                .addToAnnotations("autoscale.decrease-mode", "max")
                .addToAnnotations("deployment.kubernetes.io/revision", "3")
            .endMetadata()
            .withNewSpec().withReplicas(4).endSpec()
            .withNewStatus()
                .addNewCondition()
                    .withType("Progressing")
                    .withLastUpdateTime("2024-05-01T10:30:00Z")
                .endCondition()
            .endStatus()
            .build();

        DiscoveredService service = KubernetesOrchestratorClient.toDiscovered(deployment);

        assertEquals("shop/web", service.getServiceId());
        assertEquals(4, service.getReplicas());
        assertEquals("4711", service.getResourceVersion());
        assertEquals(9L, service.getGeneration());
        assertEquals("8", service.getLabels().get("autoscale.max"));
        assertEquals("max", service.getLabels().get("autoscale.decrease-mode"));
        assertFalse(service.getLabels().containsKey("deployment.kubernetes.io/revision"));
        assertEquals(Instant.parse("2024-05-01T10:30:00Z"), service.getLastUpdated());
    }

    @Test
    void testToDiscovered_UnsetReplicasDefaultToOne() {
        Deployment deployment = new DeploymentBuilder()
            .withNewMetadata().withName("api").withNamespace("shop").endMetadata()
            .withNewSpec().endSpec()
            .build();

        assertEquals(1, KubernetesOrchestratorClient.toDiscovered(deployment).getReplicas());
    }

    @Test
    void testDeclaresAutoscale_LabelOrAnnotation() {
        Deployment labelled = new DeploymentBuilder()
            .withNewMetadata().withName("web").withNamespace("shop").addToLabels("autoscale", "true").endMetadata()
            .build();
        Deployment annotated = new DeploymentBuilder()
            .withNewMetadata().withName("api").withNamespace("shop").addToAnnotations("autoscale", "true").endMetadata()
            .build();
        Deployment plain = new DeploymentBuilder()
            .withNewMetadata().withName("db").withNamespace("shop").addToLabels("app", "db").endMetadata()
            .build();

        assertTrue(KubernetesOrchestratorClient.declaresAutoscale(labelled));
        assertTrue(KubernetesOrchestratorClient.declaresAutoscale(annotated));
        assertFalse(KubernetesOrchestratorClient.declaresAutoscale(plain));
        assertEquals("true", KubernetesOrchestratorClient.toDiscovered(annotated).getLabels().get("autoscale"));
    }
}
