package com.qqsuccubus.autoscale.controller.k8s;

import com.qqsuccubus.autoscale.controller.config.AutoscalerConfig;
import com.qqsuccubus.autoscale.controller.registry.ServiceLabels;
import com.qqsuccubus.autoscale.core.model.Replica;
import com.qqsuccubus.autoscale.core.util.JsonUtils;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentCondition;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Kubernetes implementation of the orchestrator client.
 * <p>
 * A service is a {@code Deployment}; its replicas are the running pods matched by the
 * deployment's selector. All calls are blocking fabric8 calls moved onto
 * {@link Schedulers#boundedElastic()} and bounded by the orchestrator timeout.
 * </p>
 */
public class KubernetesOrchestratorClient implements IOrchestratorClient {
    private static final Logger log = LoggerFactory.getLogger(KubernetesOrchestratorClient.class);

    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_NOT_FOUND = 404;

    private final KubernetesClient client;
    private final AutoscalerConfig config;
    private final Duration timeout;

    public KubernetesOrchestratorClient(KubernetesClient client, AutoscalerConfig config) {
        this.client = client;
        this.config = config;
        this.timeout = config.getOrchestratorTimeout();

        log.info("Orchestrator client initialized: api={}, namespace={}, timeout={}",
            client.getMasterUrl(), config.getKubernetesNamespace(), timeout);
    }

    /**
     * Builds a fabric8 client from in-cluster or kubeconfig settings, with the orchestrator
     * timeout applied to every request.
     */
    public static KubernetesClient createClient(AutoscalerConfig config) {
        int timeoutMs = (int) config.getOrchestratorTimeout().toMillis();
        ConfigBuilder builder = new ConfigBuilder(Config.autoConfigure(null))
            .withRequestTimeout(timeoutMs)
            .withConnectionTimeout(timeoutMs);
        if (config.getOrchestratorUrl() != null && !config.getOrchestratorUrl().isBlank()) {
            builder.withMasterUrl(config.getOrchestratorUrl());
        }
        return new KubernetesClientBuilder().withConfig(builder.build()).build();
    }

    @Override
    public Mono<List<DiscoveredService>> listServices() {
        return Mono.fromCallable(() -> {
                // no server-side label selector: opting in through the annotation alone is allowed
                List<Deployment> deployments = config.isAllNamespaces()
                    ? client.apps().deployments().inAnyNamespace().list().getItems()
                    : client.apps().deployments().inNamespace(config.getKubernetesNamespace()).list().getItems();

                List<DiscoveredService> discovered = deployments.stream()
                    .filter(KubernetesOrchestratorClient::declaresAutoscale)
                    .map(KubernetesOrchestratorClient::toDiscovered)
                    .collect(Collectors.toList());
                log.debug("Listed {} deployments, {} declare {}", deployments.size(), discovered.size(),
                    ServiceLabels.AUTOSCALE);
                return discovered;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .onErrorMap(err -> new DiscoveryException("Failed to list deployments: " + describe(err), err));
    }

    @Override
    public Mono<DiscoveredService> inspect(String serviceId) {
        return Mono.fromCallable(() -> getDeployment(serviceId))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .map(KubernetesOrchestratorClient::toDiscovered);
    }

    @Override
    public Mono<List<Replica>> listRunningReplicas(String serviceId) {
        return Mono.fromCallable(() -> {
                Deployment deployment = getDeployment(serviceId);
                if (deployment == null || deployment.getSpec() == null || deployment.getSpec().getSelector() == null) {
                    return List.<Replica>of();
                }
                Map<String, String> selector = deployment.getSpec().getSelector().getMatchLabels();
                if (selector == null || selector.isEmpty()) {
                    log.warn("Deployment {} has no matchLabels selector; cannot resolve replicas", serviceId);
                    return List.<Replica>of();
                }

                List<Pod> pods = client.pods()
                    .inNamespace(deployment.getMetadata().getNamespace())
                    .withLabels(selector)
                    .list()
                    .getItems();

                return pods.stream()
                    .filter(KubernetesOrchestratorClient::isRunning)
                    .map(KubernetesOrchestratorClient::toReplica)
                    .collect(Collectors.toList());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout);
    }

    @Override
    public Mono<Void> updateReplicas(DiscoveredService observed, int replicas) {
        return Mono.fromCallable(() -> {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("resourceVersion", observed.getResourceVersion());
                Map<String, Object> patch = Map.of(
                    "metadata", metadata,
                    "spec", Map.of("replicas", replicas)
                );

                // resourceVersion in the patch body makes the API server reject concurrent edits with 409
                client.apps().deployments()
                    .inNamespace(observed.getNamespace())
                    .withName(observed.getName())
                    .patch(PatchContext.of(PatchType.JSON_MERGE), JsonUtils.writeValueAsString(patch));

                log.info("Scaled Deployment {} from {} to {} replicas",
                    observed.getServiceId(), observed.getReplicas(), replicas);
                return Boolean.TRUE;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .onErrorMap(err -> !(err instanceof ScaleActionException), err -> toScaleError(observed.getServiceId(), err))
            .then();
    }

    @Override
    public Mono<String> nodeStatsSummary(String nodeName) {
        return Mono.fromCallable(() -> client.raw("/api/v1/nodes/" + nodeName + "/proxy/stats/summary"))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<NodeCapacity> nodeCapacity(String nodeName) {
        return Mono.fromCallable(() -> {
                Node node = client.nodes().withName(nodeName).get();
                if (node == null || node.getStatus() == null || node.getStatus().getAllocatable() == null) {
                    return null;
                }
                Map<String, Quantity> allocatable = node.getStatus().getAllocatable();
                return new NodeCapacity(
                    nodeName,
                    amount(allocatable.get("cpu")).doubleValue(),
                    amount(allocatable.get("memory")).longValue()
                );
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout);
    }

    private Deployment getDeployment(String serviceId) {
        int slash = serviceId.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Service id must be namespace/name: " + serviceId);
        }
        return client.apps().deployments()
            .inNamespace(serviceId.substring(0, slash))
            .withName(serviceId.substring(slash + 1))
            .get();
    }

    /**
     * Whether the deployment carries the {@code autoscale} key as a label or an annotation.
     */
    static boolean declaresAutoscale(Deployment deployment) {
        Map<String, String> labels = deployment.getMetadata().getLabels();
        Map<String, String> annotations = deployment.getMetadata().getAnnotations();
        return (labels != null && labels.containsKey(ServiceLabels.AUTOSCALE))
            || (annotations != null && annotations.containsKey(ServiceLabels.AUTOSCALE));
    }

    static DiscoveredService toDiscovered(Deployment deployment) {
        Map<String, String> labels = new HashMap<>();
        if (deployment.getMetadata().getAnnotations() != null) {
            deployment.getMetadata().getAnnotations().forEach((key, value) -> {
                if (key.startsWith(ServiceLabels.AUTOSCALE)) {
                    labels.put(key, value);
                }
            });
        }
        if (deployment.getMetadata().getLabels() != null) {
            labels.putAll(deployment.getMetadata().getLabels());
        }

        Integer replicas = deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null;
        Long generation = deployment.getMetadata().getGeneration();
        String namespace = deployment.getMetadata().getNamespace();
        String name = deployment.getMetadata().getName();

        return DiscoveredService.builder()
            .serviceId(DiscoveredService.serviceId(namespace, name))
            .name(name)
            .namespace(namespace)
            .labels(Map.copyOf(labels))
            // Kubernetes defaults an unset replica count to 1
            .replicas(replicas != null ? replicas : 1)
            .resourceVersion(deployment.getMetadata().getResourceVersion())
            .generation(generation != null ? generation : 0L)
            .lastUpdated(lastUpdated(deployment))
            .build();
    }

    private static Instant lastUpdated(Deployment deployment) {
        Instant latest = parseInstant(deployment.getMetadata().getCreationTimestamp());
        if (deployment.getStatus() != null && deployment.getStatus().getConditions() != null) {
            for (DeploymentCondition condition : deployment.getStatus().getConditions()) {
                Instant updated = parseInstant(condition.getLastUpdateTime());
                if (updated != null && (latest == null || updated.isAfter(latest))) {
                    latest = updated;
                }
            }
        }
        return latest;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return null;
        }
    }

    static boolean isRunning(Pod pod) {
        return pod.getStatus() != null
            && "Running".equals(pod.getStatus().getPhase())
            && pod.getMetadata().getDeletionTimestamp() == null;
    }

    static Replica toReplica(Pod pod) {
        double cpuLimit = 0.0;
        long memoryLimit = 0L;
        boolean cpuLimited = true;
        boolean memoryLimited = true;

        List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : List.of();
        for (Container container : containers) {
            Map<String, Quantity> limits = container.getResources() != null
                ? container.getResources().getLimits()
                : null;
            Quantity cpu = limits != null ? limits.get("cpu") : null;
            Quantity memory = limits != null ? limits.get("memory") : null;
            // A single unlimited container makes the whole pod unlimited for that resource
            if (cpu == null) {
                cpuLimited = false;
            } else {
                cpuLimit += amount(cpu).doubleValue();
            }
            if (memory == null) {
                memoryLimited = false;
            } else {
                memoryLimit += amount(memory).longValue();
            }
        }

        return Replica.builder()
            .replicaId(pod.getMetadata().getName())
            .namespace(pod.getMetadata().getNamespace())
            .nodeName(pod.getSpec() != null ? pod.getSpec().getNodeName() : null)
            .cpuLimitCores(cpuLimited && !containers.isEmpty() ? cpuLimit : 0.0)
            .memoryLimitBytes(memoryLimited && !containers.isEmpty() ? memoryLimit : 0L)
            .build();
    }

    private static BigDecimal amount(Quantity quantity) {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        return quantity.getNumericalAmount();
    }

    private static ScaleActionException toScaleError(String serviceId, Throwable err) {
        if (err instanceof KubernetesClientException kce) {
            if (kce.getCode() == HTTP_CONFLICT) {
                return new ScaleActionException(serviceId,
                    "Concurrent modification of " + serviceId + " (version conflict)", true, err);
            }
            if (kce.getCode() == HTTP_NOT_FOUND) {
                return new ScaleActionException(serviceId, "Service " + serviceId + " no longer exists", false, err);
            }
        }
        return new ScaleActionException(serviceId, "Update of " + serviceId + " failed: " + describe(err), false, err);
    }

    private static String describe(Throwable err) {
        if (err instanceof TimeoutException) {
            return "timed out";
        }
        return Objects.toString(err.getMessage(), err.getClass().getSimpleName());
    }

    @Override
    public void close() {
        client.close();
        log.info("Orchestrator client closed");
    }
}
