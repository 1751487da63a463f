package com.qqsuccubus.autoscale.controller.k8s;

import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpec;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leader election over a Kubernetes {@code Lease}.
 * <p>
 * Only the leader runs evaluation ticks and scales services; the registry keeps refreshing on
 * every instance so a follower has a warm snapshot when it takes over. Followers keep trying
 * to acquire the lease and take it once the holder stops renewing.
 * </p>
 */
public class LeaderElectionService implements ILeaderElection {
    private static final Logger log = LoggerFactory.getLogger(LeaderElectionService.class);

    static final String LEASE_NAME = "replica-autoscaler-leader";
    private static final int LEASE_DURATION_SECONDS = 15;
    private static final Duration RENEW_INTERVAL = Duration.ofSeconds(5);

    private final KubernetesClient client;
    private final String namespace;
    private final String identity;
    private final AtomicBoolean isLeader = new AtomicBoolean(false);
    private Disposable leaseRenewalTask;

    /**
     * @param client    Kubernetes client, shared with the orchestrator client
     * @param namespace namespace holding the lease
     * @param identity  holder identity, the controller's node id
     */
    public LeaderElectionService(KubernetesClient client, String namespace, String identity) {
        this.client = client;
        this.namespace = namespace;
        this.identity = identity;

        log.info("Leader election initialized for {} in namespace {}", identity, namespace);
    }

    public Disposable start() {
        log.info("Starting leader election for {}", identity);

        leaseRenewalTask = Flux.interval(Duration.ZERO, RENEW_INTERVAL)
            .onBackpressureDrop()
            .concatMap(tick -> attempt())
            .subscribe();

        return leaseRenewalTask;
    }

    private Mono<Void> attempt() {
        return Mono.fromRunnable(() -> {
                try {
                    Lease existing = client.leases()
                        .inNamespace(namespace)
                        .withName(LEASE_NAME)
                        .get();

                    if (existing == null) {
                        createLease();
                    } else {
                        acquireOrRenew(existing);
                    }
                } catch (Exception e) {
                    log.error("Leader election attempt failed: {}", e.getMessage());
                    demote();
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private void createLease() {
        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        Lease lease = new LeaseBuilder()
            .withNewMetadata()
            .withName(LEASE_NAME)
            .withNamespace(namespace)
            .endMetadata()
            .withSpec(spec(identity, now, now))
            .build();

        try {
            client.leases().inNamespace(namespace).resource(lease).create();
            promote("created lease");
        } catch (Exception e) {
            log.warn("Failed to create lease (another instance may have created it): {}", e.getMessage());
            demote();
        }
    }

    private void acquireOrRenew(Lease existing) {
        LeaseSpec current = existing.getSpec();
        String holder = current != null ? current.getHolderIdentity() : null;
        Instant renewed = current != null && current.getRenewTime() != null
            ? current.getRenewTime().toInstant()
            : Instant.EPOCH;
        int duration = current != null && current.getLeaseDurationSeconds() != null
            ? current.getLeaseDurationSeconds()
            : LEASE_DURATION_SECONDS;
        boolean expired = Duration.between(renewed, Instant.now()).getSeconds() > duration;

        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        if (identity.equals(holder)) {
            existing.setSpec(spec(identity, current.getAcquireTime(), now));
            update(existing, "renewed lease");
        } else if (expired || holder == null) {
            log.info("Lease held by {} expired, attempting to acquire it", holder);
            existing.setSpec(spec(identity, now, now));
            update(existing, "acquired expired lease");
        } else {
            if (isLeader.get()) {
                log.warn("Leadership LOST, {} now holds the lease", holder);
            }
            isLeader.set(false);
            log.debug("{} is the leader", holder);
        }
    }

    private void update(Lease lease, String action) {
        try {
            // resourceVersion carried by the read lease makes concurrent acquisitions conflict
            client.leases().inNamespace(namespace).resource(lease).update();
            promote(action);
        } catch (Exception e) {
            log.warn("Failed to update lease ({}): {}", action, e.getMessage());
            demote();
        }
    }

    private static LeaseSpec spec(String holder, ZonedDateTime acquired, ZonedDateTime renewed) {
        return new LeaseSpecBuilder()
            .withHolderIdentity(holder)
            .withLeaseDurationSeconds(LEASE_DURATION_SECONDS)
            .withAcquireTime(acquired)
            .withRenewTime(renewed)
            .build();
    }

    private void promote(String action) {
        if (!isLeader.getAndSet(true)) {
            log.info("Leadership ACQUIRED by {} ({})", identity, action);
        } else {
            log.debug("Lease renewed by {}", identity);
        }
    }

    private void demote() {
        if (isLeader.getAndSet(false)) {
            log.warn("Leadership LOST by {}", identity);
        }
    }

    @Override
    public boolean isLeader() {
        return isLeader.get();
    }

    /**
     * Stops renewing and releases the lease if held, so another instance takes over immediately.
     */
    public void stop() {
        if (leaseRenewalTask != null) {
            leaseRenewalTask.dispose();
        }

        if (isLeader.getAndSet(false)) {
            try {
                client.leases()
                    .inNamespace(namespace)
                    .withName(LEASE_NAME)
                    .delete();
                log.info("Lease released by {}", identity);
            } catch (Exception e) {
                log.warn("Failed to release lease during shutdown: {}", e.getMessage());
            }
        }
        log.info("Leader election stopped");
    }
}
