package com.qqsuccubus.autoscale.core.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of every autoscale-eligible service.
 * <p>
 * Exactly one snapshot is current at any instant. A new one is only built when the discovered
 * service set or a descriptor changed, so the version is a change counter, not a refresh counter.
 * </p>
 */
@Value
public class CacheSnapshot {
    private static final CacheSnapshot EMPTY = new CacheSnapshot(Collections.emptyMap(), 0, Instant.EPOCH);

    Map<String, ServiceDescriptor> services;
    long version;
    Instant publishedAt;

    public CacheSnapshot(Map<String, ServiceDescriptor> services, long version, Instant publishedAt) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        this.version = version;
        this.publishedAt = publishedAt;
    }

    public static CacheSnapshot empty() {
        return EMPTY;
    }

    public Optional<ServiceDescriptor> find(String serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    public Collection<ServiceDescriptor> descriptors() {
        return services.values();
    }

    public int size() {
        return services.size();
    }

    /**
     * Creates the successor snapshot holding the given services.
     */
    public CacheSnapshot next(Map<String, ServiceDescriptor> newServices, Instant now) {
        return new CacheSnapshot(newServices, version + 1, now);
    }
}
