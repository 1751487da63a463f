package com.qqsuccubus.autoscale.controller.registry;

import com.qqsuccubus.autoscale.controller.k8s.DiscoveredService;
import com.qqsuccubus.autoscale.core.model.DecreaseMode;
import com.qqsuccubus.autoscale.core.model.MetricType;
import com.qqsuccubus.autoscale.core.model.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a workload's labels into a {@link ServiceDescriptor}.
 * <p>
 * Parsing never fails: every invalid value is replaced by its default and reported as a warning
 * on the descriptor. A given warning is logged once per process so that a misconfigured
 * service does not flood the log on every refresh.
 * </p>
 */
public class LabelParser {
    private static final Logger log = LoggerFactory.getLogger(LabelParser.class);

    private final Set<String> loggedWarnings = ConcurrentHashMap.newKeySet();

    public static boolean isTruthy(String value) {
        return value != null && "true".equalsIgnoreCase(value.trim());
    }

    public ServiceDescriptor parse(DiscoveredService service) {
        Map<String, String> labels = service.getLabels() != null ? service.getLabels() : Map.of();
        List<String> warnings = new ArrayList<>();

        int minReplicas = parseReplicas(labels, ServiceLabels.MIN_REPLICAS, ServiceLabels.DEFAULT_MIN_REPLICAS, warnings);
        int maxReplicas = parseReplicas(labels, ServiceLabels.MAX_REPLICAS, ServiceLabels.DEFAULT_MAX_REPLICAS, warnings);
        if (minReplicas > maxReplicas) {
            warnings.add(String.format("%s=%d is greater than %s=%d; using defaults %d and %d",
                ServiceLabels.MIN_REPLICAS, minReplicas, ServiceLabels.MAX_REPLICAS, maxReplicas,
                ServiceLabels.DEFAULT_MIN_REPLICAS, ServiceLabels.DEFAULT_MAX_REPLICAS));
            minReplicas = ServiceLabels.DEFAULT_MIN_REPLICAS;
            maxReplicas = ServiceLabels.DEFAULT_MAX_REPLICAS;
        }

        Integer percentageMin = parsePercentage(labels, ServiceLabels.PERCENTAGE_MIN, warnings);
        Integer percentageMax = parsePercentage(labels, ServiceLabels.PERCENTAGE_MAX, warnings);

        MetricType metric = MetricType.CPU;
        String metricValue = labels.get(ServiceLabels.METRIC);
        if (metricValue != null) {
            Optional<MetricType> parsed = MetricType.fromLabel(metricValue);
            if (parsed.isPresent()) {
                metric = parsed.get();
            } else {
                warnings.add(invalid(ServiceLabels.METRIC, metricValue, "cpu"));
            }
        }

        DecreaseMode decreaseMode = DecreaseMode.MEDIAN;
        String modeValue = labels.get(ServiceLabels.DECREASE_MODE);
        if (modeValue != null) {
            Optional<DecreaseMode> parsed = DecreaseMode.fromLabel(modeValue);
            if (parsed.isPresent()) {
                decreaseMode = parsed.get();
            } else {
                warnings.add(invalid(ServiceLabels.DECREASE_MODE, modeValue, "MEDIAN"));
            }
        }

        boolean disableManualReplicas = false;
        String manualValue = labels.get(ServiceLabels.DISABLE_MANUAL_REPLICAS);
        if (manualValue != null) {
            disableManualReplicas = isTruthy(manualValue);
            if (!disableManualReplicas && !"false".equalsIgnoreCase(manualValue.trim())) {
                warnings.add(invalid(ServiceLabels.DISABLE_MANUAL_REPLICAS, manualValue, "false"));
            }
        }

        for (String warning : warnings) {
            String key = service.getServiceId() + ": " + warning;
            if (loggedWarnings.add(key)) {
                log.warn("Invalid autoscale configuration on {}", key);
            }
        }

        return ServiceDescriptor.builder()
            .serviceId(service.getServiceId())
            .name(service.getName())
            .namespace(service.getNamespace())
            .autoscaleEnabled(isTruthy(labels.get(ServiceLabels.AUTOSCALE)))
            .metric(metric)
            .minReplicas(minReplicas)
            .maxReplicas(maxReplicas)
            .percentageMin(percentageMin)
            .percentageMax(percentageMax)
            .decreaseMode(decreaseMode)
            .disableManualReplicas(disableManualReplicas)
            .currentReplicas(service.getReplicas())
            .lastUpdated(service.getLastUpdated())
            .generation(service.getGeneration())
            .warnings(warnings)
            .build();
    }

    private static int parseReplicas(Map<String, String> labels, String key, int defaultValue, List<String> warnings) {
        String value = labels.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                warnings.add(invalid(key, value, String.valueOf(defaultValue)));
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            warnings.add(invalid(key, value, String.valueOf(defaultValue)));
            return defaultValue;
        }
    }

    /**
     * @return the override, or null to fall back to the global threshold
     */
    private static Integer parsePercentage(Map<String, String> labels, String key, List<String> warnings) {
        String value = labels.get(key);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                warnings.add(invalid(key, value, "global default"));
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            warnings.add(invalid(key, value, "global default"));
            return null;
        }
    }

    private static String invalid(String key, String value, String fallback) {
        return String.format("%s='%s' is invalid; using %s", key, value, fallback);
    }
}
