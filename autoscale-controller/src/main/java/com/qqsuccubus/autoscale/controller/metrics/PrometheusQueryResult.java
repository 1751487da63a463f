package com.qqsuccubus.autoscale.controller.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Wrapper for Prometheus query results with convenient accessors.
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    private final List<PrometheusQueryService.PrometheusResult> results;

    private PrometheusQueryResult(List<PrometheusQueryService.PrometheusResult> results) {
        this.results = results != null ? results : Collections.emptyList();
    }

    public static PrometheusQueryResult from(PrometheusQueryService.PrometheusResponse response) {
        if (response == null || response.getData() == null) {
            return empty();
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    public static PrometheusQueryResult empty() {
        return new PrometheusQueryResult(Collections.emptyList());
    }

    /**
     * Gets values grouped by a label.
     * Use this for queries with "by (label)" clause that return multiple series.
     * <p>
     * Series whose value is not a finite number (NaN, +Inf, -Inf) are left out: a missing
     * measurement must not be mistaken for an idle replica.
     * </p>
     *
     * @param labelName The label to group by (e.g., "pod")
     * @return Map of label value -> metric value
     */
    public Map<String, Double> getValuesByLabel(String labelName) {
        Map<String, Double> valuesByLabel = new HashMap<>();

        for (PrometheusQueryService.PrometheusResult result : results) {
            if (result.getMetric() == null || !result.getMetric().containsKey(labelName)) {
                log.debug("Result missing label '{}': {}", labelName, result.getMetric());
                continue;
            }
            String labelValue = result.getMetric().get(labelName);

            OptionalDouble value = parseValue(result.getValue());
            if (value.isPresent()) {
                valuesByLabel.put(labelValue, value.getAsDouble());
            }
        }

        return valuesByLabel;
    }

    // Prometheus returns [timestamp, "value"]
    private static OptionalDouble parseValue(List<Object> sample) {
        if (sample == null || sample.size() < 2) {
            return OptionalDouble.empty();
        }
        Object valueObj = sample.get(1);
        try {
            double value;
            if (valueObj instanceof String valueStr) {
                if ("NaN".equals(valueStr) || valueStr.endsWith("Inf")) {
                    log.debug("Received non-numeric value from Prometheus: {}", valueStr);
                    return OptionalDouble.empty();
                }
                value = Double.parseDouble(valueStr);
            } else if (valueObj instanceof Number number) {
                value = number.doubleValue();
            } else {
                return OptionalDouble.empty();
            }
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                log.debug("Received non-finite value from Prometheus: {}", valueObj);
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(value);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse Prometheus value '{}': {}", valueObj, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }
}
