package com.qqsuccubus.autoscale.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DecreaseModeTest {

    @Test
    void testMedian_OddCount() {
        assertEquals(11.0, DecreaseMode.MEDIAN.aggregate(List.of(10.0, 12.0, 11.0)));
    }

    @Test
    void testMedian_EvenCountAveragesMiddlePair() {
        assertEquals(15.0, DecreaseMode.MEDIAN.aggregate(List.of(40.0, 10.0, 20.0, 5.0)));
    }

    @Test
    void testMax_ReturnsLargestSample() {
        assertEquals(40.0, DecreaseMode.MAX.aggregate(List.of(10.0, 40.0, 20.0)));
    }

    @Test
    void testAggregate_EmptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> DecreaseMode.MEDIAN.aggregate(List.of()));
    }

    @Test
    void testFromLabel_CaseInsensitive() {
        assertEquals(Optional.of(DecreaseMode.MAX), DecreaseMode.fromLabel(" max "));
        assertEquals(Optional.of(DecreaseMode.MEDIAN), DecreaseMode.fromLabel("Median"));
        assertEquals(Optional.empty(), DecreaseMode.fromLabel("mean"));
        assertEquals(Optional.empty(), DecreaseMode.fromLabel(null));
    }

    @Test
    void testMetricTypeFromLabel() {
        assertEquals(Optional.of(MetricType.CPU), MetricType.fromLabel("CPU"));
        assertEquals(Optional.of(MetricType.MEMORY), MetricType.fromLabel("memory"));
        assertEquals(Optional.empty(), MetricType.fromLabel("disk"));
    }
}
