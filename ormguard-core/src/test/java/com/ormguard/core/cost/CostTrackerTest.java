package com.ormguard.core.cost;

import com.ormguard.api.cost.CostBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CostTracker 单元测试")
class CostTrackerTest {

    private static CostBreakdown estimate(double scan, long rows) {
        return CostBreakdown.builder().scanCost(scan).detail("estimated_filtered_rows", rows).build();
    }

    @Test
    @DisplayName("无记录时统计为空")
    void shouldReturnEmptyStats() {
        CostTracker.AccuracyStats stats = new CostTracker().getAccuracyStats();

        assertEquals(0, stats.getCount());
        assertEquals(0.0, stats.getAvgDurationMs());
    }

    @Test
    @DisplayName("统计耗时与行数偏差")
    void shouldComputeAccuracy() {
        CostTracker tracker = new CostTracker();
        tracker.record("Order", estimate(10.0, 10), 20.0, 20);
        tracker.record("Order", estimate(10.0, 10), 40.0, 10);

        CostTracker.AccuracyStats stats = tracker.getAccuracyStats();

        assertEquals(2, stats.getCount());
        assertEquals(3.0, stats.getAvgCostToDurationRatio(), 1e-9);
        assertEquals(0.25, stats.getAvgRowEstimationError(), 1e-9);
        assertEquals(20.0, stats.getMinDurationMs());
        assertEquals(40.0, stats.getMaxDurationMs());
        assertEquals(30.0, stats.getAvgDurationMs(), 1e-9);
    }

    @Test
    @DisplayName("超过容量时丢弃最旧记录")
    void shouldEvictOldest() {
        CostTracker tracker = new CostTracker(2);
        tracker.record("A", estimate(1, 1), 1, 1);
        tracker.record("B", estimate(1, 1), 1, 1);
        tracker.record("C", estimate(1, 1), 1, 1);

        assertEquals(2, tracker.size());
        assertEquals("B", tracker.getRecords().get(0).getModel());

        tracker.clear();
        assertEquals(0, tracker.size());
    }

    @Test
    @DisplayName("容量必须为正")
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new CostTracker(0));
    }
}
