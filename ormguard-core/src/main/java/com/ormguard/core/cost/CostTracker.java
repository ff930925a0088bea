package com.ormguard.core.cost;

import com.ormguard.api.cost.CostBreakdown;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 记录估算成本与实际执行的对比，用于校准权重
 * <p>
 * 超过容量时丢弃最旧记录。线程安全。
 * </p>
 */
@Slf4j
public class CostTracker {

    private static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Deque<Execution> records = new ArrayDeque<>();

    public CostTracker() {
        this(DEFAULT_CAPACITY);
    }

    public CostTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Value
    public static class Execution {
        String model;
        double estimatedCost;
        long estimatedRows;
        double actualDurationMs;
        long actualRows;
    }

    @Value
    @Builder
    public static class AccuracyStats {
        int count;
        double avgCostToDurationRatio;
        double avgRowEstimationError;
        double minDurationMs;
        double maxDurationMs;
        double avgDurationMs;
    }

    public void record(String model, CostBreakdown estimated, double actualDurationMs, long actualRows) {
        Object rows = estimated.getDetails().get("estimated_filtered_rows");
        long estimatedRows = rows instanceof Number ? ((Number) rows).longValue() : 0L;
        Execution execution = new Execution(model, estimated.getTotal(), estimatedRows, actualDurationMs, actualRows);
        synchronized (records) {
            if (records.size() >= capacity) {
                records.pollFirst();
            }
            records.addLast(execution);
        }
    }

    public List<Execution> getRecords() {
        synchronized (records) {
            return List.copyOf(new ArrayList<>(records));
        }
    }

    /**
     * 估算与实际的偏差统计；无记录时 count 为 0，其余为 0.0
     */
    public AccuracyStats getAccuracyStats() {
        List<Execution> snapshot = getRecords();
        if (snapshot.isEmpty()) {
            return AccuracyStats.builder().build();
        }

        double ratioSum = 0.0;
        double rowErrorSum = 0.0;
        double durationSum = 0.0;
        double min = Double.MAX_VALUE;
        double max = 0.0;
        for (Execution e : snapshot) {
            ratioSum += e.getActualDurationMs() / Math.max(e.getEstimatedCost(), 0.001);
            rowErrorSum += Math.abs(e.getEstimatedRows() - e.getActualRows()) / (double) Math.max(e.getActualRows(), 1);
            durationSum += e.getActualDurationMs();
            min = Math.min(min, e.getActualDurationMs());
            max = Math.max(max, e.getActualDurationMs());
        }
        int n = snapshot.size();
        AccuracyStats stats = AccuracyStats.builder()
                .count(n)
                .avgCostToDurationRatio(ratioSum / n)
                .avgRowEstimationError(rowErrorSum / n)
                .minDurationMs(min)
                .maxDurationMs(max)
                .avgDurationMs(durationSum / n)
                .build();
        log.debug("[Cost] Accuracy over {} executions: {}", n, stats);
        return stats;
    }

    public void clear() {
        synchronized (records) {
            records.clear();
        }
    }

    public int size() {
        synchronized (records) {
            return records.size();
        }
    }
}
