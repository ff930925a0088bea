package com.ormguard.core.cost;

import lombok.Builder;
import lombok.Value;

/**
 * 成本估算权重
 * <p>
 * 单位是抽象的，只与预期资源消耗成比例。按部署校准时用 {@code toBuilder()} 覆盖个别项。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CostWeights {

    // ==================== 扫描 ====================

    @Builder.Default
    double fullScanPerRow = 1.0;

    @Builder.Default
    double indexScanPerRow = 0.3;

    @Builder.Default
    double pkLookup = 0.1;

    // ==================== 过滤 ====================

    @Builder.Default
    double equalityFilter = 0.1;

    @Builder.Default
    double rangeFilter = 0.2;

    /** contains / startswith / endswith */
    @Builder.Default
    double stringFilter = 0.5;

    @Builder.Default
    double inFilterPerItem = 0.05;

    @Builder.Default
    double complexFilter = 0.3;

    // ==================== 关联 ====================

    @Builder.Default
    double includeBase = 5.0;

    @Builder.Default
    double includePerRow = 0.2;

    @Builder.Default
    double includePerField = 0.1;

    // ==================== 排序 ====================

    @Builder.Default
    double sortPerRow = 0.1;

    @Builder.Default
    double sortPerColumn = 1.0;

    /** 超过该行数视为落盘排序 */
    @Builder.Default
    long inMemorySortThreshold = 1000;

    @Builder.Default
    double diskSortMultiplier = 3.0;

    // ==================== 聚合 ====================

    @Builder.Default
    double aggregatePerRow = 0.05;

    @Builder.Default
    double groupByPerRow = 0.15;

    // ==================== 传输与内存 ====================

    @Builder.Default
    double networkPerRow = 0.01;

    @Builder.Default
    double networkPerColumn = 0.001;

    @Builder.Default
    double memoryPerRow = 0.001;

    @Builder.Default
    double memoryPerColumn = 0.0001;

    /** 未指定 select 时假定的列数 */
    @Builder.Default
    int defaultColumnCount = 10;

    public static CostWeights defaults() {
        return CostWeights.builder().build();
    }
}
