package com.ormguard.api.policy;

import lombok.Builder;
import lombok.Value;

/**
 * 资源预算
 * <p>
 * 限制查询规模，防止失控的操作。statementTimeoutMs 由下游执行器负责落实。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Budget {

    // ==================== 结构限制 ====================

    /** 最大返回行数 (1-10000) */
    @Builder.Default
    int maxRows = 100;

    /** 最大关系展开深度 (0-5) */
    @Builder.Default
    int maxIncludesDepth = 1;

    /** 最多选择字段数 (1-200) */
    @Builder.Default
    int maxSelectFields = 40;

    /** 语句超时（毫秒, 100-30000） */
    @Builder.Default
    int statementTimeoutMs = 2000;

    /** 复杂度评分上限 */
    @Builder.Default
    int maxComplexityScore = 100;

    // ==================== 宽查询防护 ====================

    @Builder.Default
    boolean broadQueryGuard = true;

    /** 绕过宽查询防护所需的最少过滤条件数 */
    @Builder.Default
    int minFiltersForBroadQuery = 1;

    /**
     * 默认预算
     */
    public static Budget defaults() {
        return Budget.builder().build();
    }

    /**
     * 取请求行数与预算上限中较小者
     */
    public int effectiveLimit(Integer requested) {
        if (requested == null) {
            return maxRows;
        }
        return Math.min(requested, maxRows);
    }

    public void validate() {
        validate("budget");
    }

    void validate(String path) {
        PolicyChecks.requireRange(path + ".maxRows", maxRows, 1, 10000);
        PolicyChecks.requireRange(path + ".maxIncludesDepth", maxIncludesDepth, 0, 5);
        PolicyChecks.requireRange(path + ".maxSelectFields", maxSelectFields, 1, 200);
        PolicyChecks.requireRange(path + ".statementTimeoutMs", statementTimeoutMs, 100, 30000);
        PolicyChecks.requireAtLeast(path + ".maxComplexityScore", maxComplexityScore, 1);
        PolicyChecks.requireAtLeast(path + ".minFiltersForBroadQuery", minFiltersForBroadQuery, 0);
    }

    @Override
    public String toString() {
        return String.format("Budget{maxRows=%d, includes=%d, fields=%d, timeout=%dms}",
                maxRows, maxIncludesDepth, maxSelectFields, statementTimeoutMs);
    }
}
