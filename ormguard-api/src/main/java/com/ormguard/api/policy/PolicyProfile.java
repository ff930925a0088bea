package com.ormguard.api.policy;

import java.util.Locale;

/**
 * 预置配置档
 * <p>
 * PROD 最严格；INTERNAL 放宽预算；DEV 关闭租户强制与宽查询防护，并开启写操作。
 * </p>
 */
public enum PolicyProfile {

    PROD(100, 1, 40, 2000, 100, true, true, false, true),
    INTERNAL(500, 2, 80, 5000, 200, true, true, false, true),
    DEV(1000, 3, 100, 10000, 500, false, false, true, false);

    private final int maxRows;
    private final int maxIncludesDepth;
    private final int maxSelectFields;
    private final int statementTimeoutMs;
    private final int maxComplexityScore;
    private final boolean broadQueryGuard;
    private final boolean requireTenantScope;
    private final boolean writesEnabled;
    private final boolean requireReasonForWrites;

    PolicyProfile(int maxRows, int maxIncludesDepth, int maxSelectFields, int statementTimeoutMs,
            int maxComplexityScore, boolean broadQueryGuard, boolean requireTenantScope,
            boolean writesEnabled, boolean requireReasonForWrites) {
        this.maxRows = maxRows;
        this.maxIncludesDepth = maxIncludesDepth;
        this.maxSelectFields = maxSelectFields;
        this.statementTimeoutMs = statementTimeoutMs;
        this.maxComplexityScore = maxComplexityScore;
        this.broadQueryGuard = broadQueryGuard;
        this.requireTenantScope = requireTenantScope;
        this.writesEnabled = writesEnabled;
        this.requireReasonForWrites = requireReasonForWrites;
    }

    public Budget toBudget() {
        return Budget.builder()
                .maxRows(maxRows)
                .maxIncludesDepth(maxIncludesDepth)
                .maxSelectFields(maxSelectFields)
                .statementTimeoutMs(statementTimeoutMs)
                .maxComplexityScore(maxComplexityScore)
                .broadQueryGuard(broadQueryGuard)
                .build();
    }

    public RowPolicy toRowPolicy(String tenantField) {
        return RowPolicy.builder()
                .tenantScopeField(tenantField)
                .requireScope(requireTenantScope)
                .build();
    }

    /**
     * 以本配置档的默认值开始构建策略
     */
    public Policy.PolicyBuilder newPolicy() {
        return Policy.builder()
                .version(name().toLowerCase(Locale.ROOT))
                .defaultBudget(toBudget())
                .requireTenantScope(requireTenantScope)
                .writesEnabled(writesEnabled);
    }

    public boolean isRequireTenantScope() {
        return requireTenantScope;
    }

    public boolean isWritesEnabled() {
        return writesEnabled;
    }

    public boolean isRequireReasonForWrites() {
        return requireReasonForWrites;
    }
}
