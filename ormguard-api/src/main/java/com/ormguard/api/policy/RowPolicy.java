package com.ormguard.api.policy;

import lombok.Builder;
import lombok.Value;

/**
 * 行级安全策略：描述如何根据执行上下文过滤行
 */
@Value
@Builder(toBuilder = true)
public class RowPolicy {

    /** 租户隔离字段，例如 "tenant_id" */
    String tenantScopeField;

    /** 归属隔离字段，例如 "owner_id" */
    String ownershipScopeField;

    /** 是否强制隔离（与 Policy.requireTenantScope 同时为 true 时生效） */
    @Builder.Default
    boolean requireScope = true;

    /** 软删除字段，例如 "deleted_at" */
    String softDeleteField;

    @Builder.Default
    boolean includeSoftDeleted = false;

    public static RowPolicy none() {
        return RowPolicy.builder().build();
    }

    public static RowPolicy tenantScoped(String tenantScopeField) {
        return RowPolicy.builder().tenantScopeField(tenantScopeField).build();
    }

    public boolean hasTenantScope() {
        return tenantScopeField != null && !tenantScopeField.isBlank();
    }

    public boolean hasOwnershipScope() {
        return ownershipScopeField != null && !ownershipScopeField.isBlank();
    }

    public boolean excludesSoftDeleted() {
        return softDeleteField != null && !softDeleteField.isBlank() && !includeSoftDeleted;
    }
}
