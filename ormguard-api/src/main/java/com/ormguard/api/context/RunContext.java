package com.ormguard.api.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 单次调用的上下文：身份与关联 ID
 * <p>
 * 引擎只读取这里声明的字段，不依赖任何环境状态。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RunContext {

    @Builder.Default
    Principal principal = Principal.anonymous();

    String requestId;

    String traceId;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static RunContext of(Principal principal) {
        return RunContext.builder().principal(principal).build();
    }

    public static RunContext forTenant(String tenantId) {
        return of(Principal.of(tenantId, null));
    }

    public String getTenantId() {
        return principal == null ? null : principal.getTenantId();
    }

    public String getUserId() {
        return principal == null ? null : principal.getUserId();
    }
}
