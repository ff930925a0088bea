package com.ormguard.api.policy;

import com.ormguard.api.exception.InvalidPolicyException;
import lombok.Builder;
import lombok.Value;

/**
 * 单个字段的策略
 */
@Value
@Builder(toBuilder = true)
public class FieldPolicy {

    public static final FieldPolicy ALLOW = FieldPolicy.of(FieldAction.ALLOW);
    public static final FieldPolicy DENY = FieldPolicy.of(FieldAction.DENY);
    public static final FieldPolicy MASK = FieldPolicy.of(FieldAction.MASK);
    public static final FieldPolicy HASH = FieldPolicy.of(FieldAction.HASH);

    @Builder.Default
    FieldAction action = FieldAction.ALLOW;

    /** 遮盖模板，例如 "****{last4}" */
    String maskPattern;

    /**
     * 本地注册的自定义变换名称。
     * 只保存名称，使策略文档可序列化；名称在引擎构建时校验。
     */
    String transform;

    public static FieldPolicy of(FieldAction action) {
        return FieldPolicy.builder().action(action).build();
    }

    public static FieldPolicy masked(String maskPattern) {
        return FieldPolicy.builder().action(FieldAction.MASK).maskPattern(maskPattern).build();
    }

    public boolean isDenied() {
        return action == FieldAction.DENY;
    }

    public boolean hasTransform() {
        return transform != null && !transform.isBlank();
    }

    void validate(String path) {
        if (action == null) {
            throw new InvalidPolicyException(path + ".action", null, "Field action cannot be null");
        }
    }
}
