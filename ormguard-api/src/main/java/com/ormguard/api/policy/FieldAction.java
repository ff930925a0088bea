package com.ormguard.api.policy;

import com.ormguard.api.exception.InvalidPolicyException;

import java.util.Locale;

/**
 * 字段动作
 * <p>
 * 封闭集合，评估处以 switch 穷举处理。
 * </p>
 */
public enum FieldAction {
    /**
     * 字段可见
     */
    ALLOW,

    /**
     * 字段完全隐藏，永不出现在结果中
     */
    DENY,

    /**
     * 部分遮盖（例如 "****1234"），执行由下游完成
     */
    MASK,

    /**
     * 单向哈希，执行由下游完成
     */
    HASH;

    /**
     * 配置/序列化使用的小写名称
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FieldAction fromValue(String value) {
        if (value == null) {
            throw new InvalidPolicyException("action", null, "Field action cannot be null");
        }
        try {
            return FieldAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyException("action", value, "Unknown field action: " + value);
        }
    }
}
