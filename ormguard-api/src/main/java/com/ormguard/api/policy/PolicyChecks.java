package com.ormguard.api.policy;

import com.ormguard.api.exception.InvalidPolicyException;

/**
 * 配置取值范围校验
 */
final class PolicyChecks {

    private PolicyChecks() {
    }

    static void requireRange(String name, long value, long min, long max) {
        if (value < min || value > max) {
            throw new InvalidPolicyException(name, value,
                    String.format("%s must be between %d and %d, got %d", name, min, max, value));
        }
    }

    static void requireAtLeast(String name, long value, long min) {
        if (value < min) {
            throw new InvalidPolicyException(name, value,
                    String.format("%s must be at least %d, got %d", name, min, value));
        }
    }

    static void requireNotBlank(String name, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidPolicyException(name, value, name + " cannot be blank");
        }
    }
}
