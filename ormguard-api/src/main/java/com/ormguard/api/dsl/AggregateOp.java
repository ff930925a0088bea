package com.ormguard.api.dsl;

import com.ormguard.api.exception.ValidationException;

import java.util.Locale;

/**
 * 聚合操作
 */
public enum AggregateOp {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AggregateOp fromValue(String value) {
        if (value != null) {
            for (AggregateOp op : values()) {
                if (op.getValue().equalsIgnoreCase(value.trim())) {
                    return op;
                }
            }
        }
        throw new ValidationException("Operation must be one of: count, sum, avg, min, max", "operation");
    }
}
