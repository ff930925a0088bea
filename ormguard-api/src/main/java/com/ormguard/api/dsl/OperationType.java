package com.ormguard.api.dsl;

import java.util.Locale;

/**
 * 操作类型
 */
public enum OperationType {
    QUERY(false),
    GET(false),
    AGGREGATE(false),
    CREATE(true),
    UPDATE(true),
    DELETE(true),
    BULK_UPDATE(true);

    private final boolean write;

    OperationType(boolean write) {
        this.write = write;
    }

    public boolean isWrite() {
        return write;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
