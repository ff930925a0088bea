package com.ormguard.api.exception;

import java.util.List;

/**
 * 写操作被全局或模型级写策略关闭
 */
public class WriteDisabledException extends OrmGuardException {

    private final String operation;
    private final String model;

    public WriteDisabledException(String operation, String model) {
        super(ErrorCode.WRITE_DISABLED,
                "Write operation '" + operation + "' is disabled for model '" + model + "'",
                List.of("Write operations require explicit policy configuration"),
                details("operation", operation, "model", model));
        this.operation = operation;
        this.model = model;
    }

    public String getOperation() {
        return operation;
    }

    public String getModel() {
        return model;
    }
}
