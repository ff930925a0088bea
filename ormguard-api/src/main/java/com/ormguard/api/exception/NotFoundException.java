package com.ormguard.api.exception;

import java.util.List;

/**
 * 资源不存在
 * <p>
 * 被作用域过滤掉的记录与真正不存在的记录必须以同一异常报告，
 * 策略不能泄露记录的存在性。
 * </p>
 */
public class NotFoundException extends OrmGuardException {

    private final String model;
    private final Object id;

    public NotFoundException(String model, Object id) {
        super(ErrorCode.NOT_FOUND,
                "Resource not found: " + model + " with id '" + id + "'",
                List.of(),
                details("model", model, "id", id));
        this.model = model;
        this.id = id;
    }

    public String getModel() {
        return model;
    }

    public Object getId() {
        return id;
    }
}
