package com.ormguard.api.exception;

import java.util.List;
import java.util.Map;

/**
 * 请求参数校验失败
 */
public class ValidationException extends OrmGuardException {

    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(ErrorCode.VALIDATION_ERROR, message, List.of(),
                field == null ? Map.of() : details("field", field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
