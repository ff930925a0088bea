package com.ormguard.api.exception;

import java.util.List;

/**
 * 策略配置不合法
 * 在策略发布/加载时抛出，而不是在请求评估时。
 */
public class InvalidPolicyException extends OrmGuardException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidPolicyException(String message) {
        this(null, null, message);
    }

    public InvalidPolicyException(String paramName, Object invalidValue, String message) {
        super(ErrorCode.INVALID_POLICY, message, List.of(),
                details("param", paramName, "value", invalidValue));
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public InvalidPolicyException(String message, Throwable cause) {
        super(ErrorCode.INVALID_POLICY, message, cause);
        this.paramName = null;
        this.invalidValue = null;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }
}
