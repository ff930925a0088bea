package com.ormguard.api.exception;

/**
 * 稳定的机器可读错误码
 * <p>
 * 错误码字符串属于对外契约，调用方（通常是 LLM 工具调用方）依赖它做自我纠正，
 * 一经发布不可修改。
 * </p>
 */
public enum ErrorCode {

    MODEL_NOT_ALLOWED("MODEL_NOT_ALLOWED"),
    FIELD_NOT_ALLOWED("FIELD_NOT_ALLOWED"),
    RELATION_NOT_ALLOWED("RELATION_NOT_ALLOWED"),
    TENANT_SCOPE_REQUIRED("TENANT_SCOPE_REQUIRED"),
    QUERY_TOO_BROAD("QUERY_TOO_BROAD"),
    QUERY_BUDGET_EXCEEDED("QUERY_BUDGET_EXCEEDED"),
    WRITE_DISABLED("WRITE_DISABLED"),
    WRITE_APPROVAL_REQUIRED("WRITE_APPROVAL_REQUIRED"),
    MAX_AFFECTED_ROWS_EXCEEDED("MAX_AFFECTED_ROWS_EXCEEDED"),
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),

    /**
     * 策略配置本身不合法（发布期错误，而非请求期错误）
     */
    INVALID_POLICY("INVALID_POLICY");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
