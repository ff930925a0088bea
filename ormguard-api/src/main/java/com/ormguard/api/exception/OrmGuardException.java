package com.ormguard.api.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 治理异常基类
 * <p>
 * 所有策略拒绝都是终态的：引擎不会部分应用决策，原样重试没有意义。
 * 每个异常携带稳定错误码、可读消息、面向自动纠错的重试提示以及结构化详情。
 * </p>
 */
public class OrmGuardException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> retryHints;
    private final Map<String, Object> details;

    public OrmGuardException(ErrorCode errorCode, String message) {
        this(errorCode, message, List.of(), Map.of());
    }

    public OrmGuardException(ErrorCode errorCode, String message, List<String> retryHints,
            Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.retryHints = retryHints == null ? List.of() : List.copyOf(retryHints);
        // details 允许 null 值（例如 requested 未知），不能用 Map.copyOf
        this.details = details == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public OrmGuardException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryHints = List.of();
        this.details = Map.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 稳定错误码字符串，例如 "FIELD_NOT_ALLOWED"
     */
    public String getCode() {
        return errorCode.getCode();
    }

    public List<String> getRetryHints() {
        return retryHints;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * 序列化为工具调用响应使用的结构
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("code", getCode());
        map.put("message", getMessage());
        map.put("retry_hints", retryHints);
        map.put("details", details);
        return map;
    }

    /**
     * 构造 details 的小工具，保留插入顺序并允许 null 值
     */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
