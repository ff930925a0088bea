package com.ormguard.api.dsl;

/**
 * 所有请求的公共视图，按 {@link OperationType} 区分
 */
public interface OperationRequest {

    String getModel();

    OperationType getOperationType();
}
