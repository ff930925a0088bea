package com.ormguard.api.dsl;

/**
 * 写请求公共视图
 */
public interface WriteRequest extends OperationRequest {

    /** 变更原因（审计用） */
    String getReason();

    /** 审批单号 */
    String getApprovalId();
}
