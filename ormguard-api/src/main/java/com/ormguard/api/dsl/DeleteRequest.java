package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DeleteRequest implements WriteRequest {

    String model;

    Object id;

    String reason;

    String approvalId;

    /** 请求物理删除；策略要求软删除时会被拒绝 */
    boolean hard;

    @Override
    public OperationType getOperationType() {
        return OperationType.DELETE;
    }
}
