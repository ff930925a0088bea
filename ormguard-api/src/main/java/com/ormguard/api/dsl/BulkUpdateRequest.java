package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 按主键集合批量更新
 */
@Value
@Builder(toBuilder = true)
public class BulkUpdateRequest implements WriteRequest {

    String model;

    @Singular
    List<Object> ids;

    @Singular("value")
    Map<String, Object> data;

    String reason;

    String approvalId;

    @Override
    public OperationType getOperationType() {
        return OperationType.BULK_UPDATE;
    }
}
