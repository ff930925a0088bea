package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class CreateRequest implements WriteRequest {

    String model;

    @Singular("value")
    Map<String, Object> data;

    String reason;

    String approvalId;

    @Singular("returnField")
    List<String> returnFields;

    @Override
    public OperationType getOperationType() {
        return OperationType.CREATE;
    }
}
