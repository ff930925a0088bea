package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 按主键读取单条记录
 */
@Value
@Builder(toBuilder = true)
public class GetRequest implements OperationRequest {

    String model;

    Object id;

    @Singular("selectField")
    List<String> select;

    @Singular("includeClause")
    List<IncludeClause> include;

    @Override
    public OperationType getOperationType() {
        return OperationType.GET;
    }
}
