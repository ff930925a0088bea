package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class AggregateRequest implements OperationRequest {

    String model;

    @Builder.Default
    AggregateOp operation = AggregateOp.COUNT;

    /** COUNT 可为空 */
    String field;

    @Singular("whereClause")
    List<FilterClause> where;

    @Singular("groupByField")
    List<String> groupBy;

    @Override
    public OperationType getOperationType() {
        return OperationType.AGGREGATE;
    }
}
