package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 列表查询
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest implements OperationRequest {

    String model;

    @Singular("selectField")
    List<String> select;

    @Singular("whereClause")
    List<FilterClause> where;

    @Singular("orderByClause")
    List<OrderClause> orderBy;

    @Builder.Default
    int take = 25;

    /** 分页游标（不透明） */
    String cursor;

    @Singular("includeClause")
    List<IncludeClause> include;

    @Override
    public OperationType getOperationType() {
        return OperationType.QUERY;
    }
}
