package com.ormguard.api.dsl;

/**
 * 排序条件
 */
public record OrderClause(String field, OrderDirection direction) {

    public static OrderClause asc(String field) {
        return new OrderClause(field, OrderDirection.ASC);
    }

    public static OrderClause desc(String field) {
        return new OrderClause(field, OrderDirection.DESC);
    }
}
