package com.ormguard.api.dsl;

import java.util.Collection;
import java.util.List;

/**
 * 单个过滤条件
 *
 * @param field 字段名
 * @param op    操作符
 * @param value 比较值；IN/NOT_IN 为集合，BETWEEN 为二元列表，IS_NULL 可为 null
 */
public record FilterClause(String field, FilterOp op, Object value) {

    public static FilterClause of(String field, FilterOp op, Object value) {
        return new FilterClause(field, op, value);
    }

    public static FilterClause eq(String field, Object value) {
        return new FilterClause(field, FilterOp.EQ, value);
    }

    public static FilterClause isNull(String field) {
        return new FilterClause(field, FilterOp.IS_NULL, Boolean.TRUE);
    }

    public static FilterClause in(String field, Collection<?> values) {
        return new FilterClause(field, FilterOp.IN, List.copyOf(values));
    }

    /**
     * IN/NOT_IN 的值个数，其他操作符返回 1
     */
    public int valueCount() {
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        return 1;
    }

    @Override
    public String toString() {
        return field + " " + op.getValue() + " " + value;
    }
}
