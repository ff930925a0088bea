package com.ormguard.api.dsl;

import com.ormguard.api.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("请求 DSL 单元测试")
class FilterOpTest {

    @Test
    @DisplayName("操作符解析支持别名且不区分大小写")
    void shouldParseAliases() {
        assertEquals(FilterOp.LE, FilterOp.fromValue("lte"));
        assertEquals(FilterOp.GE, FilterOp.fromValue("GTE"));
        assertEquals(FilterOp.NOT_IN, FilterOp.fromValue("nin"));
        assertEquals(FilterOp.IS_NULL, FilterOp.fromValue("isnull"));
        assertEquals(FilterOp.NE, FilterOp.fromValue(" neq "));
        assertEquals(FilterOp.BETWEEN, FilterOp.fromValue("between"));
    }

    @Test
    @DisplayName("未知操作符报告 op 字段")
    void shouldRejectUnknownOperator() {
        ValidationException ex = assertThrows(ValidationException.class, () -> FilterOp.fromValue("like"));

        assertEquals("op", ex.getField());
        assertThrows(ValidationException.class, () -> FilterOp.fromValue(null));
    }

    @Test
    @DisplayName("范围与字符串匹配分类")
    void shouldClassifyOperators() {
        assertTrue(FilterOp.BETWEEN.isRange());
        assertFalse(FilterOp.EQ.isRange());
        assertTrue(FilterOp.STARTSWITH.isStringMatch());
        assertFalse(FilterOp.IN.isStringMatch());
    }

    @Test
    @DisplayName("IN 条件按值个数计数")
    void shouldCountValues() {
        assertEquals(3, FilterClause.in("id", List.of(1, 2, 3)).valueCount());
        assertEquals(1, FilterClause.eq("id", 1).valueCount());
        assertEquals("status eq paid", FilterClause.eq("status", "paid").toString());
    }

    @Test
    @DisplayName("查询默认 take 为 25，聚合默认 COUNT")
    void shouldApplyRequestDefaults() {
        assertEquals(25, QueryRequest.builder().model("Order").build().getTake());
        assertEquals(AggregateOp.COUNT, AggregateRequest.builder().model("Order").build().getOperation());
        assertEquals(OperationType.BULK_UPDATE, BulkUpdateRequest.builder().model("Order").build().getOperationType());
        assertTrue(OperationType.DELETE.isWrite());
        assertFalse(OperationType.AGGREGATE.isWrite());
        assertEquals("sum", AggregateOp.SUM.getValue());
    }
}
