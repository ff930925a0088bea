package com.ormguard.api.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrmGuardException 单元测试")
class OrmGuardExceptionTest {

    @Test
    @DisplayName("toMap 输出稳定结构")
    void shouldSerializeToMap() {
        ModelNotAllowedException ex = new ModelNotAllowedException("Invoice", List.of("Order", "User"));

        Map<String, Object> map = ex.toMap();

        assertEquals("MODEL_NOT_ALLOWED", map.get("code"));
        assertEquals("Model 'Invoice' is not allowed", map.get("message"));
        assertEquals(List.of("Allowed models: Order, User"), map.get("retry_hints"));
        assertEquals("Invoice", ((Map<?, ?>) map.get("details")).get("model"));
        assertEquals(List.of("code", "message", "retry_hints", "details"), List.copyOf(map.keySet()));
    }

    @Test
    @DisplayName("字段提示最多列出 10 个")
    void shouldTruncateFieldHint() {
        List<String> fields = IntStream.range(0, 13).mapToObj(i -> "f" + i).collect(Collectors.toList());

        FieldNotAllowedException ex = new FieldNotAllowedException("secret", "Wide", fields);

        String hint = ex.getRetryHints().get(0);
        assertTrue(hint.startsWith("Allowed fields for Wide: f0, f1"));
        assertTrue(hint.contains("f9"));
        assertFalse(hint.contains("f10,"));
        assertTrue(hint.endsWith("(and 3 more)"));
        assertEquals(fields, ex.getDetails().get("allowed_fields"));
    }

    @Test
    @DisplayName("预算异常携带维度、上限与请求值")
    void shouldDescribeBudget() {
        QueryBudgetExceededException ex = new QueryBudgetExceededException("max_rows", 100, 500);

        assertEquals("QUERY_BUDGET_EXCEEDED", ex.getCode());
        assertEquals("Query exceeds max_rows budget (limit: 100, requested: 500)", ex.getMessage());
        assertEquals(Map.of("budget_type", "max_rows", "limit", 100, "requested", 500), ex.getDetails());
    }

    @Test
    @DisplayName("请求值未知时 details 保留 null")
    void shouldKeepNullDetail() {
        QueryBudgetExceededException ex = new QueryBudgetExceededException("includes_depth", 1, null);

        assertTrue(ex.getDetails().containsKey("requested"));
        assertNull(ex.getDetails().get("requested"));
        assertEquals("Query exceeds includes_depth budget (limit: 1)", ex.getMessage());
    }

    @Test
    @DisplayName("所有治理异常共享基类")
    void shouldShareBaseType() {
        List<OrmGuardException> errors = List.of(
                new TenantScopeRequiredException("Order", "tenant_id"),
                new WriteDisabledException("create", "Order"),
                new ValidationException("bad", "take"),
                new InvalidPolicyException("broken"));

        assertEquals(List.of("TENANT_SCOPE_REQUIRED", "WRITE_DISABLED", "VALIDATION_ERROR", "INVALID_POLICY"),
                errors.stream().map(OrmGuardException::getCode).collect(Collectors.toList()));
    }
}
