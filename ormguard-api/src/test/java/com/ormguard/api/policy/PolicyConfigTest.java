package com.ormguard.api.policy;

import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.exception.InvalidPolicyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("策略配置单元测试")
class PolicyConfigTest {

    @Nested
    @DisplayName("默认值")
    class DefaultTests {

        @Test
        @DisplayName("策略默认要求租户隔离且关闭写操作")
        void shouldHaveSafeDefaults() {
            Policy policy = Policy.builder().build();

            assertTrue(policy.isRequireTenantScope());
            assertFalse(policy.isWritesEnabled());
            assertEquals(Budget.defaults(), policy.getDefaultBudget());
            assertFalse(policy.getDefaultRowPolicy().hasTenantScope());
        }

        @Test
        @DisplayName("模型默认可读不可写，写策略全部关闭")
        void shouldDefaultModelReadOnly() {
            ModelPolicy model = ModelPolicy.builder().build();

            assertTrue(model.isAllowed());
            assertTrue(model.isReadable());
            assertFalse(model.isWritable());
            assertFalse(model.getWritePolicy().isEnabled());
            assertTrue(model.getWritePolicy().isRequireReason());
            assertTrue(model.isAggregationAllowed(AggregateOp.AVG));
        }

        @Test
        @DisplayName("预算默认值")
        void shouldDefaultBudget() {
            Budget budget = Budget.defaults();

            assertEquals(100, budget.getMaxRows());
            assertEquals(1, budget.getMaxIncludesDepth());
            assertEquals(40, budget.getMaxSelectFields());
            assertEquals(2000, budget.getStatementTimeoutMs());
            assertEquals(25, budget.effectiveLimit(25));
            assertEquals(100, budget.effectiveLimit(null));
        }
    }

    @Nested
    @DisplayName("回退与查询")
    class LookupTests {

        private final Budget custom = Budget.builder().maxRows(10).build();
        private final Policy policy = Policy.builder()
                .model("Zeta", ModelPolicy.builder().budget(custom).build())
                .model("Alpha", ModelPolicy.builder().writable(true).build())
                .model("Hidden", ModelPolicy.builder().allowed(false).build())
                .defaultRowPolicy(RowPolicy.tenantScoped("tenant_id"))
                .build();

        @Test
        @DisplayName("模型未覆盖时回退到默认预算与行级策略")
        void shouldFallBackToDefaults() {
            assertSame(custom, policy.getBudget("Zeta"));
            assertEquals(Budget.defaults(), policy.getBudget("Alpha"));
            assertEquals("tenant_id", policy.getRowPolicy("Alpha").getTenantScopeField());
        }

        @Test
        @DisplayName("模型列表按名称排序且排除未允许的模型")
        void shouldListSortedModels() {
            assertEquals(List.of("Alpha", "Zeta"), policy.listAllowedModels());
            assertEquals(List.of("Alpha"), policy.listWritableModels());
            assertFalse(policy.isModelAllowed("Hidden"));
            assertFalse(policy.isModelAllowed("Missing"));
            assertNull(policy.getModelPolicy(null));
        }

        @Test
        @DisplayName("toBuilder 生成新实例，原策略不变")
        void shouldCopyOnWrite() {
            Policy changed = policy.toBuilder().writesEnabled(true).build();

            assertFalse(policy.isWritesEnabled());
            assertTrue(changed.isWritesEnabled());
            assertEquals(policy.getModels(), changed.getModels());
        }

        @Test
        @DisplayName("集合不可修改")
        void shouldExposeUnmodifiableCollections() {
            assertThrows(UnsupportedOperationException.class,
                    () -> policy.getModels().put("Other", ModelPolicy.builder().build()));
            assertThrows(UnsupportedOperationException.class, () -> policy.getGlobalDenyPatterns().add("*x*"));
        }
    }

    @Nested
    @DisplayName("校验")
    class ValidationTests {

        @Test
        @DisplayName("超出范围的预算报告参数路径")
        void shouldRejectOutOfRangeBudget() {
            Policy policy = Policy.builder()
                    .model("Order", ModelPolicy.builder().budget(Budget.builder().maxRows(20000).build()).build())
                    .build();

            InvalidPolicyException ex = assertThrows(InvalidPolicyException.class, policy::validate);
            assertEquals("models.Order.budget.maxRows", ex.getParamName());
            assertEquals(20000L, ex.getInvalidValue());
        }

        @Test
        @DisplayName("maxAffectedRows 与关系深度有取值范围")
        void shouldRejectOutOfRangeWriteAndRelation() {
            Policy badWrite = Policy.builder()
                    .model("Order", ModelPolicy.builder()
                            .writePolicy(WritePolicy.builder().maxAffectedRows(0).build()).build())
                    .build();
            Policy badRelation = Policy.builder()
                    .model("Order", ModelPolicy.builder()
                            .relation("items", RelationPolicy.builder().maxDepth(9).build()).build())
                    .build();

            assertThrows(InvalidPolicyException.class, badWrite::validate);
            assertThrows(InvalidPolicyException.class, badRelation::validate);
        }

        @Test
        @DisplayName("合法策略通过校验")
        void shouldAcceptValidPolicy() {
            assertDoesNotThrow(() -> PolicyProfile.PROD.newPolicy()
                    .model("Order", ModelPolicy.builder().build()).build().validate());
        }
    }

    @Nested
    @DisplayName("配置档与字段动作")
    class ProfileTests {

        @Test
        @DisplayName("DEV 放宽限制并开启写操作")
        void shouldRelaxDevProfile() {
            Policy dev = PolicyProfile.DEV.newPolicy().build();

            assertEquals("dev", dev.getVersion());
            assertFalse(dev.isRequireTenantScope());
            assertTrue(dev.isWritesEnabled());
            assertFalse(dev.getDefaultBudget().isBroadQueryGuard());
            assertEquals(1000, dev.getDefaultBudget().getMaxRows());
        }

        @Test
        @DisplayName("PROD 最严格")
        void shouldKeepProdStrict() {
            Policy prod = PolicyProfile.PROD.newPolicy().build();

            assertTrue(prod.isRequireTenantScope());
            assertFalse(prod.isWritesEnabled());
            assertTrue(PolicyProfile.PROD.toRowPolicy("tenant_id").isRequireScope());
        }

        @Test
        @DisplayName("字段动作解析不区分大小写")
        void shouldParseFieldAction() {
            assertEquals(FieldAction.MASK, FieldAction.fromValue(" Mask "));
            assertThrows(InvalidPolicyException.class, () -> FieldAction.fromValue("hide"));
            assertThrows(InvalidPolicyException.class, () -> FieldAction.fromValue(null));
        }
    }
}
