package com.ormguard.starter.configuration;

import com.ormguard.api.context.RunContext;
import com.ormguard.api.decision.PolicyDecision;
import com.ormguard.api.dsl.QueryRequest;
import com.ormguard.api.exception.InvalidPolicyException;
import com.ormguard.api.schema.FieldMetadata;
import com.ormguard.api.schema.ModelMetadata;
import com.ormguard.api.schema.SchemaMetadata;
import com.ormguard.core.audit.AuditSink;
import com.ormguard.core.cost.CostBudget;
import com.ormguard.core.cost.QueryCostEstimator;
import com.ormguard.core.dev.PolicyFileWatcher;
import com.ormguard.core.policy.FieldTransformRegistry;
import com.ormguard.core.runtime.PolicyEvaluator;
import com.ormguard.core.runtime.PolicyStore;
import com.ormguard.starter.config.OrmGuardProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrmGuardAutoConfiguration 单元测试")
class OrmGuardAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OrmGuardAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class SchemaConfig {

        @Bean
        SchemaMetadata schemaMetadata() {
            return SchemaMetadata.of(ModelMetadata.builder()
                    .name("Order")
                    .field(FieldMetadata.id("id"))
                    .field(FieldMetadata.of("tenant_id", "varchar"))
                    .field(FieldMetadata.of("ssn", "varchar"))
                    .build());
        }
    }

    private static final AuditSink CUSTOM_SINK = record -> {
    };

    @Configuration(proxyBeanMethods = false)
    static class CustomSinkConfig {

        @Bean
        AuditSink auditSink() {
            return CUSTOM_SINK;
        }
    }

    @Nested
    @DisplayName("默认装配")
    class DefaultTests {

        @Test
        @DisplayName("未配置策略位置时注册核心 Bean 但不发布策略")
        void shouldRegisterCoreBeans() {
            runner.run(context -> {
                assertNotNull(context.getBean(PolicyStore.class));
                assertNotNull(context.getBean(PolicyEvaluator.class));
                assertNotNull(context.getBean(FieldTransformRegistry.class));
                assertNotNull(context.getBean(AuditSink.class));
                assertFalse(context.getBean(PolicyStore.class).isPublished());
                assertTrue(context.getBeansOfType(QueryCostEstimator.class).isEmpty());
                assertTrue(context.getBeansOfType(PolicyFileWatcher.class).isEmpty());
            });
        }

        @Test
        @DisplayName("属性默认值")
        void shouldBindDefaults() {
            runner.run(context -> {
                OrmGuardProperties properties = context.getBean(OrmGuardProperties.class);
                assertTrue(properties.isEnabled());
                assertFalse(properties.isWatch());
                assertEquals(Duration.ofMillis(500), properties.getWatchDebounce());
                assertTrue(properties.getAudit().isEnabled());
                assertFalse(properties.getCost().isEnabled());
            });
        }

        @Test
        @DisplayName("ormguard.enabled=false 时不装配")
        void shouldBackOffWhenDisabled() {
            runner.withPropertyValues("ormguard.enabled=false")
                    .run(context -> assertTrue(context.getBeansOfType(PolicyStore.class).isEmpty()));
        }
    }

    @Nested
    @DisplayName("策略加载")
    class PolicyLoadingTests {

        @Test
        @DisplayName("从 classpath 加载策略并用应用提供的 Schema 评估")
        void shouldLoadPolicyFromClasspath() {
            runner.withUserConfiguration(SchemaConfig.class)
                    .withPropertyValues("ormguard.policy-location=classpath:policies/app-policy.yml")
                    .run(context -> {
                        PolicyStore store = context.getBean(PolicyStore.class);
                        assertEquals("starter-test", store.getPolicy().getVersion());

                        PolicyDecision decision = context.getBean(PolicyEvaluator.class).evaluate(
                                QueryRequest.builder().model("Order").build(), RunContext.forTenant("acme"));
                        assertEquals(List.of("id", "tenant_id"), decision.getAllowedFields());
                    });
        }

        @Test
        @DisplayName("策略文件不存在时启动失败")
        void shouldFailOnMissingPolicy() {
            runner.withPropertyValues("ormguard.policy-location=classpath:policies/missing.yml")
                    .run(context -> {
                        assertNotNull(context.getStartupFailure());
                        assertTrue(hasCause(context.getStartupFailure(), InvalidPolicyException.class));
                    });
        }

        @Test
        @DisplayName("开启 watch 时注册文件监听器")
        void shouldRegisterWatcher(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("policy.yml");
            Files.writeString(file, "version: watched\nmodels:\n  Order: {}\n");

            runner.withPropertyValues("ormguard.policy-location=file:" + file.toAbsolutePath(),
                            "ormguard.watch=true", "ormguard.watch-debounce=50ms")
                    .run(context -> {
                        assertTrue(context.getBean(PolicyFileWatcher.class).isStarted());
                        assertEquals("watched", context.getBean(PolicyStore.class).getPolicy().getVersion());
                    });
        }
    }

    @Nested
    @DisplayName("可选与覆盖")
    class OverrideTests {

        @Test
        @DisplayName("开启成本闸门时注册估算器与预算")
        void shouldRegisterCostGate() {
            runner.withPropertyValues("ormguard.cost.enabled=true", "ormguard.cost.max-total-cost=250")
                    .run(context -> {
                        assertNotNull(context.getBean(QueryCostEstimator.class));
                        assertEquals(250.0, context.getBean(CostBudget.class).getMaxTotalCost());
                    });
        }

        @Test
        @DisplayName("应用自定义的 AuditSink 优先")
        void shouldPreferUserAuditSink() {
            runner.withUserConfiguration(CustomSinkConfig.class)
                    .run(context -> {
                        assertEquals(1, context.getBeansOfType(AuditSink.class).size());
                        assertSame(CUSTOM_SINK, context.getBean(AuditSink.class));
                    });
        }
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }
}
