package com.ormguard.core.runtime;

import com.ormguard.api.context.RunContext;
import com.ormguard.api.decision.PolicyDecision;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.QueryRequest;
import com.ormguard.api.exception.FieldNotAllowedException;
import com.ormguard.core.audit.AuditOutcome;
import com.ormguard.core.audit.AuditRecord;
import com.ormguard.core.audit.AuditSink;
import com.ormguard.core.policy.PolicyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PolicyEvaluator 单元测试")
class PolicyEvaluatorTest {

    @Mock
    private AuditSink auditSink;

    private PolicyStore store;
    private PolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new PolicyStore(PolicyFixtures.schema());
        store.publish(PolicyFixtures.policy());
        evaluator = new PolicyEvaluator(store, auditSink);
    }

    @Nested
    @DisplayName("审计")
    class AuditTests {

        @Test
        @DisplayName("允许的请求记录 ALLOWED 与决策轨迹")
        void shouldAuditAllowed() {
            QueryRequest request = QueryRequest.builder().model("Order")
                    .selectField("id")
                    .whereClause(FilterClause.eq("status", "paid"))
                    .build();

            PolicyDecision decision = evaluator.evaluate(request, PolicyFixtures.acme());

            ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
            verify(auditSink).record(captor.capture());
            AuditRecord record = captor.getValue();
            assertEquals(AuditOutcome.ALLOWED, record.getOutcome());
            assertEquals("trace-1", record.getTraceId());
            assertEquals("req-1", record.getRequestId());
            assertEquals("acme", record.getTenantId());
            assertEquals("query", record.getOperation());
            assertEquals("test-1", record.getPolicyVersion());
            assertEquals(decision.getDecisions(), record.getDecisions());
            assertEquals(List.of("status eq"), record.getInputs().get("where"));
        }

        @Test
        @DisplayName("拒绝的请求记录 DENIED 与错误码，并原样抛出")
        void shouldAuditDenied() {
            QueryRequest request = QueryRequest.builder().model("Order").selectField("ssn").build();

            assertThrows(FieldNotAllowedException.class, () -> evaluator.evaluate(request, PolicyFixtures.acme()));

            ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
            verify(auditSink).record(captor.capture());
            assertEquals(AuditOutcome.DENIED, captor.getValue().getOutcome());
            assertEquals("FIELD_NOT_ALLOWED", captor.getValue().getErrorCode());
            assertTrue(captor.getValue().getDecisions().isEmpty());
        }

        @Test
        @DisplayName("审计失败不影响评估结果")
        void shouldIgnoreAuditFailure() {
            doThrow(new RuntimeException("sink down")).when(auditSink).record(any());

            PolicyDecision decision = evaluator.evaluate(
                    QueryRequest.builder().model("Order").build(), PolicyFixtures.acme());

            assertNotNull(decision);
        }

        @Test
        @DisplayName("关闭审计时不调用审计接收方")
        void shouldSkipAuditWhenDisabled() {
            PolicyEvaluator silent = new PolicyEvaluator(store, auditSink, false);

            silent.evaluate(QueryRequest.builder().model("Order").build(), PolicyFixtures.acme());

            verifyNoInteractions(auditSink);
        }
    }

    @Nested
    @DisplayName("上下文")
    class ContextTests {

        @Test
        @DisplayName("缺少 traceId 时生成一个")
        void shouldGenerateTraceId() {
            evaluator.evaluate(QueryRequest.builder().model("Order").build(), RunContext.forTenant("acme"));

            ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
            verify(auditSink).record(captor.capture());
            assertNotNull(captor.getValue().getTraceId());
            assertFalse(captor.getValue().getTraceId().isBlank());
        }

        @Test
        @DisplayName("评估使用调用时的快照")
        void shouldUseLatestPublishedPolicy() {
            store.publish(PolicyFixtures.policy().toBuilder().version("test-2").build());

            evaluator.evaluate(QueryRequest.builder().model("Order").build(), PolicyFixtures.acme());

            ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
            verify(auditSink).record(captor.capture());
            assertEquals("test-2", captor.getValue().getPolicyVersion());
        }
    }
}
