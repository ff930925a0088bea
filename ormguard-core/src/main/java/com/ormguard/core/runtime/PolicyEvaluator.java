package com.ormguard.core.runtime;

import com.ormguard.api.context.RunContext;
import com.ormguard.api.decision.PolicyDecision;
import com.ormguard.api.dsl.OperationRequest;
import com.ormguard.api.exception.OrmGuardException;
import com.ormguard.core.audit.AuditOutcome;
import com.ormguard.core.audit.AuditRecord;
import com.ormguard.core.audit.AuditSink;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 受治理的评估入口：取快照 → 评估 → 审计
 * <p>
 * 允许与拒绝都会产生审计记录，异常原样抛给调用方。
 * </p>
 */
@Slf4j
public class PolicyEvaluator {

    private final PolicyStore store;
    private final AuditSink auditSink;
    private final boolean auditEnabled;

    public PolicyEvaluator(PolicyStore store, AuditSink auditSink) {
        this(store, auditSink, true);
    }

    public PolicyEvaluator(PolicyStore store, AuditSink auditSink, boolean auditEnabled) {
        this.store = store;
        this.auditSink = auditSink == null ? AuditSink.noop() : auditSink;
        this.auditEnabled = auditEnabled;
    }

    public PolicyDecision evaluate(OperationRequest request, RunContext ctx) {
        RunContext context = ctx != null ? ctx : RunContext.builder().build();
        String traceId = context.getTraceId() != null ? context.getTraceId() : UUID.randomUUID().toString();
        PolicySnapshot snapshot = store.current();

        long startTime = System.nanoTime();
        PolicyDecision decision = null;
        Throwable error = null;
        try {
            if (log.isDebugEnabled()) {
                log.debug("[Policy] Evaluating {} on {} | Trace={}", request.getOperationType().getValue(),
                        request.getModel(), traceId);
            }
            decision = snapshot.engine().evaluate(request, context);
            return decision;
        } catch (OrmGuardException e) {
            error = e;
            log.warn("⛔ [Policy] Denied {} on {}: {} | Trace={}", request.getOperationType().getValue(),
                    request.getModel(), e.getCode(), traceId);
            throw e;
        } catch (RuntimeException e) {
            error = e;
            log.error("[Policy] Evaluation failed for {} on {} | Trace={}", request.getOperationType().getValue(),
                    request.getModel(), traceId, e);
            throw e;
        } finally {
            if (auditEnabled) {
                long cost = System.nanoTime() - startTime;
                try {
                    auditSink.record(buildRecord(request, context, traceId, snapshot, decision, error, cost));
                } catch (Exception e) {
                    log.error("Audit failed", e);
                }
            }
        }
    }

    private AuditRecord buildRecord(OperationRequest request, RunContext ctx, String traceId,
            PolicySnapshot snapshot, PolicyDecision decision, Throwable error, long cost) {
        AuditRecord.AuditRecordBuilder builder = AuditRecord.builder()
                .traceId(traceId)
                .requestId(ctx.getRequestId())
                .tenantId(ctx.getTenantId())
                .userId(ctx.getUserId())
                .model(request.getModel())
                .operation(request.getOperationType().getValue())
                .policyVersion(snapshot.policy().getVersion())
                .inputs(AuditRecord.sanitizeInputs(request))
                .durationNanos(cost);
        if (decision != null) {
            builder.outcome(AuditOutcome.ALLOWED).decisions(decision.getDecisions());
        } else if (error instanceof OrmGuardException) {
            OrmGuardException e = (OrmGuardException) error;
            builder.outcome(AuditOutcome.DENIED).errorCode(e.getCode()).errorMessage(e.getMessage());
        } else {
            builder.outcome(AuditOutcome.ERROR).errorMessage(error == null ? null : error.getMessage());
        }
        return builder.build();
    }

    public PolicyStore getStore() {
        return store;
    }
}
