package com.ormguard.core.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 将审计记录写入日志
 * <p>
 * 默认在公共线程池中异步输出，避免阻塞评估线程。
 * </p>
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    private final boolean logInputs;
    private final Executor executor;

    public LoggingAuditSink() {
        this(false);
    }

    public LoggingAuditSink(boolean logInputs) {
        this(logInputs, null);
    }

    /**
     * @param executor 为 null 时使用 {@link CompletableFuture#runAsync(Runnable)} 的默认线程池
     */
    public LoggingAuditSink(boolean logInputs, Executor executor) {
        this.logInputs = logInputs;
        this.executor = executor;
    }

    @Override
    public void record(AuditRecord record) {
        Runnable task = () -> {
            try {
                write(record);
            } catch (Exception e) {
                log.warn("Audit log failed", e);
            }
        };
        if (executor != null) {
            CompletableFuture.runAsync(task, executor);
        } else {
            CompletableFuture.runAsync(task);
        }
    }

    void write(AuditRecord record) {
        long costMs = record.getDurationNanos() / 1_000_000;
        if (record.getOutcome() == AuditOutcome.ALLOWED) {
            log.info("[Audit] TraceId={}, Tenant={}, User={}, Op={}, Model={}, Cost={}ms, Result=ALLOWED",
                    record.getTraceId(), record.getTenantId(), record.getUserId(), record.getOperation(),
                    record.getModel(), costMs);
        } else {
            log.info("[Audit] TraceId={}, Tenant={}, User={}, Op={}, Model={}, Cost={}ms, Result={} ({})",
                    record.getTraceId(), record.getTenantId(), record.getUserId(), record.getOperation(),
                    record.getModel(), costMs, record.getOutcome(), record.getErrorCode());
        }
        if (logInputs) {
            log.info("[Audit] TraceId={}, Inputs={}, Decisions={}", record.getTraceId(), record.getInputs(),
                    record.getDecisions());
        }
    }
}
