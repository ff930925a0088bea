package com.ormguard.core.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoggingAuditSink 单元测试")
class LoggingAuditSinkTest {

    private static AuditRecord record(AuditOutcome outcome) {
        return AuditRecord.builder()
                .traceId("t-1")
                .model("Order")
                .operation("query")
                .outcome(outcome)
                .errorCode(outcome == AuditOutcome.DENIED ? "FIELD_NOT_ALLOWED" : null)
                .input("model", "Order")
                .build();
    }

    @Test
    @DisplayName("记录在给定执行器上输出")
    void shouldWriteOnExecutor() {
        AtomicInteger submitted = new AtomicInteger();
        LoggingAuditSink sink = new LoggingAuditSink(true, task -> {
            submitted.incrementAndGet();
            task.run();
        });

        assertDoesNotThrow(() -> sink.record(record(AuditOutcome.DENIED)));
        assertEquals(1, submitted.get());
    }

    @Test
    @DisplayName("允许与拒绝记录都可以直接输出")
    void shouldWriteBothOutcomes() {
        LoggingAuditSink sink = new LoggingAuditSink(false);

        assertDoesNotThrow(() -> sink.write(record(AuditOutcome.DENIED)));
        assertDoesNotThrow(() -> sink.write(record(AuditOutcome.ALLOWED)));
    }
}
