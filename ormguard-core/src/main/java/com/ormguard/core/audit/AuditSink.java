package com.ormguard.core.audit;

/**
 * 审计记录接收方
 * <p>
 * 持久化与联邦由实现方负责。实现必须是线程安全的，且不应阻塞调用线程过久。
 * </p>
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditRecord record);

    /**
     * 丢弃所有记录
     */
    static AuditSink noop() {
        return record -> {
        };
    }
}
