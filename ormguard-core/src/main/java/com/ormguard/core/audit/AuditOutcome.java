package com.ormguard.core.audit;

public enum AuditOutcome {
    ALLOWED,
    DENIED,
    ERROR
}
