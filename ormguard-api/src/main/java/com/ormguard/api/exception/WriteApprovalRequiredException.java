package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 写操作需要人工审批后才能执行
 */
public class WriteApprovalRequiredException extends OrmGuardException {

    private final String operation;
    private final String model;

    public WriteApprovalRequiredException(String operation, String model, String approvalId) {
        super(ErrorCode.WRITE_APPROVAL_REQUIRED,
                "Write operation '" + operation + "' on model '" + model + "' requires approval",
                hints(approvalId),
                details("operation", operation, "model", model, "approval_id", approvalId));
        this.operation = operation;
        this.model = model;
    }

    private static List<String> hints(String approvalId) {
        List<String> hints = new ArrayList<>();
        hints.add("This write operation requires human approval before it can be executed");
        if (approvalId != null) {
            hints.add("Approval ID: " + approvalId);
        }
        return hints;
    }

    public String getOperation() {
        return operation;
    }

    public String getModel() {
        return model;
    }
}
