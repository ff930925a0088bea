package com.ormguard.api.exception;

import java.util.List;

/**
 * 单次写操作影响的行数超过上限
 */
public class MaxAffectedRowsExceededException extends OrmGuardException {

    private final String operation;
    private final int maxRows;
    private final Integer affectedRows;

    public MaxAffectedRowsExceededException(String operation, int maxRows, Integer affectedRows) {
        super(ErrorCode.MAX_AFFECTED_ROWS_EXCEEDED,
                message(operation, maxRows, affectedRows),
                List.of("Limit the operation to affect at most " + maxRows + " rows"),
                details("operation", operation, "max_rows", maxRows, "affected_rows", affectedRows));
        this.operation = operation;
        this.maxRows = maxRows;
        this.affectedRows = affectedRows;
    }

    private static String message(String operation, int maxRows, Integer affectedRows) {
        String msg = "Operation '" + operation + "' would exceed max affected rows (limit: " + maxRows;
        if (affectedRows != null) {
            msg += ", would affect: " + affectedRows;
        }
        return msg + ")";
    }

    public String getOperation() {
        return operation;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public Integer getAffectedRows() {
        return affectedRows;
    }
}
