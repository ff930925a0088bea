package com.ormguard.api.exception;

import java.util.List;

/**
 * 查询超出预算（行数、字段数、关系深度、复杂度或估算成本）
 */
public class QueryBudgetExceededException extends OrmGuardException {

    private final String budgetType;
    private final Number limit;
    private final Number requested;

    public QueryBudgetExceededException(String budgetType, Number limit, Number requested) {
        super(ErrorCode.QUERY_BUDGET_EXCEEDED,
                message(budgetType, limit, requested),
                List.of("Reduce " + budgetType + " to at most " + limit),
                details("budget_type", budgetType, "limit", limit, "requested", requested));
        this.budgetType = budgetType;
        this.limit = limit;
        this.requested = requested;
    }

    private static String message(String budgetType, Number limit, Number requested) {
        StringBuilder sb = new StringBuilder("Query exceeds ")
                .append(budgetType).append(" budget (limit: ").append(limit);
        if (requested != null) {
            sb.append(", requested: ").append(requested);
        }
        return sb.append(')').toString();
    }

    /**
     * 超限维度，例如 max_rows / select_fields / includes_depth
     */
    public String getBudgetType() {
        return budgetType;
    }

    public Number getLimit() {
        return limit;
    }

    public Number getRequested() {
        return requested;
    }
}
