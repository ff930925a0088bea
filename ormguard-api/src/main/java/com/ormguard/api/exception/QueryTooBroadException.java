package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 宽查询防护：过滤条件不足
 */
public class QueryTooBroadException extends OrmGuardException {

    private final String model;

    public QueryTooBroadException(String model, int minFilters, int actualFilters) {
        super(ErrorCode.QUERY_TOO_BROAD,
                "Query on model '" + model + "' is too broad",
                hints(minFilters),
                details("model", model, "min_filters", minFilters, "filters", actualFilters));
        this.model = model;
    }

    private static List<String> hints(int minFilters) {
        List<String> hints = new ArrayList<>();
        hints.add("Add more specific filters to narrow down the query");
        hints.add("Add at least " + minFilters + " filter(s) to narrow the query");
        return hints;
    }

    public String getModel() {
        return model;
    }
}
