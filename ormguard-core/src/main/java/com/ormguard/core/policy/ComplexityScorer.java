package com.ormguard.core.policy;

import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.FilterOp;
import com.ormguard.api.dsl.IncludeClause;
import com.ormguard.api.dsl.QueryRequest;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 查询复杂度评分，分数越高越复杂
 */
public class ComplexityScorer {

    public static final String BASE = "base";
    public static final String PER_FIELD = "per_field";
    public static final String PER_FILTER = "per_filter";
    public static final String PER_INCLUDE = "per_include";
    public static final String PER_ORDER = "per_order";
    public static final String STRING_FILTER = "string_filter";
    public static final String IN_FILTER = "in_filter";
    public static final String BETWEEN_FILTER = "between_filter";

    private static final Map<String, Integer> DEFAULT_WEIGHTS = Map.of(
            BASE, 1,
            PER_FIELD, 1,
            PER_FILTER, 2,
            PER_INCLUDE, 10,
            PER_ORDER, 1,
            STRING_FILTER, 3,
            IN_FILTER, 2,
            BETWEEN_FILTER, 2);

    private final Map<String, Integer> weights;

    public ComplexityScorer() {
        this(Map.of());
    }

    public ComplexityScorer(Map<String, Integer> overrides) {
        Map<String, Integer> merged = new HashMap<>(DEFAULT_WEIGHTS);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        this.weights = Collections.unmodifiableMap(merged);
    }

    public int score(QueryRequest request) {
        int score = weight(BASE);
        score += request.getSelect().size() * weight(PER_FIELD);
        for (FilterClause filter : request.getWhere()) {
            score += scoreFilter(filter);
        }
        for (IncludeClause include : request.getInclude()) {
            score += scoreInclude(include);
        }
        score += request.getOrderBy().size() * weight(PER_ORDER);
        return score;
    }

    private int scoreFilter(FilterClause filter) {
        int score = weight(PER_FILTER);
        if (filter.op().isStringMatch()) {
            score += weight(STRING_FILTER);
        }
        if (filter.op() == FilterOp.IN) {
            score += filter.valueCount() * weight(IN_FILTER);
        }
        if (filter.op() == FilterOp.BETWEEN) {
            score += weight(BETWEEN_FILTER);
        }
        return score;
    }

    private int scoreInclude(IncludeClause include) {
        int score = weight(PER_INCLUDE);
        score += include.getSelect().size() * weight(PER_FIELD);
        for (FilterClause filter : include.getWhere()) {
            score += scoreFilter(filter);
        }
        return score;
    }

    private int weight(String key) {
        return weights.getOrDefault(key, 0);
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }
}
