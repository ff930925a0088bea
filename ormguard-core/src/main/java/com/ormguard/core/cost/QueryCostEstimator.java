package com.ormguard.core.cost;

import com.ormguard.api.cost.CostBreakdown;
import com.ormguard.api.cost.TableStats;
import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.dsl.AggregateRequest;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.FilterOp;
import com.ormguard.api.dsl.IncludeClause;
import com.ormguard.api.dsl.QueryRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * 基于表统计与查询结构的成本估算
 * <p>
 * 只读取构造时传入的统计信息，估算是纯函数。
 * </p>
 */
@Slf4j
public class QueryCostEstimator {

    private final Map<String, TableStats> tableStats;
    private final CostWeights weights;

    public QueryCostEstimator() {
        this(Map.of(), CostWeights.defaults());
    }

    public QueryCostEstimator(Map<String, TableStats> tableStats) {
        this(tableStats, CostWeights.defaults());
    }

    public QueryCostEstimator(Map<String, TableStats> tableStats, CostWeights weights) {
        this.tableStats = tableStats == null ? Map.of() : Map.copyOf(tableStats);
        this.weights = weights == null ? CostWeights.defaults() : weights;
    }

    /**
     * 估算查询成本
     */
    public CostBreakdown estimate(QueryRequest request) {
        TableStats stats = statsFor(request.getModel());
        long filteredRows = estimateFilteredRows(request, stats);

        CostBreakdown breakdown = CostBreakdown.builder()
                .scanCost(scanCost(request, stats))
                .filterCost(filterCost(request.getWhere(), stats))
                .joinCost(joinCost(request.getInclude(), filteredRows))
                .sortCost(sortCost(request.getOrderBy().size(), filteredRows))
                .networkCost(networkCost(request, filteredRows))
                .memoryCost(memoryCost(request, filteredRows))
                .detail("estimated_base_rows", stats.getEstimatedRowCount())
                .detail("estimated_filtered_rows", filteredRows)
                .build();

        if (log.isDebugEnabled()) {
            log.debug("[Cost] {} estimated: rows={} total={}", request.getModel(), filteredRows,
                    String.format("%.2f", breakdown.getTotal()));
        }
        return breakdown;
    }

    public CostBreakdown estimateAggregate(AggregateRequest request) {
        return estimateAggregate(request.getModel(), request.getOperation(), request.getField(),
                request.getWhere(), request.getGroupBy());
    }

    /**
     * 估算聚合成本：全表扫描 + 逐条件过滤 + 逐行聚合，分组时按分组列数追加
     */
    public CostBreakdown estimateAggregate(String model, AggregateOp operation, String field,
            List<FilterClause> filters, List<String> groupBy) {
        TableStats stats = statsFor(model);
        long rows = stats.getEstimatedRowCount();

        double filterCost = 0.0;
        if (filters != null) {
            for (FilterClause filter : filters) {
                filterCost += clauseCost(filter);
            }
        }

        double aggregateCost = rows * weights.getAggregatePerRow();
        int groupColumns = groupBy == null ? 0 : groupBy.size();
        if (groupColumns > 0) {
            aggregateCost += rows * groupColumns * weights.getGroupByPerRow();
        }

        return CostBreakdown.builder()
                .scanCost(rows * weights.getFullScanPerRow())
                .filterCost(filterCost)
                .aggregateCost(aggregateCost)
                .detail("operation", operation == null ? null : operation.getValue())
                .detail("field", field)
                .detail("group_by", groupBy == null ? List.of() : List.copyOf(groupBy))
                .detail("estimated_base_rows", rows)
                .build();
    }

    // ==================== 行数与选择度 ====================

    long estimateFilteredRows(QueryRequest request, TableStats stats) {
        long rows = stats.getEstimatedRowCount();
        long take = Math.max(request.getTake(), 0);
        if (request.getWhere().isEmpty()) {
            return Math.max(Math.min(rows, take), 0);
        }
        double selectivity = 1.0;
        for (FilterClause filter : request.getWhere()) {
            selectivity *= selectivity(filter, stats);
        }
        long filtered = (long) (rows * selectivity);
        return Math.max(Math.min(filtered, take), 0);
    }

    /**
     * 单个条件的选择度：主键等值 → 索引列 → 按操作符查表
     */
    double selectivity(FilterClause filter, TableStats stats) {
        String field = filter.field();
        if (field.equals(stats.getPrimaryKey()) && filter.op() == FilterOp.EQ) {
            return 1.0 / Math.max(stats.getEstimatedRowCount(), 1);
        }
        if (stats.isIndexed(field)) {
            if (filter.op() == FilterOp.EQ) {
                return stats.getUniqueSelectivity();
            }
            return stats.getDefaultSelectivity() * 0.5;
        }
        switch (filter.op()) {
            case EQ:
                return 0.1;
            case NE:
                return 0.9;
            case LT:
            case GT:
                return 0.3;
            case LE:
            case GE:
            case BETWEEN:
                return 0.35;
            case IN:
                return Math.min(0.1 * filter.valueCount(), 0.5);
            case NOT_IN:
                return 0.9;
            case CONTAINS:
            case ENDSWITH:
                return 0.1;
            case STARTSWITH:
                return 0.05;
            case IS_NULL:
                return 0.05;
            default:
                return stats.getDefaultSelectivity();
        }
    }

    // ==================== 分项成本 ====================

    private double scanCost(QueryRequest request, TableStats stats) {
        boolean canUseIndex = request.getWhere().stream()
                .anyMatch(f -> stats.isIndexed(f.field()) || f.field().equals(stats.getPrimaryKey()));
        double perRow = canUseIndex ? weights.getIndexScanPerRow() : weights.getFullScanPerRow();
        return stats.getEstimatedRowCount() * perRow;
    }

    private double filterCost(List<FilterClause> filters, TableStats stats) {
        if (filters.isEmpty()) {
            return 0.0;
        }
        double cost = 0.0;
        for (FilterClause filter : filters) {
            cost += clauseCost(filter);
        }
        return cost * stats.getEstimatedRowCount();
    }

    double clauseCost(FilterClause filter) {
        switch (filter.op()) {
            case EQ:
            case NE:
                return weights.getEqualityFilter();
            case LT:
            case LE:
            case GT:
            case GE:
            case BETWEEN:
                return weights.getRangeFilter();
            case CONTAINS:
            case STARTSWITH:
            case ENDSWITH:
                return weights.getStringFilter();
            case IN:
                return weights.getInFilterPerItem() * filter.valueCount();
            default:
                return weights.getComplexFilter();
        }
    }

    private double joinCost(List<IncludeClause> includes, long rows) {
        double cost = 0.0;
        for (IncludeClause include : includes) {
            cost += weights.getIncludeBase();
            cost += rows * weights.getIncludePerRow();
            cost += include.getSelect().size() * weights.getIncludePerField();
        }
        return cost;
    }

    private double sortCost(int orderColumns, long rows) {
        if (orderColumns == 0) {
            return 0.0;
        }
        double rowCost = rows * weights.getSortPerRow();
        if (rows > weights.getInMemorySortThreshold()) {
            rowCost *= weights.getDiskSortMultiplier();
        }
        return rowCost + orderColumns * weights.getSortPerColumn();
    }

    private double networkCost(QueryRequest request, long rows) {
        long returned = Math.max(Math.min(rows, request.getTake()), 0);
        int columns = columnCount(request);
        return returned * weights.getNetworkPerRow() + returned * columns * weights.getNetworkPerColumn();
    }

    private double memoryCost(QueryRequest request, long rows) {
        long returned = Math.max(Math.min(rows, request.getTake()), 0);
        int columns = columnCount(request);
        return returned * weights.getMemoryPerRow() + returned * columns * weights.getMemoryPerColumn();
    }

    private int columnCount(QueryRequest request) {
        return request.getSelect().isEmpty() ? weights.getDefaultColumnCount() : request.getSelect().size();
    }

    private TableStats statsFor(String model) {
        TableStats stats = tableStats.get(model);
        return stats != null ? stats : TableStats.unknown(model);
    }

    public CostWeights getWeights() {
        return weights;
    }
}
