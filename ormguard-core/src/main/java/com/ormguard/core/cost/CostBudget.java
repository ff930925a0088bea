package com.ormguard.core.cost;

import com.ormguard.api.cost.CostBreakdown;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 以估算成本表达的预算
 * <p>
 * 总成本上限必填，各分类上限可选（null 表示不限制）。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class CostBudget {

    @Builder.Default
    double maxTotalCost = 1000.0;

    Double maxScanCost;
    Double maxFilterCost;
    Double maxJoinCost;
    Double maxSortCost;
    Double maxAggregateCost;
    Double maxNetworkCost;
    Double maxMemoryCost;

    /**
     * 超出的单项上限
     *
     * @param category 预算维度，例如 total_cost / scan_cost
     */
    public record Exceeded(String category, double limit, double actual) {

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%s: %.1f > %.1f", category, actual, limit);
        }
    }

    public static CostBudget defaults() {
        return CostBudget.builder().build();
    }

    /**
     * 返回所有超出的上限描述，空列表表示在预算内
     */
    public List<String> check(CostBreakdown breakdown) {
        return exceeded(breakdown).stream().map(Exceeded::toString).collect(Collectors.toList());
    }

    public List<Exceeded> exceeded(CostBreakdown breakdown) {
        List<Exceeded> result = new ArrayList<>();
        if (breakdown.getTotal() > maxTotalCost) {
            result.add(new Exceeded("total_cost", maxTotalCost, breakdown.getTotal()));
        }
        addIfExceeded(result, "scan_cost", maxScanCost, breakdown.getScanCost());
        addIfExceeded(result, "filter_cost", maxFilterCost, breakdown.getFilterCost());
        addIfExceeded(result, "join_cost", maxJoinCost, breakdown.getJoinCost());
        addIfExceeded(result, "sort_cost", maxSortCost, breakdown.getSortCost());
        addIfExceeded(result, "aggregate_cost", maxAggregateCost, breakdown.getAggregateCost());
        addIfExceeded(result, "network_cost", maxNetworkCost, breakdown.getNetworkCost());
        addIfExceeded(result, "memory_cost", maxMemoryCost, breakdown.getMemoryCost());
        return result;
    }

    public Optional<Exceeded> firstExceeded(CostBreakdown breakdown) {
        return exceeded(breakdown).stream().findFirst();
    }

    public boolean isWithinBudget(CostBreakdown breakdown) {
        return exceeded(breakdown).isEmpty();
    }

    private static void addIfExceeded(List<Exceeded> result, String category, Double limit, double actual) {
        if (limit != null && actual > limit) {
            result.add(new Exceeded(category, limit, actual));
        }
    }
}
