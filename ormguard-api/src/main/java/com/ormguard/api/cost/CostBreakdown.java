package com.ormguard.api.cost;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 查询成本分项
 */
@Value
@Builder(toBuilder = true)
public class CostBreakdown {

    double scanCost;
    double filterCost;
    double joinCost;
    double sortCost;
    double aggregateCost;
    double networkCost;
    double memoryCost;

    /** 附加信息，例如 estimated_base_rows / estimated_filtered_rows */
    @Singular("detail")
    Map<String, Object> details;

    public double getTotal() {
        return scanCost + filterCost + joinCost + sortCost + aggregateCost + networkCost + memoryCost;
    }

    /**
     * 按类别名取值，类别名与 toMap 的键一致（不含 _cost 后缀）
     */
    public double get(String category) {
        switch (category) {
            case "scan":
                return scanCost;
            case "filter":
                return filterCost;
            case "join":
                return joinCost;
            case "sort":
                return sortCost;
            case "aggregate":
                return aggregateCost;
            case "network":
                return networkCost;
            case "memory":
                return memoryCost;
            case "total":
                return getTotal();
            default:
                throw new IllegalArgumentException("Unknown cost category: " + category);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("scan_cost", round(scanCost));
        map.put("filter_cost", round(filterCost));
        map.put("join_cost", round(joinCost));
        map.put("sort_cost", round(sortCost));
        map.put("aggregate_cost", round(aggregateCost));
        map.put("network_cost", round(networkCost));
        map.put("memory_cost", round(memoryCost));
        map.put("total", round(getTotal()));
        map.put("details", details);
        return map;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
