package com.ormguard.core.cost;

import com.ormguard.api.cost.CostBreakdown;
import com.ormguard.api.cost.TableStats;
import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.dsl.AggregateRequest;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.FilterOp;
import com.ormguard.api.dsl.IncludeClause;
import com.ormguard.api.dsl.OrderClause;
import com.ormguard.api.dsl.QueryRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryCostEstimator 单元测试")
class QueryCostEstimatorTest {

    private TableStats users;
    private QueryCostEstimator estimator;

    @BeforeEach
    void setUp() {
        users = TableStats.builder()
                .tableName("users")
                .estimatedRowCount(10_000)
                .indexedColumn("email")
                .build();
        estimator = new QueryCostEstimator(Map.of("User", users));
    }

    @Nested
    @DisplayName("行数估算")
    class RowEstimationTests {

        @Test
        @DisplayName("索引列等值过滤使用唯一选择度，结果受 take 约束")
        void shouldUseIndexSelectivity() {
            QueryRequest filtered = QueryRequest.builder().model("User")
                    .whereClause(FilterClause.eq("email", "a@b.c")).build();
            QueryRequest unfiltered = QueryRequest.builder().model("User").build();

            CostBreakdown withFilter = estimator.estimate(filtered);
            CostBreakdown withoutFilter = estimator.estimate(unfiltered);

            assertEquals(10L, withFilter.getDetails().get("estimated_filtered_rows"));
            assertEquals(25L, withoutFilter.getDetails().get("estimated_filtered_rows"));
            assertEquals(10_000L, withFilter.getDetails().get("estimated_base_rows"));
            assertTrue(withFilter.getScanCost() < withoutFilter.getScanCost());
        }

        @Test
        @DisplayName("主键等值过滤只命中一行")
        void shouldEstimateSingleRowForPrimaryKey() {
            QueryRequest request = QueryRequest.builder().model("User")
                    .whereClause(FilterClause.eq("id", 42)).build();

            assertEquals(1L, estimator.estimateFilteredRows(request, users));
        }

        @Test
        @DisplayName("非索引列按操作符查表")
        void shouldUseOperatorSelectivity() {
            assertEquals(0.1, estimator.selectivity(FilterClause.eq("name", "x"), users), 1e-9);
            assertEquals(0.35, estimator.selectivity(FilterClause.of("age", FilterOp.GE, 18), users), 1e-9);
            assertEquals(0.3, estimator.selectivity(FilterClause.in("name", List.of(1, 2, 3)), users), 1e-9);
            assertEquals(0.5, estimator.selectivity(
                    FilterClause.in("name", List.of(1, 2, 3, 4, 5, 6, 7)), users), 1e-9);
            assertEquals(0.05, estimator.selectivity(FilterClause.of("email", FilterOp.GT, "a"), users), 1e-9);
            assertEquals(0.35, estimator.selectivity(
                    FilterClause.of("age", FilterOp.BETWEEN, List.of(18, 30)), users), 1e-9);
        }

        @Test
        @DisplayName("非正 take 不产生负行数与负成本")
        void shouldClampRowsForNonPositiveTake() {
            QueryRequest request = QueryRequest.builder().model("User").take(-1_000_000)
                    .includeClause(IncludeClause.of("orders")).build();

            CostBreakdown cost = estimator.estimate(request);

            assertEquals(0L, estimator.estimateFilteredRows(request, users));
            assertTrue(cost.getJoinCost() >= 0);
            assertTrue(cost.getNetworkCost() >= 0);
            assertTrue(cost.getMemoryCost() >= 0);
            assertTrue(cost.getTotal() >= 0);
        }

        @Test
        @DisplayName("未知表使用默认统计信息")
        void shouldFallBackToUnknownStats() {
            CostBreakdown cost = new QueryCostEstimator().estimate(QueryRequest.builder().model("Ghost").build());

            assertEquals(1000L, cost.getDetails().get("estimated_base_rows"));
        }
    }

    @Nested
    @DisplayName("分项成本")
    class ComponentTests {

        @Test
        @DisplayName("增加关系展开不会降低关联成本与总成本")
        void shouldIncreaseCostWithIncludes() {
            QueryRequest base = QueryRequest.builder().model("User")
                    .whereClause(FilterClause.eq("status", "active")).build();
            QueryRequest oneInclude = base.toBuilder().includeClause(IncludeClause.of("orders")).build();
            QueryRequest twoIncludes = oneInclude.toBuilder()
                    .includeClause(IncludeClause.builder().relation("profile").selectField("bio").build())
                    .build();

            CostBreakdown c0 = estimator.estimate(base);
            CostBreakdown c1 = estimator.estimate(oneInclude);
            CostBreakdown c2 = estimator.estimate(twoIncludes);

            assertEquals(0.0, c0.getJoinCost());
            assertTrue(c1.getJoinCost() > c0.getJoinCost());
            assertTrue(c2.getJoinCost() > c1.getJoinCost());
            assertTrue(c2.getTotal() > c1.getTotal());
            assertTrue(c1.getTotal() > c0.getTotal());
        }

        @Test
        @DisplayName("过滤成本按条件累加后乘以行数")
        void shouldScaleFilterCostByRows() {
            QueryRequest request = QueryRequest.builder().model("User")
                    .whereClause(FilterClause.eq("status", "active"))
                    .whereClause(FilterClause.of("name", FilterOp.CONTAINS, "bob"))
                    .build();

            assertEquals((0.1 + 0.5) * 10_000, estimator.estimate(request).getFilterCost(), 1e-6);
        }

        @Test
        @DisplayName("没有排序时排序成本为 0，有排序时计入列数")
        void shouldCostSorting() {
            QueryRequest unsorted = QueryRequest.builder().model("User").build();
            QueryRequest sorted = unsorted.toBuilder().orderByClause(OrderClause.asc("name")).build();

            assertEquals(0.0, estimator.estimate(unsorted).getSortCost());
            assertEquals(25 * 0.1 + 1.0, estimator.estimate(sorted).getSortCost(), 1e-9);
        }

        @Test
        @DisplayName("分组聚合比不分组更昂贵")
        void shouldCostGroupBy() {
            AggregateRequest plain = AggregateRequest.builder().model("User").operation(AggregateOp.COUNT).build();
            AggregateRequest grouped = plain.toBuilder().groupByField("status").build();

            CostBreakdown p = estimator.estimateAggregate(plain);
            CostBreakdown g = estimator.estimateAggregate(grouped);

            assertEquals(10_000 * 0.05, p.getAggregateCost(), 1e-9);
            assertTrue(g.getAggregateCost() > p.getAggregateCost());
            assertEquals("count", g.getDetails().get("operation"));
        }

        @Test
        @DisplayName("toMap 保留两位小数并包含总计")
        void shouldRoundInMap() {
            CostBreakdown cost = CostBreakdown.builder().scanCost(1.234).filterCost(2.0).build();

            Map<String, Object> map = cost.toMap();
            assertEquals(1.23, map.get("scan_cost"));
            assertEquals(3.23, map.get("total"));
        }
    }
}
