package com.ormguard.api.decision;

import com.ormguard.api.cost.CostBreakdown;
import com.ormguard.api.dsl.FilterClause;
import com.ormguard.api.dsl.OperationType;
import com.ormguard.api.policy.Budget;
import com.ormguard.api.policy.FieldAction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 策略决策：所有存储后端消费的统一契约
 * <p>
 * 每个请求生成一次，用完即弃。builder 在各校验步骤之间传递，
 * 作为决策轨迹的累加器；decisions 只用于观测，不参与控制流。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PolicyDecision {

    String model;

    OperationType operation;

    /** 允许返回的字段，保持调用方顺序 */
    @Singular
    List<String> allowedFields;

    /** 注入的过滤条件：作用域在前，软删除在后 */
    @Singular
    List<FilterClause> injectedFilters;

    /** 字段 -> MASK / HASH */
    @Singular
    Map<String, FieldAction> redactionRules;

    /** 字段 -> 自定义变换名 */
    @Singular
    Map<String, String> transforms;

    Budget budget;

    /** 查询的实际行数上限 */
    Integer effectiveLimit;

    int statementTimeoutMs;

    /** 仅 CREATE：合并作用域值后的写入数据 */
    @Singular("writeValue")
    Map<String, Object> writeData;

    /** 仅 DELETE：是否软删除 */
    Boolean softDelete;

    CostBreakdown costEstimate;

    @Singular
    List<String> decisions;

    /**
     * 用户过滤条件与注入条件合并，注入条件在后
     */
    public List<FilterClause> combineFilters(List<FilterClause> userFilters) {
        List<FilterClause> all = new ArrayList<>(userFilters == null ? List.of() : userFilters);
        all.addAll(injectedFilters);
        return all;
    }

    public boolean hasRedactions() {
        return !redactionRules.isEmpty();
    }
}
