package com.ormguard.api.policy;

import com.ormguard.api.dsl.AggregateOp;
import com.ormguard.api.exception.InvalidPolicyException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 单个模型（实体）的完整策略
 */
@Value
@Builder(toBuilder = true)
public class ModelPolicy {

    private static final Set<AggregateOp> ALL_AGGREGATIONS =
            Collections.unmodifiableSet(EnumSet.allOf(AggregateOp.class));

    // ==================== 访问能力 ====================

    @Builder.Default
    boolean allowed = true;

    @Builder.Default
    boolean readable = true;

    @Builder.Default
    boolean writable = false;

    // ==================== 字段与关系 ====================

    /** 字段名 -> 字段策略 */
    @Singular
    Map<String, FieldPolicy> fields;

    /** 未列出字段的默认动作 */
    @Builder.Default
    FieldAction defaultFieldAction = FieldAction.ALLOW;

    /** 关系名 -> 关系策略 */
    @Singular
    Map<String, RelationPolicy> relations;

    // ==================== 覆盖项 ====================

    /** 行级策略覆盖，null 时使用 Policy 默认值 */
    RowPolicy rowPolicy;

    /** 预算覆盖，null 时使用 Policy 默认值 */
    Budget budget;

    @Builder.Default
    WritePolicy writePolicy = WritePolicy.disabled();

    // ==================== 聚合 ====================

    @Builder.Default
    Set<AggregateOp> allowedAggregations = ALL_AGGREGATIONS;

    /** 可聚合字段白名单；null 表示不限制 */
    List<String> aggregatableFields;

    /**
     * 获取字段的显式策略，未配置时按默认动作返回
     */
    public FieldPolicy getFieldPolicy(String field) {
        FieldPolicy explicit = fields.get(field);
        return explicit != null ? explicit : FieldPolicy.of(defaultFieldAction);
    }

    public boolean hasExplicitFieldPolicy(String field) {
        return fields.containsKey(field);
    }

    public RelationPolicy getRelationPolicy(String relation) {
        return relations.get(relation);
    }

    /**
     * 允许展开的关系名（保持配置顺序）
     */
    public List<String> listExpandableRelations() {
        return relations.entrySet().stream()
                .filter(e -> e.getValue().isExpandable())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public boolean isAggregationAllowed(AggregateOp op) {
        return allowedAggregations.contains(op);
    }

    void validate(String path) {
        if (defaultFieldAction == null) {
            throw new InvalidPolicyException(path + ".defaultFieldAction", null,
                    "Default field action cannot be null");
        }
        fields.forEach((name, fp) -> fp.validate(path + ".fields." + name));
        relations.forEach((name, rp) -> rp.validate(path + ".relations." + name));
        if (budget != null) {
            budget.validate(path + ".budget");
        }
        if (writePolicy != null) {
            writePolicy.validate(path + ".writePolicy");
        }
    }
}
