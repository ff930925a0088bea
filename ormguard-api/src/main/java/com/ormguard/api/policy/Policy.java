package com.ormguard.api.policy;

import com.ormguard.api.exception.InvalidPolicyException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 策略根节点
 * <p>
 * 发布后不可变，评估器从不修改它。需要调整时通过 {@code toBuilder()} 生成新实例，
 * 再整体替换（见 PolicyStore）。
 * </p>
 * <p>
 * 不变量：models 中不存在的实体永远不会被隐式放行。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Policy {

    /** 策略版本标签（仅用于审计与日志） */
    String version;

    /** 实体名 -> 模型策略 */
    @Singular
    Map<String, ModelPolicy> models;

    @Builder.Default
    Budget defaultBudget = Budget.defaults();

    @Builder.Default
    RowPolicy defaultRowPolicy = RowPolicy.none();

    /** 全局拒绝字段 glob，例如 "*password*" */
    @Singular
    List<String> globalDenyPatterns;

    /** 全局遮盖字段 glob，例如 "email" */
    @Singular
    List<String> globalMaskPatterns;

    @Builder.Default
    boolean requireTenantScope = true;

    @Builder.Default
    boolean writesEnabled = false;

    public ModelPolicy getModelPolicy(String model) {
        return model == null ? null : models.get(model);
    }

    /**
     * 模型预算，未覆盖时回退到默认预算
     */
    public Budget getBudget(String model) {
        ModelPolicy mp = getModelPolicy(model);
        if (mp != null && mp.getBudget() != null) {
            return mp.getBudget();
        }
        return defaultBudget;
    }

    /**
     * 模型行级策略，未覆盖时回退到默认行级策略
     */
    public RowPolicy getRowPolicy(String model) {
        ModelPolicy mp = getModelPolicy(model);
        if (mp != null && mp.getRowPolicy() != null) {
            return mp.getRowPolicy();
        }
        return defaultRowPolicy;
    }

    public boolean isModelAllowed(String model) {
        ModelPolicy mp = getModelPolicy(model);
        return mp != null && mp.isAllowed();
    }

    public List<String> listAllowedModels() {
        return listModels(ModelPolicy::isAllowed);
    }

    public List<String> listReadableModels() {
        return listModels(mp -> mp.isAllowed() && mp.isReadable());
    }

    public List<String> listWritableModels() {
        return listModels(mp -> mp.isAllowed() && mp.isWritable());
    }

    private List<String> listModels(Predicate<ModelPolicy> filter) {
        return models.entrySet().stream()
                .filter(e -> filter.test(e.getValue()))
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * 校验所有取值范围，不合法时抛出 InvalidPolicyException
     */
    public void validate() {
        if (defaultBudget == null) {
            throw new InvalidPolicyException("defaultBudget", null,
                    "Default budget cannot be null");
        }
        defaultBudget.validate("defaultBudget");
        models.forEach((name, mp) -> {
            PolicyChecks.requireNotBlank("models", name);
            mp.validate("models." + name);
        });
    }

    @Override
    public String toString() {
        return String.format("Policy{version='%s', models=%s, writesEnabled=%s}",
                version, models.keySet(), writesEnabled);
    }
}
