package com.ormguard.api.policy;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 关系展开策略
 */
@Value
@Builder(toBuilder = true)
public class RelationPolicy {

    @Builder.Default
    boolean allowed = true;

    /**
     * 最大展开深度 (0-5)，0 表示禁止展开
     */
    @Builder.Default
    int maxDepth = 1;

    /**
     * 关联实体上允许选择的字段；null 表示不额外限制
     */
    List<String> allowedFields;

    public static RelationPolicy allow() {
        return RelationPolicy.builder().build();
    }

    public static RelationPolicy deny() {
        return RelationPolicy.builder().allowed(false).build();
    }

    public boolean isExpandable() {
        return allowed && maxDepth > 0;
    }

    void validate(String path) {
        PolicyChecks.requireRange(path + ".maxDepth", maxDepth, 0, 5);
    }
}
