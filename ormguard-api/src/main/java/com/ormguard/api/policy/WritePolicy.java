package com.ormguard.api.policy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 写操作策略
 * 默认全部关闭，必须显式开启。
 */
@Value
@Builder(toBuilder = true)
public class WritePolicy {

    /** 写操作总开关 */
    @Builder.Default
    boolean enabled = false;

    @Builder.Default
    boolean allowCreate = false;

    @Builder.Default
    boolean allowUpdate = false;

    @Builder.Default
    boolean allowDelete = false;

    @Builder.Default
    boolean allowBulk = false;

    /** 更新/删除必须携带主键 */
    @Builder.Default
    boolean requirePrimaryKey = true;

    /** 删除默认走软删除 */
    @Builder.Default
    boolean softDelete = true;

    /** 单次操作最多影响的行数 (1-1000) */
    @Builder.Default
    int maxAffectedRows = 1;

    @Builder.Default
    boolean requireReason = true;

    @Builder.Default
    boolean requireApproval = false;

    /** 永远只读的字段 */
    @Singular
    List<String> readonlyFields;

    public static WritePolicy disabled() {
        return WritePolicy.builder().build();
    }

    public boolean isReadonly(String field) {
        return readonlyFields.contains(field);
    }

    void validate(String path) {
        PolicyChecks.requireRange(path + ".maxAffectedRows", maxAffectedRows, 1, 1000);
    }
}
