package com.ormguard.api.cost;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 表统计信息，用于选择度估算
 */
@Value
@Builder(toBuilder = true)
public class TableStats {

    String tableName;

    @Builder.Default
    long estimatedRowCount = 1000;

    @Builder.Default
    int avgRowSizeBytes = 100;

    @Singular
    Set<String> indexedColumns;

    @Builder.Default
    String primaryKey = "id";

    @Builder.Default
    double defaultSelectivity = 0.1;

    /** 唯一索引等值匹配的选择度 */
    @Builder.Default
    double uniqueSelectivity = 0.001;

    public static TableStats unknown(String tableName) {
        return TableStats.builder().tableName(tableName).build();
    }

    public boolean isIndexed(String column) {
        return indexedColumns.contains(column);
    }
}
