package com.ormguard.api.dsl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 关系展开
 */
@Value
@Builder(toBuilder = true)
public class IncludeClause {

    String relation;

    /** 关联实体上选择的字段，空表示默认字段 */
    @Singular("selectField")
    List<String> select;

    @Singular("whereClause")
    List<FilterClause> where;

    Integer take;

    public static IncludeClause of(String relation) {
        return IncludeClause.builder().relation(relation).build();
    }
}
