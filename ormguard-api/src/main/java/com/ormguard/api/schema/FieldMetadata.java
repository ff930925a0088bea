package com.ormguard.api.schema;

import lombok.Builder;
import lombok.Value;

/**
 * 字段元数据，由外部 Schema 内省提供
 */
@Value
@Builder(toBuilder = true)
public class FieldMetadata {

    String name;

    /** 存储类型，例如 "varchar"、"int" */
    String type;

    @Builder.Default
    boolean nullable = true;

    boolean primaryKey;

    public static FieldMetadata of(String name, String type) {
        return FieldMetadata.builder().name(name).type(type).build();
    }

    public static FieldMetadata id(String name) {
        return FieldMetadata.builder().name(name).type("int").nullable(false).primaryKey(true).build();
    }
}
