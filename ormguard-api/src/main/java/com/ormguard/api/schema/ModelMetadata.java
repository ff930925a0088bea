package com.ormguard.api.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 实体元数据：字段（有序）、关系与主键
 */
@Value
@Builder(toBuilder = true)
public class ModelMetadata {

    String name;

    String table;

    @Singular
    List<FieldMetadata> fields;

    @Singular
    List<RelationMetadata> relations;

    @Builder.Default
    String primaryKey = "id";

    public List<String> fieldNames() {
        return fields.stream().map(FieldMetadata::getName).collect(Collectors.toList());
    }

    public boolean hasField(String field) {
        return getField(field).isPresent();
    }

    public Optional<FieldMetadata> getField(String field) {
        return fields.stream().filter(f -> f.getName().equals(field)).findFirst();
    }

    public Optional<RelationMetadata> getRelation(String relation) {
        return relations.stream().filter(r -> r.getName().equals(relation)).findFirst();
    }
}
