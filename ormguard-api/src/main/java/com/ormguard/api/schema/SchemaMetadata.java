package com.ormguard.api.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 全部实体的元数据清单
 */
@Value
@Builder(toBuilder = true)
public class SchemaMetadata {

    @Singular
    Map<String, ModelMetadata> models;

    public static SchemaMetadata empty() {
        return SchemaMetadata.builder().build();
    }

    public static SchemaMetadata of(ModelMetadata... models) {
        SchemaMetadataBuilder builder = SchemaMetadata.builder();
        for (ModelMetadata model : models) {
            builder.model(model.getName(), model);
        }
        return builder.build();
    }

    public Optional<ModelMetadata> getModel(String model) {
        return Optional.ofNullable(models.get(model));
    }

    /**
     * 实体的字段名列表；未知实体返回空列表
     */
    public List<String> fieldNames(String model) {
        return getModel(model).map(ModelMetadata::fieldNames).orElse(List.of());
    }
}
