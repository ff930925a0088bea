package com.ormguard.api.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RelationMetadata {

    String name;

    String targetModel;

    /** one_to_one / one_to_many / many_to_one / many_to_many */
    String relationType;

    public static RelationMetadata of(String name, String targetModel, String relationType) {
        return new RelationMetadata(name, targetModel, relationType);
    }
}
