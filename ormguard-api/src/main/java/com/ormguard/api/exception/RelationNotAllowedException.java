package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 关系展开（include）未知或被禁止
 */
public class RelationNotAllowedException extends OrmGuardException {

    private final String relation;
    private final String model;

    public RelationNotAllowedException(String relation, String model, List<String> allowedRelations) {
        super(ErrorCode.RELATION_NOT_ALLOWED,
                "Relation '" + relation + "' is not allowed on model '" + model + "'",
                hints(model, allowedRelations),
                details("relation", relation, "model", model, "allowed_relations", allowedRelations));
        this.relation = relation;
        this.model = model;
    }

    private static List<String> hints(String model, List<String> allowedRelations) {
        List<String> hints = new ArrayList<>();
        if (allowedRelations != null && !allowedRelations.isEmpty()) {
            hints.add("Allowed relations for " + model + ": " + String.join(", ", allowedRelations));
        }
        return hints;
    }

    public String getRelation() {
        return relation;
    }

    public String getModel() {
        return model;
    }
}
