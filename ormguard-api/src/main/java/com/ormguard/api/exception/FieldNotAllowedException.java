package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段不存在于 Schema 中，或者被字段策略拒绝
 */
public class FieldNotAllowedException extends OrmGuardException {

    /**
     * 提示中最多列出的字段数，避免把整张宽表塞进提示
     */
    private static final int MAX_HINT_FIELDS = 10;

    private final String field;
    private final String model;

    public FieldNotAllowedException(String field, String model) {
        this(field, model, List.of());
    }

    public FieldNotAllowedException(String field, String model, List<String> allowedFields) {
        super(ErrorCode.FIELD_NOT_ALLOWED,
                "Field '" + field + "' is not allowed on model '" + model + "'",
                hints(model, allowedFields),
                details("field", field, "model", model, "allowed_fields", allowedFields));
        this.field = field;
        this.model = model;
    }

    private static List<String> hints(String model, List<String> allowedFields) {
        List<String> hints = new ArrayList<>();
        if (allowedFields == null || allowedFields.isEmpty()) {
            return hints;
        }
        List<String> shown = allowedFields.subList(0, Math.min(MAX_HINT_FIELDS, allowedFields.size()));
        String hint = "Allowed fields for " + model + ": " + String.join(", ", shown);
        if (allowedFields.size() > MAX_HINT_FIELDS) {
            hint += " (and " + (allowedFields.size() - MAX_HINT_FIELDS) + " more)";
        }
        hints.add(hint);
        return hints;
    }

    public String getField() {
        return field;
    }

    public String getModel() {
        return model;
    }
}
