package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型不在白名单内，或者不具备请求的读/写能力
 */
public class ModelNotAllowedException extends OrmGuardException {

    private final String model;

    public ModelNotAllowedException(String model, List<String> allowedModels) {
        super(ErrorCode.MODEL_NOT_ALLOWED,
                "Model '" + model + "' is not allowed",
                hints(allowedModels),
                details("model", model, "allowed_models", allowedModels));
        this.model = model;
    }

    private static List<String> hints(List<String> allowedModels) {
        List<String> hints = new ArrayList<>();
        if (allowedModels != null && !allowedModels.isEmpty()) {
            hints.add("Allowed models: " + String.join(", ", allowedModels));
        }
        return hints;
    }

    public String getModel() {
        return model;
    }
}
