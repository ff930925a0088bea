package com.ormguard.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型要求租户隔离，但上下文中没有租户 ID
 */
public class TenantScopeRequiredException extends OrmGuardException {

    private final String model;

    public TenantScopeRequiredException(String model, String scopeField) {
        super(ErrorCode.TENANT_SCOPE_REQUIRED,
                "Tenant scope is required for model '" + model + "'",
                hints(scopeField),
                details("model", model, "scope_field", scopeField));
        this.model = model;
    }

    private static List<String> hints(String scopeField) {
        List<String> hints = new ArrayList<>();
        hints.add("Ensure you are authenticated with a valid tenant context");
        if (scopeField != null) {
            hints.add("The model requires scoping on field: " + scopeField);
        }
        return hints;
    }

    public String getModel() {
        return model;
    }
}
