package com.ormguard.api.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * 调用方身份
 */
@Value
@Builder(toBuilder = true)
public class Principal {

    String tenantId;

    String userId;

    @Singular
    Set<String> roles;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static Principal of(String tenantId, String userId) {
        return Principal.builder().tenantId(tenantId).userId(userId).build();
    }

    public static Principal anonymous() {
        return Principal.builder().build();
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }

    public boolean hasUser() {
        return userId != null && !userId.isBlank();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
