package com.atrium.tenancy.exception;

import java.util.UUID;

/** The caller holds no role in the workspace it asked for. */
public class TenantAccessDeniedException extends TenancyAccessDeniedException {

    private final String userId;
    private final UUID tenantKey;

    public TenantAccessDeniedException(String userId, UUID tenantKey) {
        super("User '%s' does not have access to workspace '%s'".formatted(userId, tenantKey));
        this.userId = userId;
        this.tenantKey = tenantKey;
    }

    public String userId() {
        return userId;
    }

    public UUID tenantKey() {
        return tenantKey;
    }
}
