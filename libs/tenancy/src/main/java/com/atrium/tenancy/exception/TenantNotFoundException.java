package com.atrium.tenancy.exception;

import java.util.UUID;

/**
 * The workspace does not exist (or no longer exists).
 * <p>
 * Mapped to 404 so unauthorized callers cannot probe which workspaces exist.
 */
public class TenantNotFoundException extends TenancyAccessDeniedException {

    private final UUID tenantKey;

    public TenantNotFoundException(UUID tenantKey) {
        super("Workspace '%s' was not found".formatted(tenantKey));
        this.tenantKey = tenantKey;
    }

    public UUID tenantKey() {
        return tenantKey;
    }
}
