package com.atrium.tenancy.exception;

import java.util.UUID;

/** The user has no role assignment in the workspace. */
public class RoleAssignmentNotFoundException extends TenancyResourceNotFoundException {

    private final String userId;
    private final UUID tenantKey;

    public RoleAssignmentNotFoundException(String userId, UUID tenantKey) {
        super("User '%s' does not have a role assignment for workspace '%s'".formatted(userId, tenantKey));
        this.userId = userId;
        this.tenantKey = tenantKey;
    }

    @Override
    public String resourceType() {
        return "RoleAssignment";
    }

    public String userId() {
        return userId;
    }

    public UUID tenantKey() {
        return tenantKey;
    }
}
