package com.atrium.workspace.api;

import com.atrium.tenancy.TenantMembership;
import java.time.Instant;
import java.util.UUID;

/** A workspace together with the caller's role there. */
public record WorkspaceRoleResponse(
        UUID key, String name, String description, String role, Instant createdAt) {

    public static WorkspaceRoleResponse from(TenantMembership membership) {
        var tenant = membership.tenant();
        return new WorkspaceRoleResponse(
                tenant.key(),
                tenant.name(),
                tenant.description(),
                membership.role().claimValue(),
                tenant.createdAt());
    }
}
