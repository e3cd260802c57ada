package com.atrium.tenancy;

/**
 * Persisted grant of a role to a user within one workspace.
 * <p>
 * At most one assignment exists per (userId, tenantId) pair.
 *
 * @param userId   user the role is granted to
 * @param tenantId internal id of the workspace
 * @param role     granted role
 */
public record RoleAssignment(String userId, long tenantId, TenantRole role) {

    public RoleAssignment {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }
}
