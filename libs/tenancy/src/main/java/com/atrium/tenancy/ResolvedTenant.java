package com.atrium.tenancy;

import java.util.Optional;
import java.util.UUID;

/**
 * Workspace resolved by an evaluator, handed to the tenant context resolver for the rest of
 * the request.
 * <p>
 * A {@code null} role marks an anonymous access grant: the workspace key came from the route
 * alone and the endpoint must re-validate whatever it needs.
 *
 * @param tenantKey public key of the workspace
 * @param role      role the caller holds there, or null for an anonymous grant
 */
public record ResolvedTenant(UUID tenantKey, TenantRole role) {

    public ResolvedTenant {
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
    }

    public static ResolvedTenant withRole(UUID tenantKey, TenantRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        return new ResolvedTenant(tenantKey, role);
    }

    public static ResolvedTenant anonymousGrant(UUID tenantKey) {
        return new ResolvedTenant(tenantKey, null);
    }

    public boolean isAnonymousGrant() {
        return role == null;
    }

    public Optional<TenantRole> roleIfPresent() {
        return Optional.ofNullable(role);
    }
}
