package com.atrium.tenancy;

import com.atrium.tenancy.exception.TenantContextAlreadySetException;
import com.atrium.tenancy.exception.TenantContextNotSetException;

import java.util.Optional;

/**
 * The workspace the current request operates on.
 * <p>
 * One instance per request, created empty and populated exactly once by the tenant context
 * resolver after authorization succeeds. Reading before population fails with
 * {@link TenantContextNotSetException}; there is no default workspace. Setting twice fails with
 * {@link TenantContextAlreadySetException}, even with the same value.
 * <p>
 * Not thread-safe and never shared: the owning request is its only user.
 */
public class TenantContext {

    private Tenant currentTenant;
    private TenantRole currentRole;

    /**
     * Sets the current workspace for this request.
     *
     * @param tenant the resolved workspace (must not be null)
     * @param role   the caller's role there, or null for an anonymous grant
     */
    public void setCurrentTenant(Tenant tenant, TenantRole role) {
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
        if (currentTenant != null) {
            throw new TenantContextAlreadySetException(currentTenant.key(), tenant.key());
        }
        this.currentTenant = tenant;
        this.currentRole = role;
    }

    /**
     * @return the current workspace
     * @throws TenantContextNotSetException if no workspace was resolved for this request
     */
    public Tenant getCurrentTenant() {
        if (currentTenant == null) {
            throw new TenantContextNotSetException();
        }
        return currentTenant;
    }

    /**
     * @return the caller's role in the current workspace; empty for an anonymous grant
     * @throws TenantContextNotSetException if no workspace was resolved for this request
     */
    public Optional<TenantRole> getCurrentRole() {
        getCurrentTenant();
        return Optional.ofNullable(currentRole);
    }

    public boolean isSet() {
        return currentTenant != null;
    }
}
