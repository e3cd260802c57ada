package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.CallerIdentity;
import com.atrium.tenancy.ResolvedTenant;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Names and accessors of the servlet request attributes the tenant pipeline passes between
 * stages. Request attributes die with the request, so nothing leaks across requests.
 */
public final class TenancyRequestAttributes {

    /** {@link CallerIdentity} set by {@link IdentityAssertionFilter}. */
    public static final String CALLER = TenancyRequestAttributes.class.getName() + ".CALLER";

    /** {@link ResolvedTenant} set by {@link TenantAuthorizationInterceptor} on Allow. */
    public static final String RESOLVED_TENANT =
            TenancyRequestAttributes.class.getName() + ".RESOLVED_TENANT";

    private TenancyRequestAttributes() {
        // utility class
    }

    public static Optional<CallerIdentity> caller(HttpServletRequest request) {
        return Optional.ofNullable((CallerIdentity) request.getAttribute(CALLER));
    }

    public static Optional<ResolvedTenant> resolvedTenant(HttpServletRequest request) {
        return Optional.ofNullable((ResolvedTenant) request.getAttribute(RESOLVED_TENANT));
    }
}
