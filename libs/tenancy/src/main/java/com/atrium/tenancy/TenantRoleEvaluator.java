package com.atrium.tenancy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether an authenticated caller meets a {@link TenantRoleRequirement} for the
 * workspace named in the route.
 * <p>
 * Checks run in a fixed order and the first failure decides the reason:
 * <ol>
 *   <li>route workspace key missing or malformed: {@link DenyReason#MALFORMED_TENANT_REFERENCE}</li>
 *   <li>no claim for that workspace: {@link DenyReason#NO_ROLE_FOR_TENANT}</li>
 *   <li>claimed role below the minimum: {@link DenyReason#INSUFFICIENT_ROLE}; conflicting
 *       claims for one workspace count as the lowest of them</li>
 *   <li>workspace no longer exists: {@link DenyReason#TENANT_NOT_FOUND}</li>
 * </ol>
 * Deny is returned, never thrown. The only exception is an {@link IllegalArgumentException}
 * for a missing requirement, which is a wiring bug.
 */
public class TenantRoleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TenantRoleEvaluator.class);

    private final String routeParameter;
    private final TenantDirectory tenantDirectory;

    public TenantRoleEvaluator(String routeParameter, TenantDirectory tenantDirectory) {
        if (routeParameter == null || routeParameter.isBlank()) {
            throw new IllegalArgumentException("routeParameter must not be null or blank");
        }
        if (tenantDirectory == null) {
            throw new IllegalArgumentException("tenantDirectory must not be null");
        }
        this.routeParameter = routeParameter;
        this.tenantDirectory = tenantDirectory;
    }

    /**
     * Evaluates the requirement against the route and the caller's claims.
     *
     * @param requirement  the endpoint's requirement (must not be null)
     * @param routeParams  path variables of the matched route
     * @param callerClaims the caller's role claims (null is treated as none)
     * @return Allow with the resolved workspace and role, or Deny with a reason
     */
    public AuthorizationDecision evaluate(
            TenantRoleRequirement requirement,
            Map<String, String> routeParams,
            Collection<RoleClaim> callerClaims) {
        if (requirement == null) {
            throw new IllegalArgumentException("requirement must not be null");
        }
        log.debug("Evaluating {} on route parameter '{}'", requirement, routeParameter);

        Optional<UUID> routeTenant = TenantKeys.fromRoute(routeParams, routeParameter);
        if (routeTenant.isEmpty()) {
            log.warn("Malformed tenant reference in route parameter '{}': {}",
                    routeParameter, routeParams == null ? null : routeParams.get(routeParameter));
            return AuthorizationDecision.deny(DenyReason.MALFORMED_TENANT_REFERENCE);
        }
        UUID tenantKey = routeTenant.get();

        Optional<TenantRole> claimed = RoleClaim.roleFor(callerClaims, tenantKey);
        if (claimed.isEmpty()) {
            log.warn("No role claim for workspace {}", tenantKey);
            return AuthorizationDecision.deny(DenyReason.NO_ROLE_FOR_TENANT);
        }

        TenantRole role = claimed.get();
        if (!requirement.isSatisfiedBy(role)) {
            log.warn("Insufficient role for workspace {}: has {}, requires {}",
                    tenantKey, role, requirement.minimumRole());
            return AuthorizationDecision.deny(DenyReason.INSUFFICIENT_ROLE);
        }

        if (!tenantDirectory.exists(tenantKey)) {
            log.warn("Role claim names workspace {} which no longer exists", tenantKey);
            return AuthorizationDecision.deny(DenyReason.TENANT_NOT_FOUND);
        }

        log.debug("Authorized workspace {} with role {}", tenantKey, role);
        return AuthorizationDecision.allow(ResolvedTenant.withRole(tenantKey, role));
    }
}
