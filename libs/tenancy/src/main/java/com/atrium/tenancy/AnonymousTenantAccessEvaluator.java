package com.atrium.tenancy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Grants tenant context from the route alone, without any caller or claim.
 * <p>
 * <strong>Security:</strong> only endpoints marked {@code @AllowAnonymousTenantAccess} reach
 * this evaluator. It checks nothing but the shape of the workspace key; such endpoints must
 * re-validate whatever they rely on themselves (e.g. the {@code __TEST__} name prefix on
 * test-control endpoints). The resulting grant carries no role.
 */
public class AnonymousTenantAccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AnonymousTenantAccessEvaluator.class);

    private final String routeParameter;

    public AnonymousTenantAccessEvaluator(String routeParameter) {
        if (routeParameter == null || routeParameter.isBlank()) {
            throw new IllegalArgumentException("routeParameter must not be null or blank");
        }
        this.routeParameter = routeParameter;
    }

    /**
     * @param routeParams path variables of the matched route
     * @return Allow with an anonymous grant, or Deny({@link DenyReason#MALFORMED_TENANT_REFERENCE})
     */
    public AuthorizationDecision evaluate(Map<String, String> routeParams) {
        Optional<UUID> routeTenant = TenantKeys.fromRoute(routeParams, routeParameter);
        if (routeTenant.isEmpty()) {
            log.warn("Malformed tenant reference in route parameter '{}': {}",
                    routeParameter, routeParams == null ? null : routeParams.get(routeParameter));
            return AuthorizationDecision.deny(DenyReason.MALFORMED_TENANT_REFERENCE);
        }
        log.info("Anonymous tenant access granted for workspace {}", routeTenant.get());
        return AuthorizationDecision.allow(ResolvedTenant.anonymousGrant(routeTenant.get()));
    }
}
