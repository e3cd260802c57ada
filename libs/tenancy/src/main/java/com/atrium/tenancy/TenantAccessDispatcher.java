package com.atrium.tenancy;

import java.util.Collection;
import java.util.Map;

/**
 * Single entry point of the authorization stage: picks the evaluator from the endpoint's
 * {@link TenantAccessPolicy} and runs it.
 */
public class TenantAccessDispatcher {

    private final TenantRoleEvaluator roleEvaluator;
    private final AnonymousTenantAccessEvaluator anonymousEvaluator;

    public TenantAccessDispatcher(
            TenantRoleEvaluator roleEvaluator, AnonymousTenantAccessEvaluator anonymousEvaluator) {
        if (roleEvaluator == null || anonymousEvaluator == null) {
            throw new IllegalArgumentException("evaluators must not be null");
        }
        this.roleEvaluator = roleEvaluator;
        this.anonymousEvaluator = anonymousEvaluator;
    }

    /**
     * @param policy       the endpoint's policy (must not be null)
     * @param routeParams  path variables of the matched route
     * @param callerClaims the caller's claims; ignored for anonymous-tenant endpoints
     */
    public AuthorizationDecision authorize(
            TenantAccessPolicy policy,
            Map<String, String> routeParams,
            Collection<RoleClaim> callerClaims) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        return switch (policy.kind()) {
            case REQUIRE_ROLE -> roleEvaluator.evaluate(policy.requirement(), routeParams, callerClaims);
            case ALLOW_ANONYMOUS_TENANT -> anonymousEvaluator.evaluate(routeParams);
        };
    }
}
