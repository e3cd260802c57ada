package com.atrium.tenancy;

import java.util.Optional;

/**
 * Outcome of a tenant authorization: either Allow with the resolved workspace, or Deny with a
 * reason. Deny is the normal unauthorized path and is never signalled by an exception.
 *
 * @param allowed  whether access is granted
 * @param tenant   resolved workspace (present only when allowed)
 * @param reason   deny reason (present only when denied)
 */
public record AuthorizationDecision(boolean allowed, ResolvedTenant tenant, DenyReason reason) {

    public AuthorizationDecision {
        if (allowed && (tenant == null || reason != null)) {
            throw new IllegalArgumentException("allow decision needs a tenant and no reason");
        }
        if (!allowed && (reason == null || tenant != null)) {
            throw new IllegalArgumentException("deny decision needs a reason and no tenant");
        }
    }

    public static AuthorizationDecision allow(ResolvedTenant tenant) {
        return new AuthorizationDecision(true, tenant, null);
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(false, null, reason);
    }

    public Optional<ResolvedTenant> resolvedTenant() {
        return Optional.ofNullable(tenant);
    }

    public Optional<DenyReason> denyReason() {
        return Optional.ofNullable(reason);
    }
}
