package com.atrium.tenancy;

/**
 * The tenant gate attached to one endpoint.
 * <p>
 * A tagged variant: either {@link Kind#REQUIRE_ROLE} with a requirement, or
 * {@link Kind#ALLOW_ANONYMOUS_TENANT} with none. The two kinds are mutually exclusive per
 * endpoint and share the same slot in the request pipeline.
 *
 * @param kind        which evaluator handles the endpoint
 * @param requirement the role requirement (null for {@link Kind#ALLOW_ANONYMOUS_TENANT})
 */
public record TenantAccessPolicy(Kind kind, TenantRoleRequirement requirement) {

    public enum Kind {
        REQUIRE_ROLE,
        ALLOW_ANONYMOUS_TENANT
    }

    private static final TenantAccessPolicy ANONYMOUS_TENANT =
            new TenantAccessPolicy(Kind.ALLOW_ANONYMOUS_TENANT, null);

    public TenantAccessPolicy {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (kind == Kind.REQUIRE_ROLE && requirement == null) {
            throw new IllegalArgumentException("REQUIRE_ROLE policy needs a requirement");
        }
        if (kind == Kind.ALLOW_ANONYMOUS_TENANT && requirement != null) {
            throw new IllegalArgumentException("ALLOW_ANONYMOUS_TENANT policy carries no requirement");
        }
    }

    /** Policy requiring at least {@code minimumRole} on the route's workspace. */
    public static TenantAccessPolicy requireRole(TenantRole minimumRole) {
        return new TenantAccessPolicy(Kind.REQUIRE_ROLE, TenantRoleRequirement.of(minimumRole));
    }

    /** Policy trusting the route's workspace key without any role check. */
    public static TenantAccessPolicy allowAnonymousTenant() {
        return ANONYMOUS_TENANT;
    }

    public boolean requiresAuthenticatedCaller() {
        return kind == Kind.REQUIRE_ROLE;
    }
}
