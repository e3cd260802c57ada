package com.atrium.tenancy;

import java.util.EnumMap;
import java.util.Map;

/**
 * "Caller must hold at least {@link #minimumRole()} on the workspace named in the route."
 * <p>
 * Instances are interned: {@link #of(TenantRole)} always returns the same object for the same
 * role, so endpoints annotated with the same minimum share one requirement and nothing is
 * allocated per request.
 */
public final class TenantRoleRequirement {

    private static final Map<TenantRole, TenantRoleRequirement> INTERNED = new EnumMap<>(TenantRole.class);

    static {
        for (TenantRole role : TenantRole.values()) {
            INTERNED.put(role, new TenantRoleRequirement(role));
        }
    }

    private final TenantRole minimumRole;

    private TenantRoleRequirement(TenantRole minimumRole) {
        this.minimumRole = minimumRole;
    }

    /**
     * Returns the requirement for the given minimum role.
     *
     * @throws IllegalArgumentException if {@code minimumRole} is null
     */
    public static TenantRoleRequirement of(TenantRole minimumRole) {
        if (minimumRole == null) {
            throw new IllegalArgumentException("minimumRole must not be null");
        }
        return INTERNED.get(minimumRole);
    }

    public TenantRole minimumRole() {
        return minimumRole;
    }

    /** Whether a caller holding {@code role} meets this requirement. */
    public boolean isSatisfiedBy(TenantRole role) {
        return role != null && role.satisfies(minimumRole);
    }

    @Override
    public String toString() {
        return "TenantRoleRequirement[minimumRole=" + minimumRole + "]";
    }
}
