package com.atrium.tenancy;

import java.util.Optional;

/**
 * Role a user holds within a single workspace.
 * <p>
 * Roles are strictly ordinal: {@code VIEWER < EDITOR < OWNER}. A requirement for a
 * minimum role is satisfied by that role or any role declared after it. There is no
 * "closest match", only "at least this".
 */
public enum TenantRole {

    VIEWER("Viewer"),
    EDITOR("Editor"),
    OWNER("Owner");

    private final String claimValue;

    TenantRole(String claimValue) {
        this.claimValue = claimValue;
    }

    /** The spelling used inside {@code tenant_role} claims (e.g., "Editor"). */
    public String claimValue() {
        return claimValue;
    }

    /**
     * Checks whether this role meets the given minimum.
     * <p>
     * Example: {@code OWNER.satisfies(VIEWER)} is true, {@code VIEWER.satisfies(EDITOR)} is false.
     *
     * @param minimum the minimum role required (must not be null)
     */
    public boolean satisfies(TenantRole minimum) {
        if (minimum == null) {
            throw new IllegalArgumentException("minimum role must not be null");
        }
        return compareTo(minimum) >= 0;
    }

    /**
     * Looks up a role by its claim spelling, ignoring case ("owner", "Owner", "OWNER").
     *
     * @param value the string to match (may be null)
     * @return the matching role, or empty if not recognised
     */
    public static Optional<TenantRole> fromClaimValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        for (TenantRole role : values()) {
            if (role.claimValue.equalsIgnoreCase(trimmed)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
