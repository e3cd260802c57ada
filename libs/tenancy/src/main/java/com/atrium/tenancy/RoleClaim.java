package com.atrium.tenancy;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;

/**
 * A trusted (workspace, role) pair embedded in the caller's token at login time.
 * <p>
 * On the wire a role claim is the string {@code "<tenantKey>:<Role>"}, for example
 * {@code "3f2c...:Editor"}, carried under the {@link #DEFAULT_CLAIM_TYPE} claim type.
 *
 * @param tenantKey public key of the workspace
 * @param role      role held in that workspace
 */
public record RoleClaim(UUID tenantKey, TenantRole role) {

    /** Claim type under which role claims are published unless configured otherwise. */
    public static final String DEFAULT_CLAIM_TYPE = "tenant_role";

    private static final char SEPARATOR = ':';

    public RoleClaim {
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** Renders this claim in its wire form. */
    public String toClaimValue() {
        return tenantKey.toString() + SEPARATOR + role.claimValue();
    }

    /**
     * The role claimed for a workspace. A token that claims several roles for the same workspace
     * is held to the lowest of them.
     *
     * @param claims    the caller's claims (null is treated as none)
     * @param tenantKey the workspace
     * @return the effective role, or empty if no claim names the workspace
     */
    public static Optional<TenantRole> roleFor(Collection<RoleClaim> claims, UUID tenantKey) {
        if (claims == null) {
            return Optional.empty();
        }
        return claims.stream()
                .filter(claim -> claim.tenantKey().equals(tenantKey))
                .map(RoleClaim::role)
                .min(Comparator.naturalOrder());
    }

    /**
     * Parses a claim value of the form {@code "<tenantKey>:<Role>"}.
     *
     * @param value the raw claim value (may be null)
     * @return the parsed claim, or empty if the value is malformed
     */
    public static Optional<RoleClaim> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        int idx = value.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            return Optional.empty();
        }
        return TenantKeys.parse(value.substring(0, idx))
                .flatMap(key -> TenantRole.fromClaimValue(value.substring(idx + 1))
                        .map(role -> new RoleClaim(key, role)));
    }
}
