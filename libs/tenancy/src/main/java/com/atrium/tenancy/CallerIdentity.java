package com.atrium.tenancy;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Externally authenticated principal with the role claims embedded in its token.
 * <p>
 * The claims are trusted as-is; verifying the token is the identity provider's job.
 *
 * @param userId     unique user identifier (the token's {@code sub})
 * @param roleClaims workspace role claims, possibly empty
 */
public record CallerIdentity(String userId, Set<RoleClaim> roleClaims) {

    public CallerIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        roleClaims = roleClaims == null ? Set.of() : Set.copyOf(roleClaims);
    }

    /** The role claimed for the given workspace, if any; see {@link RoleClaim#roleFor}. */
    public Optional<TenantRole> roleFor(UUID tenantKey) {
        return RoleClaim.roleFor(roleClaims, tenantKey);
    }
}
