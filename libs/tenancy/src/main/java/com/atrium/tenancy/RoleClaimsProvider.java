package com.atrium.tenancy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Produces the role claims to embed in a user's token.
 * <p>
 * A pure read of persisted role assignments, called once when the identity provider mints a
 * token rather than on every request. A user with no workspaces gets an empty set, which is a
 * valid state (e.g. before creating their first workspace).
 */
public class RoleClaimsProvider {

    private final TenantRepository tenantRepository;

    public RoleClaimsProvider(TenantRepository tenantRepository) {
        if (tenantRepository == null) {
            throw new IllegalArgumentException("tenantRepository must not be null");
        }
        this.tenantRepository = tenantRepository;
    }

    /**
     * Returns the user's role claims, one per workspace they belong to.
     *
     * @param userId the user (must not be blank)
     * @return the claims, never null
     */
    public Set<RoleClaim> getClaims(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        Set<RoleClaim> claims = new LinkedHashSet<>();
        for (TenantMembership membership : tenantRepository.findMemberships(userId)) {
            if (membership.tenant() != null) {
                claims.add(new RoleClaim(membership.tenant().key(), membership.role()));
            }
        }
        return Set.copyOf(claims);
    }

    /** The user's claims in wire form ({@code "<tenantKey>:<Role>"}). */
    public List<String> getClaimValues(String userId) {
        return getClaims(userId).stream()
                .map(RoleClaim::toClaimValue)
                .sorted()
                .toList();
    }
}
