package com.atrium.tenancy;

/**
 * A workspace together with the role a particular user holds in it.
 *
 * @param tenant the workspace
 * @param role   the user's role there
 */
public record TenantMembership(Tenant tenant, TenantRole role) {
}
