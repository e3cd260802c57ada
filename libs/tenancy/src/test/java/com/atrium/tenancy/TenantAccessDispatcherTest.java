package com.atrium.tenancy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static com.atrium.tenancy.testing.TestTenancyFactory.claim;
import static com.atrium.tenancy.testing.TestTenancyFactory.route;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantAccessDispatcher")
class TenantAccessDispatcherTest {

    private final TenantAccessDispatcher dispatcher = new TenantAccessDispatcher(
            new TenantRoleEvaluator(TenantKeys.DEFAULT_ROUTE_PARAMETER, TenantDirectory.ALL_EXIST),
            new AnonymousTenantAccessEvaluator(TenantKeys.DEFAULT_ROUTE_PARAMETER));

    @Test
    @DisplayName("REQUIRE_ROLE consults the caller's claims")
    void requireRoleUsesClaims() {
        var key = UUID.randomUUID();

        var decision = dispatcher.authorize(TenantAccessPolicy.requireRole(TenantRole.EDITOR), route(key), Set.of());

        assertThat(decision.denyReason()).contains(DenyReason.NO_ROLE_FOR_TENANT);
    }

    @Test
    @DisplayName("REQUIRE_ROLE resolves the caller's role")
    void requireRoleAllows() {
        var key = UUID.randomUUID();

        var decision = dispatcher.authorize(
                TenantAccessPolicy.requireRole(TenantRole.EDITOR), route(key), Set.of(claim(key, TenantRole.EDITOR)));

        assertThat(decision.tenant()).isEqualTo(ResolvedTenant.withRole(key, TenantRole.EDITOR));
    }

    @Test
    @DisplayName("ALLOW_ANONYMOUS_TENANT ignores claims")
    void anonymousIgnoresClaims() {
        var key = UUID.randomUUID();

        var decision = dispatcher.authorize(TenantAccessPolicy.allowAnonymousTenant(), route(key), null);

        assertThat(decision.tenant()).isEqualTo(ResolvedTenant.anonymousGrant(key));
    }

    @Test
    @DisplayName("rejects a null policy")
    void nullPolicy() {
        assertThatThrownBy(() -> dispatcher.authorize(null, route(UUID.randomUUID()), Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
