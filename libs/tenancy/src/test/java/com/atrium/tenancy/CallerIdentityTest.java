package com.atrium.tenancy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.UUID;

import static com.atrium.tenancy.testing.TestTenancyFactory.caller;
import static com.atrium.tenancy.testing.TestTenancyFactory.claim;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CallerIdentity")
class CallerIdentityTest {

    @Test
    @DisplayName("finds the role claimed for a workspace")
    void roleFor() {
        var key = UUID.randomUUID();

        var identity = caller(claim(key, TenantRole.EDITOR));

        assertThat(identity.roleFor(key)).contains(TenantRole.EDITOR);
        assertThat(identity.roleFor(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("conflicting claims for one workspace resolve to the lowest role")
    void conflictingClaims() {
        var key = UUID.randomUUID();

        var identity = caller(claim(key, TenantRole.OWNER), claim(key, TenantRole.EDITOR));

        assertThat(identity.roleFor(key)).contains(TenantRole.EDITOR);
    }

    @Test
    @DisplayName("null claims become an empty set")
    void nullClaims() {
        assertThat(new CallerIdentity("u1", null).roleClaims()).isEmpty();
    }

    @Test
    @DisplayName("claims are copied defensively")
    void copied() {
        var claims = new HashSet<RoleClaim>();
        var identity = new CallerIdentity("u1", claims);

        claims.add(claim(UUID.randomUUID(), TenantRole.OWNER));

        assertThat(identity.roleClaims()).isEmpty();
    }

    @Test
    @DisplayName("a blank user id is rejected")
    void blankUser() {
        assertThatThrownBy(() -> new CallerIdentity("", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
