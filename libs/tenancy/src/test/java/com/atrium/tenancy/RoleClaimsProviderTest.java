package com.atrium.tenancy;

import com.atrium.tenancy.testing.InMemoryTenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoleClaimsProvider")
class RoleClaimsProviderTest {

    private InMemoryTenantRepository repository;
    private RoleClaimsProvider provider;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTenantRepository();
        provider = new RoleClaimsProvider(repository);
    }

    @Test
    @DisplayName("a user without assignments gets an empty set")
    void noAssignments() {
        assertThat(provider.getClaims("alice")).isEmpty();
        assertThat(provider.getClaimValues("alice")).isEmpty();
    }

    @Test
    @DisplayName("one claim per workspace the user belongs to")
    void claimPerWorkspace() {
        var home = repository.addTenant("Home", "");
        var club = repository.addTenant("Club", "");
        repository.addRoleAssignment(new RoleAssignment("alice", home.id(), TenantRole.OWNER));
        repository.addRoleAssignment(new RoleAssignment("alice", club.id(), TenantRole.VIEWER));
        repository.addRoleAssignment(new RoleAssignment("bob", club.id(), TenantRole.EDITOR));

        assertThat(provider.getClaims("alice")).containsExactlyInAnyOrder(
                new RoleClaim(home.key(), TenantRole.OWNER),
                new RoleClaim(club.key(), TenantRole.VIEWER));
    }

    @Test
    @DisplayName("claim values use the <tenantKey>:<Role> wire form")
    void wireForm() {
        var home = repository.addTenant("Home", "");
        repository.addRoleAssignment(new RoleAssignment("alice", home.id(), TenantRole.EDITOR));

        assertThat(provider.getClaimValues("alice")).containsExactly(home.key() + ":Editor");
    }

    @Test
    @DisplayName("deleted workspaces no longer produce claims")
    void deletedWorkspace() {
        var home = repository.addTenant("Home", "");
        repository.addRoleAssignment(new RoleAssignment("alice", home.id(), TenantRole.OWNER));

        repository.deleteTenant(home);

        assertThat(provider.getClaims("alice")).isEmpty();
    }

    @Test
    @DisplayName("a blank user id is rejected")
    void blankUser() {
        assertThatThrownBy(() -> provider.getClaims(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
