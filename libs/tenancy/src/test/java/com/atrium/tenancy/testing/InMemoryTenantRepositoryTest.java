package com.atrium.tenancy.testing;

import com.atrium.tenancy.RoleAssignment;
import com.atrium.tenancy.TenantRole;
import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;
import com.atrium.tenancy.exception.TenantNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryTenantRepository")
class InMemoryTenantRepositoryTest {

    private InMemoryTenantRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTenantRepository();
    }

    @Test
    @DisplayName("E: a second assignment for the same user and workspace fails and keeps the first")
    void duplicateAssignment() {
        var tenant = repository.addTenant("Home", "");
        repository.addRoleAssignment(new RoleAssignment("u1", tenant.id(), TenantRole.VIEWER));

        assertThatThrownBy(() -> repository.addRoleAssignment(
                new RoleAssignment("u1", tenant.id(), TenantRole.OWNER)))
                .isInstanceOf(DuplicateRoleAssignmentException.class);

        assertThat(repository.findRoleAssignment("u1", tenant.id()))
                .map(RoleAssignment::role)
                .contains(TenantRole.VIEWER);
    }

    @Test
    @DisplayName("deleting a workspace removes its assignments")
    void cascadeDelete() {
        var tenant = repository.addTenant("Home", "");
        var other = repository.addTenant("Other", "");
        repository.addRoleAssignment(new RoleAssignment("u1", tenant.id(), TenantRole.OWNER));
        repository.addRoleAssignment(new RoleAssignment("u1", other.id(), TenantRole.OWNER));

        repository.deleteTenant(tenant);

        assertThat(repository.exists(tenant.key())).isFalse();
        assertThat(repository.findRoleAssignmentsForTenant(tenant.id())).isEmpty();
        assertThat(repository.findMemberships("u1")).hasSize(1);
    }

    @Test
    @DisplayName("finds workspaces by key and by name prefix")
    void lookups() {
        var key = UUID.randomUUID();
        var seeded = repository.addTenant(key, "__TEST__alpha");
        repository.addTenant("Production", "");

        assertThat(repository.findTenantByKey(key)).contains(seeded);
        assertThat(repository.findTenantsByNamePrefix("__TEST__")).containsExactly(seeded);
    }

    @Test
    @DisplayName("updating a deleted workspace fails with TenantNotFoundException")
    void updateDeleted() {
        var tenant = repository.addTenant("Gone", "");
        repository.deleteTenant(tenant);

        assertThatThrownBy(() -> repository.updateTenant(tenant.withDetails("Back", "")))
                .isInstanceOf(TenantNotFoundException.class);
    }

    @Test
    @DisplayName("removing an absent assignment reports false")
    void removeAbsent() {
        assertThat(repository.removeRoleAssignment("nobody", 42L)).isFalse();
    }
}
