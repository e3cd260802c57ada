package com.atrium.tenancy;

import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for workspaces and role assignments.
 * <p>
 * Implementations must enforce at most one {@link RoleAssignment} per (userId, tenantId), and
 * must remove a workspace's assignments when the workspace is deleted.
 */
public interface TenantRepository extends TenantDirectory {

    /**
     * Creates a workspace with a fresh key.
     *
     * @return the stored workspace, with its id and key populated
     */
    Tenant addTenant(String name, String description);

    /**
     * Updates name and description of an existing workspace.
     *
     * @throws com.atrium.tenancy.exception.TenantNotFoundException if the workspace is gone
     */
    Tenant updateTenant(Tenant tenant);

    /** Deletes a workspace and all of its role assignments. */
    void deleteTenant(Tenant tenant);

    Optional<Tenant> findTenantById(long tenantId);

    Optional<Tenant> findTenantByKey(UUID tenantKey);

    /** Workspaces whose name starts with the given prefix (ordinal comparison). */
    List<Tenant> findTenantsByNamePrefix(String namePrefix);

    /** All workspaces the user holds a role in, with that role. */
    List<TenantMembership> findMemberships(String userId);

    Optional<RoleAssignment> findRoleAssignment(String userId, long tenantId);

    List<RoleAssignment> findRoleAssignmentsForTenant(long tenantId);

    /**
     * Stores a new role assignment.
     *
     * @throws DuplicateRoleAssignmentException if the user already has a role in the workspace
     */
    void addRoleAssignment(RoleAssignment assignment);

    /**
     * Removes the user's role assignment in the workspace.
     *
     * @return true if an assignment was removed
     */
    boolean removeRoleAssignment(String userId, long tenantId);

    @Override
    default boolean exists(UUID tenantKey) {
        return findTenantByKey(tenantKey).isPresent();
    }
}
