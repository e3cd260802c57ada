package com.atrium.workspace.application;

import com.atrium.tenancy.RoleAssignment;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantMembership;
import com.atrium.tenancy.TenantRepository;
import com.atrium.tenancy.TenantRole;
import com.atrium.tenancy.exception.RoleAssignmentNotFoundException;
import com.atrium.tenancy.exception.TenantAccessDeniedException;
import com.atrium.tenancy.exception.TenantNotFoundException;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Workspace management use cases.
 *
 * <p>Operations on a specific workspace take the {@link Tenant} already resolved by the tenant
 * pipeline; the only lookups by key here serve endpoints that are not tenant-gated.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final TenantRepository tenantRepository;

    public WorkspaceService(TenantRepository tenantRepository) {
        this.tenantRepository = tenantRepository;
    }

    /** Creates a workspace and makes the creator its Owner. */
    @Transactional
    public TenantMembership createWorkspace(String creatorUserId, String name, String description) {
        Tenant tenant = tenantRepository.addTenant(name.strip(), description.strip());
        tenantRepository.addRoleAssignment(new RoleAssignment(creatorUserId, tenant.id(), TenantRole.OWNER));
        log.info("User {} created workspace {}", creatorUserId, tenant.key());
        return new TenantMembership(tenant, TenantRole.OWNER);
    }

    /** Creates a workspace with no members. */
    public Tenant createUnownedWorkspace(String name, String description) {
        Tenant tenant = tenantRepository.addTenant(name.strip(), description == null ? "" : description.strip());
        log.info("Created unowned workspace {}", tenant.key());
        return tenant;
    }

    /** Deletes every workspace whose name starts with {@code namePrefix}, with its assignments. */
    public int deleteWorkspacesByNamePrefix(String namePrefix) {
        List<Tenant> doomed = tenantRepository.findTenantsByNamePrefix(namePrefix);
        doomed.forEach(tenantRepository::deleteTenant);
        log.info("Deleted {} workspace(s) named '{}*'", doomed.size(), namePrefix);
        return doomed.size();
    }

    public List<TenantMembership> listWorkspaces(String userId) {
        return tenantRepository.findMemberships(userId);
    }

    /**
     * @throws TenantNotFoundException if no workspace has the key
     * @throws TenantAccessDeniedException if the user holds no role in it
     */
    public TenantMembership getWorkspace(String userId, UUID tenantKey) {
        Tenant tenant = tenantRepository.findTenantByKey(tenantKey)
                .orElseThrow(() -> new TenantNotFoundException(tenantKey));
        RoleAssignment assignment = tenantRepository.findRoleAssignment(userId, tenant.id())
                .orElseThrow(() -> new TenantAccessDeniedException(userId, tenantKey));
        return new TenantMembership(tenant, assignment.role());
    }

    public Tenant updateWorkspace(Tenant tenant, String name, String description) {
        Tenant updated = tenantRepository.updateTenant(tenant.withDetails(name.strip(), description.strip()));
        log.info("Updated workspace {}", tenant.key());
        return updated;
    }

    public void deleteWorkspace(Tenant tenant) {
        tenantRepository.deleteTenant(tenant);
        log.info("Deleted workspace {}", tenant.key());
    }

    public List<RoleAssignment> listMembers(Tenant tenant) {
        return tenantRepository.findRoleAssignmentsForTenant(tenant.id());
    }

    /**
     * @throws com.atrium.tenancy.exception.DuplicateRoleAssignmentException if the user already
     *     has a role in the workspace; the existing assignment is left as it was
     */
    public RoleAssignment addMember(Tenant tenant, String userId, TenantRole role) {
        var assignment = new RoleAssignment(userId, tenant.id(), role);
        tenantRepository.addRoleAssignment(assignment);
        log.info("Assigned {} to user {} in workspace {}", role, userId, tenant.key());
        return assignment;
    }

    /** @throws RoleAssignmentNotFoundException if the user has no role in the workspace */
    public void removeMember(Tenant tenant, String userId) {
        if (!tenantRepository.removeRoleAssignment(userId, tenant.id())) {
            throw new RoleAssignmentNotFoundException(userId, tenant.key());
        }
        log.info("Removed user {} from workspace {}", userId, tenant.key());
    }
}
