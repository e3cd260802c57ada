package com.atrium.tenancy.testing;

import com.atrium.tenancy.RoleAssignment;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantMembership;
import com.atrium.tenancy.TenantRepository;
import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;
import com.atrium.tenancy.exception.TenantNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TenantRepository} backed by maps, enforcing the same invariants as the JDBC
 * implementation (one assignment per user and workspace, cascading delete).
 * <p>
 * Lives in {@code src/main} under {@code testing} so other modules can use it from their test
 * scope through a regular dependency.
 */
public class InMemoryTenantRepository implements TenantRepository {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<AssignmentKey, RoleAssignment> assignments = new ConcurrentHashMap<>();

    private record AssignmentKey(String userId, long tenantId) {
    }

    @Override
    public Tenant addTenant(String name, String description) {
        var tenant = new Tenant(ids.incrementAndGet(), UUID.randomUUID(), name, description, Instant.now());
        tenants.put(tenant.id(), tenant);
        return tenant;
    }

    /** Stores a workspace with a caller-chosen key. */
    public Tenant addTenant(UUID key, String name) {
        var tenant = new Tenant(ids.incrementAndGet(), key, name, "", Instant.now());
        tenants.put(tenant.id(), tenant);
        return tenant;
    }

    @Override
    public Tenant updateTenant(Tenant tenant) {
        if (!tenants.containsKey(tenant.id())) {
            throw new TenantNotFoundException(tenant.key());
        }
        tenants.put(tenant.id(), tenant);
        return tenant;
    }

    @Override
    public void deleteTenant(Tenant tenant) {
        tenants.remove(tenant.id());
        assignments.keySet().removeIf(key -> key.tenantId() == tenant.id());
    }

    @Override
    public Optional<Tenant> findTenantById(long tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Optional<Tenant> findTenantByKey(UUID tenantKey) {
        return tenants.values().stream().filter(t -> t.key().equals(tenantKey)).findFirst();
    }

    @Override
    public List<Tenant> findTenantsByNamePrefix(String namePrefix) {
        return tenants.values().stream()
                .filter(t -> t.name() != null && t.name().startsWith(namePrefix))
                .sorted(Comparator.comparingLong(Tenant::id))
                .toList();
    }

    @Override
    public List<TenantMembership> findMemberships(String userId) {
        var result = new ArrayList<TenantMembership>();
        assignments.values().stream()
                .filter(a -> a.userId().equals(userId))
                .sorted(Comparator.comparingLong(RoleAssignment::tenantId))
                .forEach(a -> findTenantById(a.tenantId())
                        .ifPresent(t -> result.add(new TenantMembership(t, a.role()))));
        return result;
    }

    @Override
    public Optional<RoleAssignment> findRoleAssignment(String userId, long tenantId) {
        return Optional.ofNullable(assignments.get(new AssignmentKey(userId, tenantId)));
    }

    @Override
    public List<RoleAssignment> findRoleAssignmentsForTenant(long tenantId) {
        return assignments.values().stream()
                .filter(a -> a.tenantId() == tenantId)
                .sorted(Comparator.comparing(RoleAssignment::userId))
                .toList();
    }

    @Override
    public void addRoleAssignment(RoleAssignment assignment) {
        var key = new AssignmentKey(assignment.userId(), assignment.tenantId());
        if (assignments.putIfAbsent(key, assignment) != null) {
            throw new DuplicateRoleAssignmentException(assignment.userId(), assignment.tenantId());
        }
    }

    @Override
    public boolean removeRoleAssignment(String userId, long tenantId) {
        return assignments.remove(new AssignmentKey(userId, tenantId)) != null;
    }
}
