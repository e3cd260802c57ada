package com.atrium.workspace.persistence;

import com.atrium.tenancy.RoleAssignment;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantMembership;
import com.atrium.tenancy.TenantRepository;
import com.atrium.tenancy.TenantRole;
import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;
import com.atrium.tenancy.exception.TenantNotFoundException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TenantRepository} on Spring {@link JdbcTemplate}. Schema is owned by the Flyway
 * migrations under {@code db/migration}; the unique {@code (user_id, tenant_id)} constraint is
 * what turns a second assignment into {@link DuplicateRoleAssignmentException}.
 */
@Repository
public class JdbcTenantRepository implements TenantRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTenantRepository.class);

    private static final String TENANT_COLUMNS = "t.id, t.tenant_key, t.name, t.description, t.created_at";

    private static final RowMapper<Tenant> TENANT_ROW = (rs, rowNum) -> tenant(rs);

    private static final RowMapper<RoleAssignment> ASSIGNMENT_ROW = (rs, rowNum) ->
            new RoleAssignment(rs.getString("user_id"), rs.getLong("tenant_id"),
                    TenantRole.valueOf(rs.getString("role")));

    private final JdbcTemplate jdbcTemplate;
    private final SimpleJdbcInsert tenantInsert;

    public JdbcTenantRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.tenantInsert = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("tenants")
                .usingColumns("tenant_key", "name", "description", "created_at")
                .usingGeneratedKeyColumns("id");
    }

    @Override
    public Tenant addTenant(String name, String description) {
        UUID key = UUID.randomUUID();
        Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Number id = tenantInsert.executeAndReturnKey(Map.of(
                "tenant_key", key.toString(),
                "name", name,
                "description", description == null ? "" : description,
                "created_at", Timestamp.from(createdAt)));
        log.debug("Created workspace {} with id {}", key, id);
        return new Tenant(id.longValue(), key, name, description == null ? "" : description, createdAt);
    }

    @Override
    public Tenant updateTenant(Tenant tenant) {
        int updated = jdbcTemplate.update(
                "UPDATE tenants SET name = ?, description = ? WHERE id = ?",
                tenant.name(), tenant.description(), tenant.id());
        if (updated == 0) {
            throw new TenantNotFoundException(tenant.key());
        }
        return tenant;
    }

    @Override
    @Transactional
    public void deleteTenant(Tenant tenant) {
        jdbcTemplate.update("DELETE FROM user_tenant_role_assignments WHERE tenant_id = ?", tenant.id());
        jdbcTemplate.update("DELETE FROM tenants WHERE id = ?", tenant.id());
        log.debug("Deleted workspace {}", tenant.key());
    }

    @Override
    public Optional<Tenant> findTenantById(long tenantId) {
        return jdbcTemplate.query(
                "SELECT " + TENANT_COLUMNS + " FROM tenants t WHERE t.id = ?", TENANT_ROW, tenantId)
                .stream().findFirst();
    }

    @Override
    public Optional<Tenant> findTenantByKey(UUID tenantKey) {
        return jdbcTemplate.query(
                "SELECT " + TENANT_COLUMNS + " FROM tenants t WHERE t.tenant_key = ?",
                TENANT_ROW, tenantKey.toString())
                .stream().findFirst();
    }

    @Override
    public List<Tenant> findTenantsByNamePrefix(String namePrefix) {
        String escaped = namePrefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return jdbcTemplate.query(
                "SELECT " + TENANT_COLUMNS + " FROM tenants t WHERE t.name LIKE ? ESCAPE '\\' ORDER BY t.id",
                TENANT_ROW, escaped + "%");
    }

    @Override
    public List<TenantMembership> findMemberships(String userId) {
        return jdbcTemplate.query(
                "SELECT " + TENANT_COLUMNS + ", a.role FROM user_tenant_role_assignments a"
                        + " JOIN tenants t ON t.id = a.tenant_id WHERE a.user_id = ? ORDER BY t.id",
                (rs, rowNum) -> new TenantMembership(tenant(rs), TenantRole.valueOf(rs.getString("role"))),
                userId);
    }

    @Override
    public Optional<RoleAssignment> findRoleAssignment(String userId, long tenantId) {
        return jdbcTemplate.query(
                "SELECT user_id, tenant_id, role FROM user_tenant_role_assignments"
                        + " WHERE user_id = ? AND tenant_id = ?",
                ASSIGNMENT_ROW, userId, tenantId)
                .stream().findFirst();
    }

    @Override
    public List<RoleAssignment> findRoleAssignmentsForTenant(long tenantId) {
        return jdbcTemplate.query(
                "SELECT user_id, tenant_id, role FROM user_tenant_role_assignments"
                        + " WHERE tenant_id = ? ORDER BY user_id",
                ASSIGNMENT_ROW, tenantId);
    }

    @Override
    public void addRoleAssignment(RoleAssignment assignment) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO user_tenant_role_assignments (user_id, tenant_id, role) VALUES (?, ?, ?)",
                    assignment.userId(), assignment.tenantId(), assignment.role().name());
        } catch (DuplicateKeyException e) {
            throw new DuplicateRoleAssignmentException(assignment.userId(), assignment.tenantId(), e);
        }
    }

    @Override
    public boolean removeRoleAssignment(String userId, long tenantId) {
        return jdbcTemplate.update(
                "DELETE FROM user_tenant_role_assignments WHERE user_id = ? AND tenant_id = ?",
                userId, tenantId) > 0;
    }

    private static Tenant tenant(ResultSet rs) throws SQLException {
        return new Tenant(
                rs.getLong("id"),
                UUID.fromString(rs.getString("tenant_key")),
                rs.getString("name"),
                rs.getString("description"),
                rs.getTimestamp("created_at").toInstant());
    }
}
