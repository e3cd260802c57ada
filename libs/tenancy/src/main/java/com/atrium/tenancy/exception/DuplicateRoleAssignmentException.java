package com.atrium.tenancy.exception;

/**
 * A second role assignment was attempted for a (user, workspace) pair that already has one.
 * <p>
 * Raised at assignment time, never when claims are read. The existing assignment is left
 * unchanged; the assignment API reports this as a conflict.
 */
public class DuplicateRoleAssignmentException extends TenancyException {

    private final String userId;
    private final long tenantId;

    public DuplicateRoleAssignmentException(String userId, long tenantId) {
        super(message(userId, tenantId));
        this.userId = userId;
        this.tenantId = tenantId;
    }

    public DuplicateRoleAssignmentException(String userId, long tenantId, Throwable cause) {
        super(message(userId, tenantId), cause);
        this.userId = userId;
        this.tenantId = tenantId;
    }

    private static String message(String userId, long tenantId) {
        return "User '%s' already has a role assignment for workspace %d".formatted(userId, tenantId);
    }

    public String userId() {
        return userId;
    }

    public long tenantId() {
        return tenantId;
    }
}
