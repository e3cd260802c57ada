package com.atrium.tenancy;

import java.util.UUID;

/**
 * Answers whether a workspace still exists.
 * <p>
 * Claims are minted at login; a workspace can be deleted after that. The role evaluator asks
 * the directory so stale claims never grant access to a workspace that is gone.
 */
@FunctionalInterface
public interface TenantDirectory {

    /** A directory that treats every workspace as existing. */
    TenantDirectory ALL_EXIST = tenantKey -> true;

    boolean exists(UUID tenantKey);
}
