package com.atrium.tenancy;

/**
 * Why a tenant authorization was denied.
 * <p>
 * Reasons are checked in declaration order; the first failing check wins. They are kept
 * distinct so the HTTP layer can map them exactly, but none of them is ever shown to the caller.
 */
public enum DenyReason {

    /** The route's workspace key is missing or not a UUID. */
    MALFORMED_TENANT_REFERENCE,

    /** The caller holds no role claim for the route's workspace. */
    NO_ROLE_FOR_TENANT,

    /** The caller's role is below the required minimum. */
    INSUFFICIENT_ROLE,

    /** The claim names a workspace that no longer exists. */
    TENANT_NOT_FOUND
}
