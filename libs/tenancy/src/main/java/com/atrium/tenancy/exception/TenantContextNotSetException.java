package com.atrium.tenancy.exception;

/**
 * Business code read the current workspace on a request where none was resolved.
 * <p>
 * Always a programming error: the endpoint is missing its tenant annotation, or the resolver
 * did not run. Surfaces as an opaque 500.
 */
public class TenantContextNotSetException extends TenancyException {

    public TenantContextNotSetException() {
        super("Current workspace is not set. The tenant context resolver may not have run "
                + "or the endpoint is not tenant-gated.");
    }
}
