package com.atrium.tenancy.exception;

import java.util.UUID;

/** The current workspace was set twice within one request. */
public class TenantContextAlreadySetException extends TenancyException {

    private final UUID currentTenantKey;
    private final UUID attemptedTenantKey;

    public TenantContextAlreadySetException(UUID currentTenantKey, UUID attemptedTenantKey) {
        super("Current workspace is already set to '%s'; refusing to set it to '%s'"
                .formatted(currentTenantKey, attemptedTenantKey));
        this.currentTenantKey = currentTenantKey;
        this.attemptedTenantKey = attemptedTenantKey;
    }

    public UUID currentTenantKey() {
        return currentTenantKey;
    }

    public UUID attemptedTenantKey() {
        return attemptedTenantKey;
    }
}
