package com.atrium.tenancy.exception;

/** A tenancy resource other than a workspace itself could not be found. */
public abstract class TenancyResourceNotFoundException extends TenancyException {

    protected TenancyResourceNotFoundException(String message) {
        super(message);
    }

    /** Short name of the missing resource type, used as the problem title. */
    public abstract String resourceType();
}
