package com.atrium.tenancy.exception;

/**
 * Base type for every tenancy failure that escapes the authorization stage.
 * <p>
 * Unchecked: these are either programming errors or conditions the top-level exception handler
 * turns into a problem response. Business code must not catch and ignore them.
 */
public abstract class TenancyException extends RuntimeException {

    protected TenancyException(String message) {
        super(message);
    }

    protected TenancyException(String message, Throwable cause) {
        super(message, cause);
    }
}
