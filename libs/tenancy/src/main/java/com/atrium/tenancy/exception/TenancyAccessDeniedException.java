package com.atrium.tenancy.exception;

/** A caller may not see or act on a workspace. */
public abstract class TenancyAccessDeniedException extends TenancyException {

    protected TenancyAccessDeniedException(String message) {
        super(message);
    }
}
