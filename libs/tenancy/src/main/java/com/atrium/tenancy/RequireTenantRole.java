package com.atrium.tenancy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the caller to hold at least {@link #value()} in the workspace named by the route's
 * workspace key variable.
 * <p>
 * Allowed on a controller class (applies to every handler) or a handler method (overrides the
 * class). An endpoint without this annotation, or {@link AllowAnonymousTenantAccess}, is not
 * tenant-gated and gets no tenant context.
 *
 * <pre>{@code
 * @PutMapping("/{tenantKey}")
 * @RequireTenantRole(TenantRole.OWNER)
 * public WorkspaceResponse update(...) { ... }
 * }</pre>
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireTenantRole {

    TenantRole value();
}
