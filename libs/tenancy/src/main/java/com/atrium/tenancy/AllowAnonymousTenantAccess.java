package com.atrium.tenancy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Gives the endpoint tenant context from the route's workspace key alone, with <em>no</em>
 * authentication and <em>no</em> role check.
 * <p>
 * Only for trusted internal or test-automation endpoints that re-validate everything they need
 * themselves. Cannot be combined with {@link RequireTenantRole} on the same element.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface AllowAnonymousTenantAccess {
}
