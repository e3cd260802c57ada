package com.atrium.tenancy;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Compiles {@link RequireTenantRole} / {@link AllowAnonymousTenantAccess} annotations into a
 * {@link TenantAccessPolicy}.
 * <p>
 * Method annotations take precedence over class annotations. Declaring both annotations on the
 * same element is rejected with {@link IllegalStateException} so the mistake fails at startup.
 */
public final class TenantAccessPolicies {

    private TenantAccessPolicies() {
        // utility class
    }

    /**
     * Resolves the policy for a handler method declared on (or inherited by) {@code handlerType}.
     *
     * @return the policy, or empty if the endpoint is not tenant-gated
     */
    public static Optional<TenantAccessPolicy> resolve(Class<?> handlerType, Method method) {
        Optional<TenantAccessPolicy> fromMethod = fromElement(method, describe(handlerType, method));
        if (fromMethod.isPresent()) {
            return fromMethod;
        }
        return fromElement(handlerType, handlerType.getName());
    }

    private static Optional<TenantAccessPolicy> fromElement(AnnotatedElement element, String description) {
        RequireTenantRole requireRole = element.getAnnotation(RequireTenantRole.class);
        boolean anonymous = element.isAnnotationPresent(AllowAnonymousTenantAccess.class);

        if (requireRole != null && anonymous) {
            throw new IllegalStateException(
                    "%s declares both @RequireTenantRole and @AllowAnonymousTenantAccess".formatted(description));
        }
        if (requireRole != null) {
            return Optional.of(TenantAccessPolicy.requireRole(requireRole.value()));
        }
        if (anonymous) {
            return Optional.of(TenantAccessPolicy.allowAnonymousTenant());
        }
        return Optional.empty();
    }

    private static String describe(Class<?> handlerType, Method method) {
        return handlerType.getName() + "#" + method.getName();
    }
}
