package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.TenantAccessPolicies;
import com.atrium.tenancy.TenantAccessPolicy;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * Endpoint to {@link TenantAccessPolicy} dispatch table.
 *
 * <p>Built once at startup from every Spring MVC handler method, so a controller that declares
 * both tenant annotations stops the application from starting. Policies are looked up, never
 * rebuilt, on the request path.
 */
@Component
public class TenantAccessPolicyRegistry implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(TenantAccessPolicyRegistry.class);

    private record Endpoint(Class<?> handlerType, Method method) {}

    private final ApplicationContext applicationContext;
    private final Map<Endpoint, Optional<TenantAccessPolicy>> policies = new ConcurrentHashMap<>();

    public TenantAccessPolicyRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterSingletonsInstantiated() {
        applicationContext.getBeansOfType(RequestMappingHandlerMapping.class).values().stream()
                .flatMap(mapping -> mapping.getHandlerMethods().values().stream())
                .forEach(this::policyFor);
        long gated = policies.values().stream().filter(Optional::isPresent).count();
        log.info("Registered tenant policies for {} of {} endpoints", gated, policies.size());
    }

    /**
     * @return the endpoint's policy, or empty if it is not tenant-gated
     * @throws IllegalStateException if the endpoint declares conflicting tenant annotations
     */
    public Optional<TenantAccessPolicy> policyFor(HandlerMethod handlerMethod) {
        var endpoint = new Endpoint(handlerMethod.getBeanType(), handlerMethod.getMethod());
        return policies.computeIfAbsent(
                endpoint, e -> TenantAccessPolicies.resolve(e.handlerType(), e.method()));
    }
}
