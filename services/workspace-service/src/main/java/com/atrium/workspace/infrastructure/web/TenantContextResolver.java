package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.ResolvedTenant;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantContext;
import com.atrium.tenancy.TenantRepository;
import com.atrium.tenancy.exception.TenantNotFoundException;
import com.atrium.workspace.config.TenancyProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Context stage of the tenant pipeline: turns the {@link ResolvedTenant} published by
 * {@link TenantAuthorizationInterceptor} into the request's {@link TenantContext}.
 *
 * <p>When a workspace was resolved it is loaded and stored in the context before the controller
 * runs, so a controller never observes an unset context on a tenant-gated endpoint. An anonymous
 * grant naming a workspace that does not exist fails with {@link TenantNotFoundException}.
 *
 * <p>A route that carries the workspace key parameter but reached this stage with nothing
 * resolved belongs to an endpoint missing its tenant annotation. It is rejected with 401 rather
 * than served tenant-agnostic. Other unresolved requests pass through untouched.
 */
@Component
public class TenantContextResolver implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);

    public static final String MDC_KEY = "tenantKey";

    private final TenantRepository tenantRepository;
    private final TenantContext tenantContext;
    private final ProblemResponseWriter problemWriter;
    private final String routeParameter;

    public TenantContextResolver(
            TenantRepository tenantRepository,
            TenantContext tenantContext,
            ProblemResponseWriter problemWriter,
            TenancyProperties tenancyProperties) {
        this.tenantRepository = tenantRepository;
        this.tenantContext = tenantContext;
        this.problemWriter = problemWriter;
        this.routeParameter = tenancyProperties.routeParameter();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        Optional<ResolvedTenant> resolved = TenancyRequestAttributes.resolvedTenant(request);
        if (resolved.isEmpty()) {
            if (!hasTenantRoute(request)) {
                return true;
            }
            log.warn("{} {} names a workspace but no tenant policy resolved it",
                    request.getMethod(), request.getRequestURI());
            problemWriter.write(response,
                    ProblemDetails.unauthorized("Tenant authorization is required for this endpoint"));
            return false;
        }
        ResolvedTenant grant = resolved.get();
        Tenant tenant = tenantRepository.findTenantByKey(grant.tenantKey())
                .orElseThrow(() -> new TenantNotFoundException(grant.tenantKey()));

        tenantContext.setCurrentTenant(tenant, grant.role());
        MDC.put(MDC_KEY, tenant.key().toString());
        log.debug("Tenant context set to workspace {} ({})",
                tenant.key(), grant.isAnonymousGrant() ? "anonymous grant" : grant.role());
        return true;
    }

    private boolean hasTenantRoute(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables instanceof Map<?, ?> map && map.containsKey(routeParameter);
    }

    @Override
    public void afterCompletion(
            HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        MDC.remove(MDC_KEY);
    }
}
