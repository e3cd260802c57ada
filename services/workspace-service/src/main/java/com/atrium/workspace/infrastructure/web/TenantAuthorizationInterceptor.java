package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.AuthorizationDecision;
import com.atrium.tenancy.CallerIdentity;
import com.atrium.tenancy.DenyReason;
import com.atrium.tenancy.RoleClaim;
import com.atrium.tenancy.TenantAccessDispatcher;
import com.atrium.tenancy.TenantAccessPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Authorization stage of the tenant pipeline.
 *
 * <p>Runs the endpoint's {@link TenantAccessPolicy} through the {@link TenantAccessDispatcher}.
 * On Allow the resolved workspace is stored under {@link TenancyRequestAttributes#RESOLVED_TENANT}
 * for {@link TenantContextResolver}. On Deny the request ends here with a problem response that
 * does not say which check failed:
 *
 * <ul>
 *   <li>malformed or unknown workspace: 404
 *   <li>no role, or a role below the minimum: 403
 * </ul>
 *
 * A role-gated endpoint reached without a caller gets 401 before any evaluation.
 */
@Component
public class TenantAuthorizationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TenantAuthorizationInterceptor.class);

    static final String METRIC_NAME = "atrium.tenancy.authorization";

    private final TenantAccessPolicyRegistry policyRegistry;
    private final TenantAccessDispatcher dispatcher;
    private final ProblemResponseWriter problemWriter;
    private final MeterRegistry meterRegistry;

    public TenantAuthorizationInterceptor(
            TenantAccessPolicyRegistry policyRegistry,
            TenantAccessDispatcher dispatcher,
            ProblemResponseWriter problemWriter,
            MeterRegistry meterRegistry) {
        this.policyRegistry = policyRegistry;
        this.dispatcher = dispatcher;
        this.problemWriter = problemWriter;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        Optional<TenantAccessPolicy> found = policyRegistry.policyFor(handlerMethod);
        if (found.isEmpty()) {
            return true;
        }
        TenantAccessPolicy policy = found.get();

        Optional<CallerIdentity> caller = TenancyRequestAttributes.caller(request);
        if (policy.requiresAuthenticatedCaller() && caller.isEmpty()) {
            count(policy, "deny", "UNAUTHENTICATED");
            log.info("Rejecting anonymous request to {} {}", request.getMethod(), request.getRequestURI());
            problemWriter.write(response, ProblemDetails.unauthorized("Authentication is required"));
            return false;
        }

        Set<RoleClaim> claims = caller.map(CallerIdentity::roleClaims).orElse(Set.of());
        AuthorizationDecision decision = dispatcher.authorize(policy, routeParameters(request), claims);

        if (decision.allowed()) {
            count(policy, "allow", "NONE");
            request.setAttribute(TenancyRequestAttributes.RESOLVED_TENANT, decision.tenant());
            return true;
        }

        DenyReason reason = decision.reason();
        count(policy, "deny", reason.name());
        log.info("Denied {} {} for user {}: {}",
                request.getMethod(), request.getRequestURI(),
                caller.map(CallerIdentity::userId).orElse("anonymous"), reason);
        problemWriter.write(response, problemFor(reason));
        return false;
    }

    static ProblemDetail problemFor(DenyReason reason) {
        return switch (reason) {
            case MALFORMED_TENANT_REFERENCE, TENANT_NOT_FOUND -> ProblemDetails.of(
                    HttpStatus.NOT_FOUND, "workspace-not-found", "Workspace Not Found",
                    "The requested workspace was not found");
            case NO_ROLE_FOR_TENANT, INSUFFICIENT_ROLE -> ProblemDetails.of(
                    HttpStatus.FORBIDDEN, "forbidden", "Forbidden",
                    "You do not have access to this workspace");
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> routeParameters(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables instanceof Map ? (Map<String, String>) variables : Map.of();
    }

    private void count(TenantAccessPolicy policy, String outcome, String reason) {
        Counter.builder(METRIC_NAME)
                .description("Tenant authorization decisions")
                .tag("policy", policy.kind().name())
                .tag("outcome", outcome)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
