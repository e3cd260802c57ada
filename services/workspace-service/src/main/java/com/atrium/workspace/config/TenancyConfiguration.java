package com.atrium.workspace.config;

import com.atrium.tenancy.AnonymousTenantAccessEvaluator;
import com.atrium.tenancy.RoleClaimsProvider;
import com.atrium.tenancy.TenantAccessDispatcher;
import com.atrium.tenancy.TenantContext;
import com.atrium.tenancy.TenantRepository;
import com.atrium.tenancy.TenantRoleEvaluator;
import com.atrium.workspace.infrastructure.identity.IdentityTokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.context.annotation.RequestScope;

/**
 * Wires the framework-neutral tenancy core into the Spring context.
 *
 * <p>{@link TenantContext} is request scoped: each HTTP request gets its own instance behind a
 * scoped proxy, so singletons can inject it and still only ever see the current request's
 * workspace.
 */
@Configuration
public class TenancyConfiguration {

    @Bean
    public TenantRoleEvaluator tenantRoleEvaluator(
            TenancyProperties properties, TenantRepository tenantRepository) {
        return new TenantRoleEvaluator(properties.routeParameter(), tenantRepository);
    }

    @Bean
    public AnonymousTenantAccessEvaluator anonymousTenantAccessEvaluator(
            TenancyProperties properties) {
        return new AnonymousTenantAccessEvaluator(properties.routeParameter());
    }

    @Bean
    public TenantAccessDispatcher tenantAccessDispatcher(
            TenantRoleEvaluator roleEvaluator, AnonymousTenantAccessEvaluator anonymousEvaluator) {
        return new TenantAccessDispatcher(roleEvaluator, anonymousEvaluator);
    }

    @Bean
    public RoleClaimsProvider roleClaimsProvider(TenantRepository tenantRepository) {
        return new RoleClaimsProvider(tenantRepository);
    }

    @Bean
    public IdentityTokenCodec identityTokenCodec(
            ObjectMapper objectMapper, TenancyProperties properties) {
        return new IdentityTokenCodec(objectMapper, properties.claimType());
    }

    @Bean
    @RequestScope
    public TenantContext tenantContext() {
        return new TenantContext();
    }
}
