package com.atrium.workspace.config;

import com.atrium.workspace.infrastructure.web.CallerIdentityArgumentResolver;
import com.atrium.workspace.infrastructure.web.TenantAuthorizationInterceptor;
import com.atrium.workspace.infrastructure.web.TenantContextResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: tenant pipeline interceptors, argument resolvers and CORS.
 *
 * <p>Interceptor order is fixed. Authorization must publish the resolved workspace before the
 * context resolver reads it, and both run after the identity filter.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final int AUTHORIZATION_ORDER = 0;
    static final int CONTEXT_RESOLUTION_ORDER = 10;

    private final TenantAuthorizationInterceptor authorizationInterceptor;
    private final TenantContextResolver tenantContextResolver;
    private final CallerIdentityArgumentResolver callerIdentityArgumentResolver;

    public WebConfig(
            TenantAuthorizationInterceptor authorizationInterceptor,
            TenantContextResolver tenantContextResolver,
            CallerIdentityArgumentResolver callerIdentityArgumentResolver) {
        this.authorizationInterceptor = authorizationInterceptor;
        this.tenantContextResolver = tenantContextResolver;
        this.callerIdentityArgumentResolver = callerIdentityArgumentResolver;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authorizationInterceptor)
                .addPathPatterns("/api/**")
                .order(AUTHORIZATION_ORDER);
        registry.addInterceptor(tenantContextResolver)
                .addPathPatterns("/api/**")
                .order(CONTEXT_RESOLUTION_ORDER);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(callerIdentityArgumentResolver);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local development frontends only; deployments override via a gateway.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
