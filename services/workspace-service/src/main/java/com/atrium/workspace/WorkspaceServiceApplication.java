package com.atrium.workspace;

import com.atrium.workspace.config.TenancyProperties;
import com.atrium.workspace.config.WorkspaceServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Atrium workspace service.
 *
 * <p>Every request passes through the tenant pipeline before a controller runs:
 *
 * <ol>
 *   <li>{@code IdentityAssertionFilter} turns the bearer token into a caller identity
 *   <li>{@code TenantAuthorizationInterceptor} evaluates the endpoint's tenant policy
 *   <li>{@code TenantContextResolver} loads the authorized workspace into the request's
 *       {@link com.atrium.tenancy.TenantContext}
 * </ol>
 */
@SpringBootApplication
@EnableConfigurationProperties({WorkspaceServiceProperties.class, TenancyProperties.class})
public class WorkspaceServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceServiceApplication.class, args);
        log.info("Atrium workspace service started");
    }
}
