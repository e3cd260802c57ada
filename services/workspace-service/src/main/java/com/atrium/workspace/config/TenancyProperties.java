package com.atrium.workspace.config;

import com.atrium.tenancy.RoleClaim;
import com.atrium.tenancy.TenantKeys;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tenant pipeline settings, bound from {@code atrium.tenancy.*}.
 *
 * @param routeParameter path variable that carries the workspace key
 * @param claimType token claim type under which role claims are published
 */
@ConfigurationProperties(prefix = "atrium.tenancy")
@Validated
public record TenancyProperties(
        @NotBlank @Pattern(regexp = "[A-Za-z][A-Za-z0-9]*") String routeParameter,
        @NotBlank String claimType) {

    public TenancyProperties {
        if (routeParameter == null || routeParameter.isBlank()) {
            routeParameter = TenantKeys.DEFAULT_ROUTE_PARAMETER;
        }
        if (claimType == null || claimType.isBlank()) {
            claimType = RoleClaim.DEFAULT_CLAIM_TYPE;
        }
    }
}
