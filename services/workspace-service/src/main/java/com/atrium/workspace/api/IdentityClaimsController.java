package com.atrium.workspace.api;

import com.atrium.tenancy.CallerIdentity;
import com.atrium.tenancy.RoleClaimsProvider;
import com.atrium.workspace.config.TenancyProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Claim publication for the identity provider, called when it mints a token. Claims are read
 * from role assignments here and nowhere on the request path.
 */
@RestController
@RequestMapping("/api/v1/me")
public class IdentityClaimsController {

    private final RoleClaimsProvider roleClaimsProvider;
    private final TenancyProperties tenancyProperties;

    public IdentityClaimsController(RoleClaimsProvider roleClaimsProvider, TenancyProperties tenancyProperties) {
        this.roleClaimsProvider = roleClaimsProvider;
        this.tenancyProperties = tenancyProperties;
    }

    @GetMapping("/claims")
    public ClaimsResponse claims(CallerIdentity caller) {
        return new ClaimsResponse(
                caller.userId(),
                tenancyProperties.claimType(),
                roleClaimsProvider.getClaimValues(caller.userId()));
    }
}
