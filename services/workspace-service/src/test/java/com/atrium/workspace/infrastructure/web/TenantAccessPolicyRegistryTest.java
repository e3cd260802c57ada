package com.atrium.workspace.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atrium.tenancy.AllowAnonymousTenantAccess;
import com.atrium.tenancy.RequireTenantRole;
import com.atrium.tenancy.TenantAccessPolicy;
import com.atrium.tenancy.TenantRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.StaticApplicationContext;
import org.springframework.web.method.HandlerMethod;

@DisplayName("TenantAccessPolicyRegistry")
class TenantAccessPolicyRegistryTest {

    @RequireTenantRole(TenantRole.VIEWER)
    static class ViewerController {

        public void read() {}

        @RequireTenantRole(TenantRole.OWNER)
        public void write() {}
    }

    static class ConflictingController {

        @RequireTenantRole(TenantRole.OWNER)
        @AllowAnonymousTenantAccess
        public void both() {}
    }

    private final TenantAccessPolicyRegistry registry =
            new TenantAccessPolicyRegistry(new StaticApplicationContext());

    @Test
    @DisplayName("resolves class and method policies per endpoint")
    void resolves() throws Exception {
        var controller = new ViewerController();

        assertThat(registry.policyFor(new HandlerMethod(controller, "read")))
                .contains(TenantAccessPolicy.requireRole(TenantRole.VIEWER));
        assertThat(registry.policyFor(new HandlerMethod(controller, "write")))
                .contains(TenantAccessPolicy.requireRole(TenantRole.OWNER));
    }

    @Test
    @DisplayName("returns the same policy instance on repeated lookups")
    void cached() throws Exception {
        var method = new HandlerMethod(new ViewerController(), "read");

        assertThat(registry.policyFor(method).get()).isSameAs(registry.policyFor(method).get());
    }

    @Test
    @DisplayName("conflicting annotations fail")
    void conflicting() {
        assertThatThrownBy(() -> registry.policyFor(new HandlerMethod(new ConflictingController(), "both")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("startup scan tolerates a context without handler mappings")
    void emptyScan() {
        var context = new StaticApplicationContext();
        context.refresh();

        assertThatCode(() -> new TenantAccessPolicyRegistry(context).afterSingletonsInstantiated())
                .doesNotThrowAnyException();
    }
}
