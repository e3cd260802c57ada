package com.atrium.workspace.api;

import com.atrium.tenancy.AllowAnonymousTenantAccess;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantContext;
import com.atrium.workspace.application.WorkspaceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Setup endpoints for functional test suites, registered only when
 * {@code atrium.test-control.enabled=true}.
 *
 * <p>Anonymous: the workspace comes from the route through {@link AllowAnonymousTenantAccess}, so
 * each handler re-validates that it only touches {@value #TEST_PREFIX} workspaces and users.
 */
@RestController
@RequestMapping("/api/v1/test-control/workspaces")
@ConditionalOnProperty(prefix = "atrium.test-control", name = "enabled", havingValue = "true")
public class TestControlController {

    private static final Logger log = LoggerFactory.getLogger(TestControlController.class);

    public static final String TEST_PREFIX = "__TEST__";

    public record TestWorkspaceRequest(
            @NotBlank @Size(max = 100) String name, @Size(max = 500) String description) {}

    private final WorkspaceService workspaceService;
    private final TenantContext tenantContext;

    public TestControlController(WorkspaceService workspaceService, TenantContext tenantContext) {
        this.workspaceService = workspaceService;
        this.tenantContext = tenantContext;
        log.warn("Test control endpoints are enabled");
    }

    @PostMapping
    public ResponseEntity<WorkspaceResponse> createWorkspace(@Valid @RequestBody TestWorkspaceRequest request) {
        requireTestName("Workspace name", request.name());
        Tenant tenant = workspaceService.createUnownedWorkspace(request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkspaceResponse.from(tenant));
    }

    @DeleteMapping
    public Map<String, Integer> deleteTestWorkspaces() {
        return Map.of("deleted", workspaceService.deleteWorkspacesByNamePrefix(TEST_PREFIX));
    }

    @GetMapping("/{tenantKey}")
    @AllowAnonymousTenantAccess
    public WorkspaceResponse getWorkspace() {
        return WorkspaceResponse.from(currentTestWorkspace());
    }

    @PostMapping("/{tenantKey}/members")
    @AllowAnonymousTenantAccess
    public ResponseEntity<MemberResponse> addMember(@Valid @RequestBody MemberAssignmentRequest request) {
        Tenant tenant = currentTestWorkspace();
        requireTestName("User id", request.userId());
        var assignment = workspaceService.addMember(tenant, request.userId(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(assignment));
    }

    private Tenant currentTestWorkspace() {
        Tenant tenant = tenantContext.getCurrentTenant();
        requireTestName("Workspace name", tenant.name());
        return tenant;
    }

    private static void requireTestName(String what, String value) {
        if (value == null || !value.startsWith(TEST_PREFIX)) {
            throw new TestControlViolationException(
                    "%s must start with '%s'".formatted(what, TEST_PREFIX));
        }
    }
}
