package com.atrium.workspace.api;

import com.atrium.tenancy.CallerIdentity;
import com.atrium.tenancy.RequireTenantRole;
import com.atrium.tenancy.Tenant;
import com.atrium.tenancy.TenantContext;
import com.atrium.tenancy.TenantRole;
import com.atrium.workspace.application.WorkspaceService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Workspace management.
 *
 * <p>Listing, reading and creating work from the caller's identity alone. Changing or deleting a
 * workspace is tenant-gated, and the handler acts on the workspace in {@link TenantContext}
 * rather than on the raw path variable.
 */
@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final TenantContext tenantContext;

    public WorkspaceController(WorkspaceService workspaceService, TenantContext tenantContext) {
        this.workspaceService = workspaceService;
        this.tenantContext = tenantContext;
    }

    @GetMapping
    public List<WorkspaceRoleResponse> listWorkspaces(CallerIdentity caller) {
        return workspaceService.listWorkspaces(caller.userId()).stream()
                .map(WorkspaceRoleResponse::from)
                .toList();
    }

    @GetMapping("/{key}")
    public WorkspaceRoleResponse getWorkspace(CallerIdentity caller, @PathVariable UUID key) {
        return WorkspaceRoleResponse.from(workspaceService.getWorkspace(caller.userId(), key));
    }

    @PostMapping
    public ResponseEntity<WorkspaceRoleResponse> createWorkspace(
            CallerIdentity caller, @Valid @RequestBody WorkspaceEditRequest request) {
        var membership = workspaceService.createWorkspace(caller.userId(), request.name(), request.description());
        var body = WorkspaceRoleResponse.from(membership);
        return ResponseEntity.created(URI.create("/api/v1/workspaces/" + body.key())).body(body);
    }

    @PutMapping("/{tenantKey}")
    @RequireTenantRole(TenantRole.OWNER)
    public WorkspaceResponse updateWorkspace(@Valid @RequestBody WorkspaceEditRequest request) {
        Tenant updated = workspaceService.updateWorkspace(
                tenantContext.getCurrentTenant(), request.name(), request.description());
        return WorkspaceResponse.from(updated);
    }

    @DeleteMapping("/{tenantKey}")
    @RequireTenantRole(TenantRole.OWNER)
    public ResponseEntity<Void> deleteWorkspace() {
        workspaceService.deleteWorkspace(tenantContext.getCurrentTenant());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{tenantKey}/context")
    @RequireTenantRole(TenantRole.VIEWER)
    public CurrentWorkspaceResponse currentWorkspace() {
        Tenant tenant = tenantContext.getCurrentTenant();
        String role = tenantContext.getCurrentRole().map(TenantRole::claimValue).orElse(null);
        return new CurrentWorkspaceResponse(tenant.key(), tenant.name(), role);
    }
}
