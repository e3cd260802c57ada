package com.atrium.workspace.api;

import com.atrium.tenancy.RequireTenantRole;
import com.atrium.tenancy.TenantContext;
import com.atrium.tenancy.TenantRole;
import com.atrium.workspace.application.WorkspaceService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Role assignments of a workspace. Viewers may list; only Owners may change membership. */
@RestController
@RequestMapping("/api/v1/workspaces/{tenantKey}/members")
@RequireTenantRole(TenantRole.VIEWER)
public class WorkspaceMemberController {

    private final WorkspaceService workspaceService;
    private final TenantContext tenantContext;

    public WorkspaceMemberController(WorkspaceService workspaceService, TenantContext tenantContext) {
        this.workspaceService = workspaceService;
        this.tenantContext = tenantContext;
    }

    @GetMapping
    public List<MemberResponse> listMembers() {
        return workspaceService.listMembers(tenantContext.getCurrentTenant()).stream()
                .map(MemberResponse::from)
                .toList();
    }

    @PostMapping
    @RequireTenantRole(TenantRole.OWNER)
    public ResponseEntity<MemberResponse> addMember(@Valid @RequestBody MemberAssignmentRequest request) {
        var assignment = workspaceService.addMember(
                tenantContext.getCurrentTenant(), request.userId().strip(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(assignment));
    }

    @DeleteMapping("/{userId}")
    @RequireTenantRole(TenantRole.OWNER)
    public ResponseEntity<Void> removeMember(@PathVariable String userId) {
        workspaceService.removeMember(tenantContext.getCurrentTenant(), userId);
        return ResponseEntity.noContent().build();
    }
}
