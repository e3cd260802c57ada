package com.atrium.workspace.api;

import com.atrium.tenancy.TenantRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Grants {@code role} in the workspace to {@code userId}. */
public record MemberAssignmentRequest(
        @NotBlank @Size(max = 255) String userId, @NotNull TenantRole role) {}
