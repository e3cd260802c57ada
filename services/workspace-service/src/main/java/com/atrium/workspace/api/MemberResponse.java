package com.atrium.workspace.api;

import com.atrium.tenancy.RoleAssignment;

public record MemberResponse(String userId, String role) {

    public static MemberResponse from(RoleAssignment assignment) {
        return new MemberResponse(assignment.userId(), assignment.role().claimValue());
    }
}
