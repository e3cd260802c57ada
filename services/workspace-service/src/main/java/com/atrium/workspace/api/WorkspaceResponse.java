package com.atrium.workspace.api;

import com.atrium.tenancy.Tenant;
import java.time.Instant;
import java.util.UUID;

/** A workspace as returned by the API. The internal id never leaves the service. */
public record WorkspaceResponse(UUID key, String name, String description, Instant createdAt) {

    public static WorkspaceResponse from(Tenant tenant) {
        return new WorkspaceResponse(tenant.key(), tenant.name(), tenant.description(), tenant.createdAt());
    }
}
