package com.atrium.tenancy;

import java.time.Instant;
import java.util.UUID;

/**
 * A workspace: an isolated data partition.
 *
 * @param id          internal database identity, used to filter workspace-scoped rows
 * @param key         public key that appears in routes and claims
 * @param name        display name
 * @param description free text description
 * @param createdAt   creation timestamp
 */
public record Tenant(long id, UUID key, String name, String description, Instant createdAt) {

    public Tenant {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
    }

    public Tenant withDetails(String newName, String newDescription) {
        return new Tenant(id, key, newName, newDescription, createdAt);
    }
}
