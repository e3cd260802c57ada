package com.atrium.workspace.api;

import java.util.UUID;

/**
 * The request's resolved tenant context.
 *
 * @param role the caller's role, or null for an anonymous grant
 */
public record CurrentWorkspaceResponse(UUID key, String name, String role) {}
