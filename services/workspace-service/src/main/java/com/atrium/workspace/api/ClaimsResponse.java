package com.atrium.workspace.api;

import java.util.List;

/**
 * Role claims to embed in a user's token.
 *
 * @param claimType claim type the values are published under
 * @param values claim values in {@code "<tenantKey>:<Role>"} form
 */
public record ClaimsResponse(String userId, String claimType, List<String> values) {}
