package com.atrium.tenancy;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Parsing of workspace keys as they appear in routes and claims.
 * <p>
 * A workspace key is a canonical UUID ({@code 8-4-4-4-12} hex digits). {@link UUID#fromString}
 * alone is too lenient (it accepts "1-2-3-4-5"), so the shape is checked first. The raw value is
 * matched as given: surrounding whitespace makes it malformed.
 */
public final class TenantKeys {

    /** Default name of the path variable carrying the workspace key. */
    public static final String DEFAULT_ROUTE_PARAMETER = "tenantKey";

    private static final Pattern CANONICAL_UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private TenantKeys() {
        // utility class
    }

    /**
     * Parses a workspace key.
     *
     * @param raw the raw string (may be null)
     * @return the key, or empty if missing or not a canonical UUID
     */
    public static Optional<UUID> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (!CANONICAL_UUID.matcher(raw).matches()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(raw));
    }

    /**
     * Reads the route tenant reference from a request's path variables.
     *
     * @param routeParams    path variables of the matched route (may be null)
     * @param parameterName  name of the workspace key variable
     * @return the key, or empty if absent or malformed
     */
    public static Optional<UUID> fromRoute(Map<String, String> routeParams, String parameterName) {
        if (routeParams == null) {
            return Optional.empty();
        }
        return parse(routeParams.get(parameterName));
    }
}
