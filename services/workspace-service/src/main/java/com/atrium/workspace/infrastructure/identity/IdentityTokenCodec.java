package com.atrium.workspace.infrastructure.identity;

import com.atrium.tenancy.CallerIdentity;
import com.atrium.tenancy.RoleClaim;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the identity assertion carried in the bearer token.
 *
 * <p>The token is Base64 encoded JSON issued by the identity provider:
 *
 * <pre>{@code
 * {
 *   "sub": "user-123",
 *   "claims": { "tenant_role": ["3f2c...:Owner", "9a1b...:Viewer"] }
 * }
 * }</pre>
 *
 * <p>Signature checks belong to the identity provider; the assertion is trusted as received.
 * Claim values that do not parse are skipped with a warning rather than failing the request.
 */
public class IdentityTokenCodec {

    private static final Logger log = LoggerFactory.getLogger(IdentityTokenCodec.class);

    private static final String SUBJECT = "sub";
    private static final String CLAIMS = "claims";

    private final ObjectMapper objectMapper;
    private final String claimType;

    public IdentityTokenCodec(ObjectMapper objectMapper, String claimType) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        if (claimType == null || claimType.isBlank()) {
            throw new IllegalArgumentException("claimType must not be null or blank");
        }
        this.objectMapper = objectMapper;
        this.claimType = claimType;
    }

    /**
     * Decodes a token into the caller it asserts.
     *
     * @throws InvalidIdentityTokenException if the token is not Base64 JSON or has no subject
     */
    public CallerIdentity decode(String token) {
        JsonNode root;
        try {
            byte[] json = Base64.getDecoder().decode(token);
            root = objectMapper.readTree(json);
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidIdentityTokenException("Identity token is not Base64 encoded JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidIdentityTokenException("Identity token must be a JSON object", null);
        }
        String subject = Optional.ofNullable(root.get(SUBJECT))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(s -> !s.isBlank())
                .orElseThrow(() -> new InvalidIdentityTokenException("Identity token has no subject", null));

        return new CallerIdentity(subject, readRoleClaims(subject, root.path(CLAIMS).path(claimType)));
    }

    /** Encodes a caller the way the identity provider would. */
    public String encode(CallerIdentity identity) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(SUBJECT, identity.userId());
        ArrayNode values = root.putObject(CLAIMS).putArray(claimType);
        identity.roleClaims().stream().map(RoleClaim::toClaimValue).sorted().forEach(values::add);
        try {
            return Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(root));
        } catch (JsonProcessingException e) {
            throw new InvalidIdentityTokenException("Failed to encode identity token", e);
        }
    }

    private Set<RoleClaim> readRoleClaims(String subject, JsonNode values) {
        Set<RoleClaim> claims = new LinkedHashSet<>();
        if (values.isMissingNode() || values.isNull()) {
            return claims;
        }
        if (!values.isArray()) {
            log.warn("Ignoring non-array '{}' claim for user {}", claimType, subject);
            return claims;
        }
        for (JsonNode value : values) {
            Optional<RoleClaim> claim = value.isTextual() ? RoleClaim.parse(value.asText()) : Optional.empty();
            if (claim.isPresent()) {
                claims.add(claim.get());
            } else {
                log.warn("Skipping malformed '{}' claim for user {}: {}", claimType, subject, value);
            }
        }
        return claims;
    }

    /** The bearer token could not be read as an identity assertion. */
    public static class InvalidIdentityTokenException extends RuntimeException {
        public InvalidIdentityTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
