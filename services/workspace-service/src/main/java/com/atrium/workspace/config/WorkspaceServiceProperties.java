package com.atrium.workspace.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code atrium.service.*}.
 *
 * <pre>
 * atrium:
 *   service:
 *     name: workspace-service
 *     environment: production
 *     description: Workspace API
 * </pre>
 *
 * @param name service name, tagged on every meter. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description free text published under {@code service} on {@code /actuator/info}
 */
@ConfigurationProperties(prefix = "atrium.service")
@Validated
public record WorkspaceServiceProperties(
        @NotBlank String name, String environment, String description) {

    /** Fills defaults before Bean Validation runs. */
    public WorkspaceServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
