package com.atrium.workspace.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of create and update requests.
 *
 * @param name display name, up to 100 characters
 * @param description free text, up to 500 characters
 */
public record WorkspaceEditRequest(
        @NotBlank @Size(max = 100) String name, @NotBlank @Size(max = 500) String description) {}
