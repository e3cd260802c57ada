package com.atrium.workspace.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;
import com.atrium.tenancy.exception.RoleAssignmentNotFoundException;
import com.atrium.tenancy.exception.TenantAccessDeniedException;
import com.atrium.tenancy.exception.TenantContextAlreadySetException;
import com.atrium.tenancy.exception.TenantContextNotSetException;
import com.atrium.tenancy.exception.TenantNotFoundException;
import com.atrium.workspace.api.TestControlViolationException;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final UUID KEY = UUID.fromString("11111111-1111-4111-8111-111111111111");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Test
    @DisplayName("maps TenantNotFoundException to 404")
    void tenantNotFound() {
        ProblemDetail result = handler.handleTenantNotFound(new TenantNotFoundException(KEY));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getTitle()).isEqualTo("Workspace Not Found");
    }

    @Test
    @DisplayName("maps TenantAccessDeniedException to 403 without naming the user")
    void accessDenied() {
        ProblemDetail result =
                handler.handleTenantAccessDenied(new TenantAccessDeniedException("alice", KEY));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).doesNotContain("alice");
    }

    @Test
    @DisplayName("maps a missing role assignment to 404 titled by resource type")
    void assignmentNotFound() {
        ProblemDetail result =
                handler.handleResourceNotFound(new RoleAssignmentNotFoundException("bob", KEY));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getTitle()).isEqualTo("RoleAssignment Not Found");
    }

    @Test
    @DisplayName("maps DuplicateRoleAssignmentException to 409")
    void duplicate() {
        ProblemDetail result =
                handler.handleDuplicateAssignment(new DuplicateRoleAssignmentException("bob", 1L));

        assertThat(result.getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("reports tenant context misuse as an opaque 500")
    void contextMisuse() {
        ProblemDetail notSet = handler.handleTenantContextMisuse(new TenantContextNotSetException());
        ProblemDetail alreadySet = handler.handleTenantContextMisuse(
                new TenantContextAlreadySetException(KEY, UUID.randomUUID()));

        assertThat(notSet.getStatus()).isEqualTo(500);
        assertThat(notSet.getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(alreadySet.getDetail()).doesNotContain(KEY.toString());
    }

    @Test
    @DisplayName("maps AuthenticationRequiredException to 401")
    void authenticationRequired() {
        assertThat(handler.handleAuthenticationRequired(new AuthenticationRequiredException()).getStatus())
                .isEqualTo(401);
    }

    @Test
    @DisplayName("maps TestControlViolationException to 403")
    void testControlViolation() {
        assertThat(handler.handleTestControlViolation(new TestControlViolationException("nope")).getStatus())
                .isEqualTo(403);
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400")
    void illegalArgument() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
    }

    @Test
    @DisplayName("maps anything else to 500")
    void generic() {
        assertThat(handler.handleGeneric(new RuntimeException("boom")).getStatus()).isEqualTo(500);
    }

    @Test
    @DisplayName("problems carry timestamp and correlation ID")
    void enrichment() {
        MDC.put(CorrelationIdFilter.MDC_KEY, "cid-42");

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "cid-42");
    }
}
