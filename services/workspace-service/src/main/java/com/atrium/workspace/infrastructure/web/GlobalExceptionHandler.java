package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.exception.DuplicateRoleAssignmentException;
import com.atrium.tenancy.exception.TenancyResourceNotFoundException;
import com.atrium.tenancy.exception.TenantAccessDeniedException;
import com.atrium.tenancy.exception.TenantContextAlreadySetException;
import com.atrium.tenancy.exception.TenantContextNotSetException;
import com.atrium.tenancy.exception.TenantNotFoundException;
import com.atrium.workspace.api.TestControlViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 problems.
 *
 * <p>Tenancy failures keep their status but never their internals: access problems do not say
 * which check failed, and tenant context misuse, a programming error, is reported as an opaque
 * 500 and logged with its stack trace.
 *
 * <pre>
 * {
 *   "type": "https://atrium.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "You do not have access to this workspace",
 *   "timestamp": "2026-01-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TenantNotFoundException.class)
    public ProblemDetail handleTenantNotFound(TenantNotFoundException ex) {
        log.info("Workspace not found: {}", ex.tenantKey());
        return ProblemDetails.of(HttpStatus.NOT_FOUND, "workspace-not-found", "Workspace Not Found",
                "The requested workspace was not found");
    }

    @ExceptionHandler(TenantAccessDeniedException.class)
    public ProblemDetail handleTenantAccessDenied(TenantAccessDeniedException ex) {
        log.info("Access denied: user {} on workspace {}", ex.userId(), ex.tenantKey());
        return ProblemDetails.of(HttpStatus.FORBIDDEN, "forbidden", "Forbidden",
                "You do not have access to this workspace");
    }

    @ExceptionHandler(TenancyResourceNotFoundException.class)
    public ProblemDetail handleResourceNotFound(TenancyResourceNotFoundException ex) {
        log.info("{} not found: {}", ex.resourceType(), ex.getMessage());
        return ProblemDetails.of(HttpStatus.NOT_FOUND, "not-found",
                ex.resourceType() + " Not Found", ex.getMessage());
    }

    @ExceptionHandler(DuplicateRoleAssignmentException.class)
    public ProblemDetail handleDuplicateAssignment(DuplicateRoleAssignmentException ex) {
        log.info("Duplicate role assignment: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.CONFLICT, "duplicate-role-assignment",
                "Duplicate Role Assignment", "The user already has a role in this workspace");
    }

    @ExceptionHandler({TenantContextNotSetException.class, TenantContextAlreadySetException.class})
    public ProblemDetail handleTenantContextMisuse(RuntimeException ex) {
        log.error("Tenant context misuse", ex);
        return internalError();
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ProblemDetail handleAuthenticationRequired(AuthenticationRequiredException ex) {
        return ProblemDetails.unauthorized(ex.getMessage());
    }

    @ExceptionHandler(TestControlViolationException.class)
    public ProblemDetail handleTestControlViolation(TestControlViolationException ex) {
        log.warn("Test control violation: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.FORBIDDEN, "test-control", "Forbidden", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .sorted()
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "validation", "Validation Error", detail);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ProblemDetail handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request",
                "The request could not be read");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return ProblemDetails.of(HttpStatus.NOT_FOUND, "not-found", "Not Found",
                "No endpoint " + ex.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ProblemDetails.of(HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
                "Method Not Allowed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return internalError();
    }

    private static ProblemDetail internalError() {
        return ProblemDetails.of(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred");
    }
}
