package com.atrium.workspace.infrastructure.web;

import java.net.URI;
import java.time.Instant;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds RFC 7807 problems in the service's house format: a typed URI, a title, and the
 * {@code timestamp} and {@code correlationId} properties support needs to find the log lines.
 */
public final class ProblemDetails {

    private static final String TYPE_BASE = "https://atrium.dev/errors/";

    private ProblemDetails() {
        // utility class
    }

    public static ProblemDetail of(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }

    /** 401 for requests that need a caller but carry no usable identity. */
    public static ProblemDetail unauthorized(String detail) {
        return of(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized", detail);
    }
}
