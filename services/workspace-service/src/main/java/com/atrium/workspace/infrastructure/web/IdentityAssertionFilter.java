package com.atrium.workspace.infrastructure.web;

import com.atrium.tenancy.CallerIdentity;
import com.atrium.workspace.infrastructure.identity.BearerTokenExtractor;
import com.atrium.workspace.infrastructure.identity.IdentityTokenCodec;
import com.atrium.workspace.infrastructure.identity.IdentityTokenCodec.InvalidIdentityTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authentication stage of the tenant pipeline.
 *
 * <p>A request without an {@code Authorization} header continues anonymously. A bearer token is
 * decoded into a {@link CallerIdentity} and published under {@link TenancyRequestAttributes#CALLER}.
 * A token that cannot be decoded ends the request with 401: a caller who tried to authenticate
 * and failed is not treated as anonymous.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class IdentityAssertionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IdentityAssertionFilter.class);

    private final IdentityTokenCodec tokenCodec;
    private final ProblemResponseWriter problemWriter;

    public IdentityAssertionFilter(IdentityTokenCodec tokenCodec, ProblemResponseWriter problemWriter) {
        this.tokenCodec = tokenCodec;
        this.problemWriter = problemWriter;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<String> token = BearerTokenExtractor.extract(header);
        if (token.isEmpty()) {
            log.info("Rejecting request with unsupported Authorization header");
            problemWriter.write(response, ProblemDetails.unauthorized("A bearer token is required"));
            return;
        }

        CallerIdentity caller;
        try {
            caller = tokenCodec.decode(token.get());
        } catch (InvalidIdentityTokenException e) {
            log.info("Rejecting unreadable identity token: {}", e.getMessage());
            problemWriter.write(response, ProblemDetails.unauthorized("The identity token could not be read"));
            return;
        }

        log.debug("Authenticated user {} with {} role claim(s)", caller.userId(), caller.roleClaims().size());
        request.setAttribute(TenancyRequestAttributes.CALLER, caller);
        filterChain.doFilter(request, response);
    }
}
