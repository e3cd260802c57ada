package com.atrium.workspace.infrastructure.web;

/** The endpoint needs an authenticated caller and the request has none. */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException() {
        super("Authentication is required");
    }
}
