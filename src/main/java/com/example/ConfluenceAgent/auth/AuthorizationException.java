package com.example.ConfluenceAgent.auth;

/**
 * Raised when the external authorization provider cannot deliver an access token.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
