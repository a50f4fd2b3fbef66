package com.heronix.devicegate.exception;

/**
 * Exception thrown when no unique auth token value could be generated.
 */
public class TokenGenerationException extends RuntimeException {

    public TokenGenerationException(String message) {
        super(message);
    }

    public TokenGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
