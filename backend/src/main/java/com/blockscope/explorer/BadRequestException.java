package com.blockscope.explorer;

/**
 * Caller input rejected: malformed address or xpub, feature disabled.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
