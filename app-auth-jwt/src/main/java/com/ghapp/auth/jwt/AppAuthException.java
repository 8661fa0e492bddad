package com.ghapp.auth.jwt;

import lombok.Getter;

/**
 * Raised by every part of the App authentication lifecycle; {@link #getKind()} tells callers
 * whether a retry can help.
 */
@Getter
public class AppAuthException extends RuntimeException {

    private final ErrorKind kind;

    public AppAuthException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AppAuthException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
