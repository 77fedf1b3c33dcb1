package com.securefile.core.script;

/**
 * A path typed or picked by the user was rejected before any script was started.
 */
public final class ValidationException extends Exception {

    public enum Reason {
        MISSING,
        INVALID
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
