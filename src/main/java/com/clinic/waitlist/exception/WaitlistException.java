package com.clinic.waitlist.exception;

/**
 * Base type for failures surfaced to callers of the waitlist core.
 */
public abstract class WaitlistException extends RuntimeException {

    protected WaitlistException(String message) {
        super(message);
    }

    protected WaitlistException(String message, Throwable cause) {
        super(message, cause);
    }
}
