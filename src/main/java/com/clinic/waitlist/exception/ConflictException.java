package com.clinic.waitlist.exception;

/**
 * The current state of a slot or patient no longer allows the requested transition.
 * Callers re-read state and decide again; the core never retries on their behalf.
 */
public class ConflictException extends WaitlistException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
