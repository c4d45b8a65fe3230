package com.clinic.waitlist.exception;

/**
 * Malformed input, rejected before anything is written.
 */
public class ValidationException extends WaitlistException {

    public ValidationException(String message) {
        super(message);
    }
}
