package com.ewale.ewale.exception;

/**
 * Input rejected locally, before any outbound call is made.
 */
public class UssdValidationException extends RuntimeException {
    public UssdValidationException(String message) {
        super(message);
    }
}
