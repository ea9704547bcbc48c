package com.ewale.ewale.exception;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String sessionId) {
        super("USSD session not found: " + sessionId);
    }
}
