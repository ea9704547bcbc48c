package com.ewale.ewale.exception;

public class HubtelApiException extends RuntimeException {

    private final String responseCode;

    public HubtelApiException(String message) {
        this(message, null, null);
    }

    public HubtelApiException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public HubtelApiException(String message, String responseCode, Throwable cause) {
        super(message, cause);
        this.responseCode = responseCode;
    }

    public String getResponseCode() {
        return responseCode;
    }
}
