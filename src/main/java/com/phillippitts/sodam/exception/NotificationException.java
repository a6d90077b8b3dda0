package com.phillippitts.sodam.exception;

/**
 * Thrown when a backend notification call fails (transport error or non-2xx status).
 */
public class NotificationException extends SodamException {

    private final String endpoint;

    public NotificationException(String endpoint, String message) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public NotificationException(String endpoint, String message, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
