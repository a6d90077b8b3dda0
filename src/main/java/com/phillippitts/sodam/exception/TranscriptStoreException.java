package com.phillippitts.sodam.exception;

/**
 * Thrown by a transcript store when a write fails.
 * Callers on the session hot path catch and log it; it never ends a session.
 */
public class TranscriptStoreException extends SodamException {

    private final String callId;

    public TranscriptStoreException(String callId, String message, Throwable cause) {
        super(message + " (call: " + callId + ")", cause);
        this.callId = callId;
    }

    public String getCallId() {
        return callId;
    }
}
