package com.phillippitts.sodam.exception;

/**
 * Thrown when a resource the worker needs before accepting sessions is missing or invalid.
 * This is the only error category allowed to abort the process.
 */
public class SessionStartupException extends SodamException {

    private final String setting;

    public SessionStartupException(String setting, String message) {
        super(message + " (setting: " + setting + ")");
        this.setting = setting;
    }

    public SessionStartupException(String setting, String message, Throwable cause) {
        super(message + " (setting: " + setting + ")", cause);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
