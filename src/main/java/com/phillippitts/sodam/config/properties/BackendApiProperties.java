package com.phillippitts.sodam.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the ops backend (call lookup and post-session notifications).
 */
@Validated
@ConfigurationProperties(prefix = "sodam.api")
public class BackendApiProperties {

    /** Base URL of the backend, e.g. {@code http://backend:3000}. */
    @NotBlank
    private String baseUrl = "http://localhost:3000";

    /** Internal service token sent as {@code Authorization: Bearer ...}; optional. */
    private String internalToken;

    /** Whether identity resolution may ask the backend to map a room name to a call. */
    private boolean lookupEnabled = true;

    /** Timeout for the call lookup request. */
    @NotNull
    private Duration lookupTimeout = Duration.ofSeconds(3);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getInternalToken() {
        return internalToken;
    }

    public void setInternalToken(String internalToken) {
        this.internalToken = internalToken;
    }

    public boolean isLookupEnabled() {
        return lookupEnabled;
    }

    public void setLookupEnabled(boolean lookupEnabled) {
        this.lookupEnabled = lookupEnabled;
    }

    public Duration getLookupTimeout() {
        return lookupTimeout;
    }

    public void setLookupTimeout(Duration lookupTimeout) {
        this.lookupTimeout = lookupTimeout;
    }
}
