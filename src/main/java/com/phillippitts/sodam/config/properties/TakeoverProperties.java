package com.phillippitts.sodam.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for supervisor takeover detection.
 */
@Validated
@ConfigurationProperties(prefix = "sodam.takeover")
public class TakeoverProperties {

    /** Interval of the participant poll that backs up event delivery. */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(2);

    /** Identity prefix reserved for supervisors. */
    @NotBlank
    private String privilegedIdentityPrefix = "admin_";

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getPrivilegedIdentityPrefix() {
        return privilegedIdentityPrefix;
    }

    public void setPrivilegedIdentityPrefix(String privilegedIdentityPrefix) {
        this.privilegedIdentityPrefix = privilegedIdentityPrefix;
    }
}
