package com.phillippitts.sodam.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for session start-up: counterpart discovery and the agent's first
 * utterance.
 */
@Validated
@ConfigurationProperties(prefix = "sodam.session")
public class SessionProperties {

    /** Identity prefix of automated test callers, preferred as the counterpart. */
    @NotBlank
    private String botIdentityPrefix = "bot-";

    /** How long to wait for a counterpart before listening to everyone. */
    @NotNull
    private Duration discoveryTimeout = Duration.ofSeconds(10);

    /** Snapshot interval while waiting for a counterpart. */
    @NotNull
    private Duration discoveryPollInterval = Duration.ofMillis(200);

    /** First utterance after the agent starts. */
    @NotBlank
    private String greeting = "안녕하세요, 어르신. 오늘 어떻게 지내셨어요?";

    /** Display name published in the agent's participant metadata. */
    private String agentName = "소담이";

    /** Conversation language published in the agent's participant metadata. */
    private String language = "ko";

    public String getBotIdentityPrefix() {
        return botIdentityPrefix;
    }

    public void setBotIdentityPrefix(String botIdentityPrefix) {
        this.botIdentityPrefix = botIdentityPrefix;
    }

    public Duration getDiscoveryTimeout() {
        return discoveryTimeout;
    }

    public void setDiscoveryTimeout(Duration discoveryTimeout) {
        this.discoveryTimeout = discoveryTimeout;
    }

    public Duration getDiscoveryPollInterval() {
        return discoveryPollInterval;
    }

    public void setDiscoveryPollInterval(Duration discoveryPollInterval) {
        this.discoveryPollInterval = discoveryPollInterval;
    }

    public String getGreeting() {
        return greeting;
    }

    public void setGreeting(String greeting) {
        this.greeting = greeting;
    }

    public String getAgentName() {
        return agentName;
    }

    public void setAgentName(String agentName) {
        this.agentName = agentName;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
