package com.phillippitts.sodam.config;

import com.phillippitts.sodam.config.properties.BackendApiProperties;
import com.phillippitts.sodam.config.properties.PostSessionProperties;
import com.phillippitts.sodam.config.properties.SessionProperties;
import com.phillippitts.sodam.config.properties.TakeoverProperties;
import com.phillippitts.sodam.config.properties.TranscriptProperties;
import com.phillippitts.sodam.exception.SessionStartupException;
import com.phillippitts.sodam.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Validates the worker's required configuration before any session is accepted.
 *
 * Fail-fast philosophy: abort application startup with clear, actionable errors
 * if the backend or Redis URLs are malformed, or timeouts are unusable. A session
 * cannot safely begin without these.
 */
@Component
@ConditionalOnProperty(name = "sodam.validation.enabled", havingValue = "true", matchIfMissing = true)
class StartupValidationService {

    private static final Logger LOG = LogManager.getLogger(StartupValidationService.class);

    private final SessionProperties session;
    private final BackendApiProperties api;
    private final TranscriptProperties transcript;
    private final TakeoverProperties takeover;
    private final PostSessionProperties postSession;

    StartupValidationService(SessionProperties session,
                             BackendApiProperties api,
                             TranscriptProperties transcript,
                             TakeoverProperties takeover,
                             PostSessionProperties postSession) {
        this.session = session;
        this.api = api;
        this.transcript = transcript;
        this.takeover = takeover;
        this.postSession = postSession;
    }

    @PostConstruct
    void validateAllOnStartup() {
        LOG.info("Validating agent configuration...");

        validateUrl("sodam.api.base-url", api.getBaseUrl(), Set.of("http", "https"));
        if (transcript.isPersistenceEnabled()) {
            validateUrl("sodam.transcript.redis-url", transcript.getRedisUrl(), Set.of("redis", "rediss"));
        }
        validatePositive("sodam.takeover.poll-interval", takeover.getPollInterval());
        validatePositive("sodam.post-session.timeout", postSession.getTimeout());
        validatePositive("sodam.session.discovery-timeout", session.getDiscoveryTimeout());
        validatePositive("sodam.session.discovery-poll-interval", session.getDiscoveryPollInterval());

        LOG.info("Configuration valid: api='{}', token={}, transcriptPersistence={}",
                api.getBaseUrl(), LogSanitizer.maskToken(api.getInternalToken()),
                transcript.isPersistenceEnabled());
    }

    // Visible for tests
    static void validateUrl(String setting, String value, Set<String> schemes) {
        if (value == null || value.isBlank()) {
            throw new SessionStartupException(setting, "URL is required");
        }
        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new SessionStartupException(setting, "Malformed URL '" + value + "'", e);
        }
        if (uri.getScheme() == null || !schemes.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new SessionStartupException(setting,
                    "URL must start with one of " + schemes + "://, got: " + value);
        }
        if (uri.getHost() == null) {
            throw new SessionStartupException(setting, "URL has no host: " + value);
        }
    }

    // Visible for tests
    static void validatePositive(String setting, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new SessionStartupException(setting, "Duration must be positive, got: " + value);
        }
    }
}
