package com.phillippitts.sodam.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for transcript capture and persistence.
 */
@Validated
@ConfigurationProperties(prefix = "sodam.transcript")
public class TranscriptProperties {

    /** Maximum entries kept in memory per session; oldest are evicted beyond this. */
    @Positive
    private final int capacity;

    /**
     * Redis connection URL, e.g. {@code redis://redis:6379/0}. When blank, transcripts are kept
     * in memory only.
     */
    private final String redisUrl;

    /** Expiry refreshed on the stored transcript list after every append. */
    private final Duration ttl;

    /** Whether entries are broadcast to the room as data messages. */
    private final boolean broadcastEnabled;

    /** Data-message topic used for live transcript display. */
    private final String broadcastTopic;

    /** How long session teardown waits for pending store writes before notifying the backend. */
    private final Duration flushTimeout;

    @ConstructorBinding
    public TranscriptProperties(Integer capacity, String redisUrl, Duration ttl, Boolean broadcastEnabled,
                                String broadcastTopic, Duration flushTimeout) {
        this.capacity = capacity == null ? 500 : capacity;
        this.redisUrl = redisUrl == null ? "" : redisUrl.trim();
        this.ttl = ttl == null ? Duration.ofHours(24) : ttl;
        this.broadcastEnabled = broadcastEnabled == null || broadcastEnabled;
        this.broadcastTopic = broadcastTopic == null || broadcastTopic.isBlank() ? "transcript" : broadcastTopic;
        this.flushTimeout = flushTimeout == null ? Duration.ofSeconds(2) : flushTimeout;
    }

    /**
     * Defaults for tests and programmatic construction.
     */
    public TranscriptProperties() {
        this(null, null, null, null, null, null);
    }

    public int getCapacity() {
        return capacity;
    }

    public String getRedisUrl() {
        return redisUrl;
    }

    public boolean isPersistenceEnabled() {
        return !redisUrl.isEmpty();
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isBroadcastEnabled() {
        return broadcastEnabled;
    }

    public String getBroadcastTopic() {
        return broadcastTopic;
    }

    public Duration getFlushTimeout() {
        return flushTimeout;
    }
}
