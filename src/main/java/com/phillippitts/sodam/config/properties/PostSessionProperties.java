package com.phillippitts.sodam.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for post-session notification work.
 */
@Validated
@ConfigurationProperties(prefix = "sodam.post-session")
public class PostSessionProperties {

    /** Overall deadline for the whole task set. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /** Per-call timeout for the call-ended notification. */
    @NotNull
    private Duration callEndedTimeout = Duration.ofSeconds(3);

    /** Per-call timeout for the call-analysis trigger. */
    @NotNull
    private Duration callAnalysisTimeout = Duration.ofSeconds(5);

    /** Per-call timeout for the RAG indexing trigger. */
    @NotNull
    private Duration ragIndexingTimeout = Duration.ofSeconds(5);

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getCallEndedTimeout() {
        return callEndedTimeout;
    }

    public void setCallEndedTimeout(Duration callEndedTimeout) {
        this.callEndedTimeout = callEndedTimeout;
    }

    public Duration getCallAnalysisTimeout() {
        return callAnalysisTimeout;
    }

    public void setCallAnalysisTimeout(Duration callAnalysisTimeout) {
        this.callAnalysisTimeout = callAnalysisTimeout;
    }

    public Duration getRagIndexingTimeout() {
        return ragIndexingTimeout;
    }

    public void setRagIndexingTimeout(Duration ragIndexingTimeout) {
        this.ragIndexingTimeout = ragIndexingTimeout;
    }
}
