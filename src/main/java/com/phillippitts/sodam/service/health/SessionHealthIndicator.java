package com.phillippitts.sodam.service.health;

import com.phillippitts.sodam.service.session.ActiveSessionRegistry;
import com.phillippitts.sodam.service.transcript.TranscriptStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the session worker.
 *
 * <p>Always UP while the context is running; sessions degrade individually rather than taking
 * the worker down. Details:
 * <ul>
 *   <li>activeSessions: sessions currently hosted</li>
 *   <li>takeovers: sessions in which a supervisor is currently speaking</li>
 *   <li>transcriptPersistence: whether transcripts leave the process</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final ActiveSessionRegistry registry;
    private final TranscriptStore transcriptStore;

    public SessionHealthIndicator(ActiveSessionRegistry registry, TranscriptStore transcriptStore) {
        this.registry = registry;
        this.transcriptStore = transcriptStore;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("activeSessions", registry.activeCount())
                .withDetail("takeovers", registry.takeoverCount())
                .withDetail("transcriptPersistence", transcriptStore.isPersistent() ? "redis" : "disabled")
                .build();
    }
}
