package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.config.properties.SessionProperties;
import com.phillippitts.sodam.config.properties.TakeoverProperties;
import com.phillippitts.sodam.domain.ParticipantSnapshot;
import com.phillippitts.sodam.service.room.RoomTransport;
import com.phillippitts.sodam.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the remote participant the agent should listen to.
 *
 * <p>Each snapshot is searched for a participant whose identity starts with the bot prefix
 * (automated test callers), then for the first participant that is not a supervisor. The room
 * is re-checked every {@code pollInterval} until a candidate appears or {@code timeout} elapses.
 * Finding nobody is not an error: the agent then listens to everyone.
 */
@Component
public class CounterpartDiscovery {

    private static final Logger LOG = LogManager.getLogger(CounterpartDiscovery.class);

    private final Duration timeout;
    private final Duration pollInterval;
    private final String botPrefix;
    private final String privilegedPrefix;

    @Autowired
    public CounterpartDiscovery(SessionProperties session, TakeoverProperties takeover) {
        this(session.getDiscoveryTimeout(), session.getDiscoveryPollInterval(),
                session.getBotIdentityPrefix(), takeover.getPrivilegedIdentityPrefix());
    }

    CounterpartDiscovery(Duration timeout, Duration pollInterval, String botPrefix, String privilegedPrefix) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.botPrefix = Objects.requireNonNull(botPrefix, "botPrefix must not be null");
        this.privilegedPrefix = Objects.requireNonNull(privilegedPrefix, "privilegedPrefix must not be null");
    }

    /**
     * Waits for a counterpart. Returns early with empty if the calling thread is interrupted.
     *
     * @return identity of the chosen participant, or empty to listen to everyone
     */
    public Optional<String> discover(RoomTransport room) {
        long t0 = System.nanoTime();
        long deadline = t0 + timeout.toNanos();
        while (true) {
            Optional<String> found = select(room.participants());
            if (found.isPresent()) {
                LOG.info("Counterpart selected: {} (after {} ms)", found.get(), TimeUtils.elapsedMillis(t0));
                return found;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                break;
            }
            long sleepMs = Math.max(1L, Math.min(pollInterval.toMillis(), remainingNanos / TimeUtils.NANOS_PER_MILLI));
            if (!TimeUtils.sleepQuietly(sleepMs)) {
                LOG.debug("Counterpart discovery interrupted");
                return Optional.empty();
            }
        }
        LOG.warn("No counterpart joined within {} ms; listening to all participants", timeout.toMillis());
        return Optional.empty();
    }

    /**
     * Applies the selection priority to one snapshot.
     */
    Optional<String> select(List<ParticipantSnapshot> participants) {
        if (participants == null || participants.isEmpty()) {
            return Optional.empty();
        }
        String firstOther = null;
        for (ParticipantSnapshot p : participants) {
            if (p == null || p.identity().startsWith(privilegedPrefix)) {
                continue;
            }
            if (p.identity().startsWith(botPrefix)) {
                return Optional.of(p.identity());
            }
            if (firstOther == null) {
                firstOther = p.identity();
            }
        }
        return Optional.ofNullable(firstOther);
    }
}
