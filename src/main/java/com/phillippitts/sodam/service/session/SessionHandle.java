package com.phillippitts.sodam.service.session;

import com.phillippitts.sodam.domain.SessionIdentity;
import com.phillippitts.sodam.service.postsession.PostSessionCoordinator;
import com.phillippitts.sodam.service.takeover.TakeoverMonitor;
import com.phillippitts.sodam.service.transcript.TranscriptRecorder;

import java.time.Instant;
import java.util.Optional;

/**
 * Components wired for one live session.
 *
 * @param sessionId orchestrator-assigned id
 * @param roomName room the session runs in
 * @param identity resolved identity
 * @param counterpart participant the agent listens to, empty for everyone
 * @param monitor takeover monitor
 * @param recorder transcript recorder
 * @param coordinator post-session coordinator
 * @param startedAt when the session started
 */
public record SessionHandle(String sessionId,
                            String roomName,
                            SessionIdentity identity,
                            Optional<String> counterpart,
                            TakeoverMonitor monitor,
                            TranscriptRecorder recorder,
                            PostSessionCoordinator coordinator,
                            Instant startedAt) {

    public boolean isTakeoverActive() {
        return monitor.isTakeoverActive();
    }
}
