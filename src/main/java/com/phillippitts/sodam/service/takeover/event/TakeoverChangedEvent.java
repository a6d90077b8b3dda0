package com.phillippitts.sodam.service.takeover.event;

import com.phillippitts.sodam.service.takeover.SignalSource;

import java.time.Instant;

/**
 * Emitted once per takeover transition, after the pause or resume side effect ran.
 *
 * @param sessionId session whose state changed
 * @param active new state: true when a supervisor has taken over
 * @param source channel that detected the change
 * @param timestamp when the transition was applied
 */
public record TakeoverChangedEvent(String sessionId, boolean active, SignalSource source, Instant timestamp) {
}
