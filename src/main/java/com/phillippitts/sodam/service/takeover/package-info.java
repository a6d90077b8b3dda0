/**
 * Supervisor takeover detection and agent pause/resume.
 *
 * <p>{@link com.phillippitts.sodam.service.takeover.TakeoverMonitor} merges room events and a
 * periodic participant poll into one serialized stream of
 * {@link com.phillippitts.sodam.service.takeover.TakeoverSignal}s.
 * {@link com.phillippitts.sodam.service.takeover.TakeoverStateMachine} turns the stream into
 * at most one transition per state change, and
 * {@link com.phillippitts.sodam.service.takeover.AgentPauseController} applies each transition
 * to the conversation agent.
 *
 * @since 1.0
 */
package com.phillippitts.sodam.service.takeover;
