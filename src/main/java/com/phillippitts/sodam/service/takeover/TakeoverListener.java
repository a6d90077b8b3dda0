package com.phillippitts.sodam.service.takeover;

/**
 * Receives takeover transitions. Called on the session's reconciliation thread, exactly once
 * per transition and never concurrently for the same session.
 */
public interface TakeoverListener {

    void onTakeoverStarted(TakeoverSignal cause);

    void onTakeoverEnded(TakeoverSignal cause);
}
