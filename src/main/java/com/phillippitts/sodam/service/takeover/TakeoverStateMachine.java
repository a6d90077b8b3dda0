package com.phillippitts.sodam.service.takeover;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of one session's authoritative takeover state.
 *
 * <p>Every channel's {@link TakeoverSignal} goes through {@link #apply(TakeoverSignal)}, which
 * decides whether the signal causes a transition. At most one transition is reported per
 * actual state change, regardless of how many channels observe it.
 *
 * <p><b>Reconciliation rule:</b>
 * <ul>
 *   <li>Explicit signals ({@link SignalSource#METADATA}) are level-triggered: the flag becomes
 *       the state if it differs from it.</li>
 *   <li>Inferred signals (participant/track events and the poll) are edge-triggered: they only
 *       act when the inferred presence differs from the previous inferred observation, and then
 *       only if the new value also differs from the current state.</li>
 * </ul>
 * An explicit flag therefore holds until either a newer flag arrives or the inferred
 * observation actually changes, and the poll still repairs missed metadata or track events.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * INACTIVE → ACTIVE   (explicit true, or inferred edge absent→present)
 * ACTIVE   → INACTIVE (explicit false, or inferred edge present→absent)
 * </pre>
 *
 * @since 1.0
 */
public final class TakeoverStateMachine {

    /** Result of applying a signal. */
    public enum Transition { NONE, STARTED, ENDED }

    private final Lock lock = new ReentrantLock();
    private boolean active;
    private boolean inferredPresence;

    /**
     * Applies one signal.
     *
     * @param signal candidate presence value
     * @return the transition caused by the signal, or {@link Transition#NONE}
     * @throws NullPointerException if signal is null
     */
    public Transition apply(TakeoverSignal signal) {
        if (signal == null) {
            throw new NullPointerException("signal cannot be null");
        }
        lock.lock();
        try {
            if (!signal.source().isExplicit()) {
                if (signal.present() == inferredPresence) {
                    return Transition.NONE;
                }
                inferredPresence = signal.present();
            }
            if (signal.present() == active) {
                return Transition.NONE;
            }
            active = signal.present();
            return active ? Transition.STARTED : Transition.ENDED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether a supervisor has currently taken over.
     */
    public boolean isActive() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /** Visible for tests */
    boolean inferredPresence() {
        lock.lock();
        try {
            return inferredPresence;
        } finally {
            lock.unlock();
        }
    }
}
