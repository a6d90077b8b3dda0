package com.phillippitts.sodam.service.takeover;

import java.util.Objects;

/**
 * Candidate supervisor-presence value pushed by one channel into the reconciliation point.
 *
 * @param source channel that computed the value
 * @param present whether that channel sees a supervisor actively taking over
 */
public record TakeoverSignal(SignalSource source, boolean present) {

    public TakeoverSignal {
        Objects.requireNonNull(source, "source");
    }
}
