package com.phillippitts.sodam.service.room;

import com.phillippitts.sodam.domain.ParticipantSnapshot;

import java.util.List;

/**
 * Narrow view of the real-time room the agent has joined.
 *
 * <p>Implementations wrap the transport SDK. Snapshot queries must be cheap and synchronous;
 * {@link #sendData(String, byte[])} is best-effort.
 */
public interface RoomTransport {

    String roomName();

    /** Raw room metadata as delivered by the transport; may be null or blank. */
    String metadata();

    /** Remote participants currently in the room. */
    List<ParticipantSnapshot> participants();

    /**
     * Registers a listener for room events.
     *
     * @return handle that removes the listener when closed
     */
    Subscription subscribe(RoomEventListener listener);

    /** Broadcasts a data message to every participant on the given topic. */
    void sendData(String topic, byte[] payload);

    /** Replaces the local (agent) participant's metadata. */
    void setLocalMetadata(String metadata);

    /** Handle returned by {@link #subscribe(RoomEventListener)}. */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
