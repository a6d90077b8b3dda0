package com.phillippitts.sodam.service.room;

/**
 * Discrete notifications delivered by the room transport.
 *
 * <p>Delivery is not guaranteed to be exhaustive; consumers that need a reliable view pair
 * these events with periodic snapshot polling.
 */
public sealed interface RoomEvent permits RoomEvent.ParticipantJoined, RoomEvent.ParticipantLeft,
        RoomEvent.TrackPublished, RoomEvent.TrackUnpublished, RoomEvent.RoomMetadataChanged {

    enum TrackKind { AUDIO, VIDEO, DATA }

    record ParticipantJoined(String identity) implements RoomEvent {
    }

    record ParticipantLeft(String identity) implements RoomEvent {
    }

    record TrackPublished(String identity, TrackKind kind) implements RoomEvent {
    }

    record TrackUnpublished(String identity, TrackKind kind) implements RoomEvent {
    }

    /** Carries the new raw metadata string; may be null or malformed. */
    record RoomMetadataChanged(String metadata) implements RoomEvent {
    }
}
