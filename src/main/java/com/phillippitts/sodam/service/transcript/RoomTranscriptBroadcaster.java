package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.service.room.RoomTransport;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sends each entry to the room as a data message, e.g.
 * {@code {"type":"transcript","speaker":"agent","text":"...","timestamp":"...","final":true}}.
 */
public final class RoomTranscriptBroadcaster implements TranscriptBroadcaster {

    private final RoomTransport room;
    private final String topic;

    public RoomTranscriptBroadcaster(RoomTransport room, String topic) {
        this.room = Objects.requireNonNull(room, "room must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    @Override
    public void broadcast(TranscriptEntry entry) {
        room.sendData(topic, toPayload(entry));
    }

    static byte[] toPayload(TranscriptEntry entry) {
        return new JSONObject()
                .put("type", "transcript")
                .put("speaker", entry.speaker().wireName())
                .put("text", entry.text())
                .put("timestamp", entry.timestamp().toString())
                .put("final", entry.isFinal())
                .toString()
                .getBytes(StandardCharsets.UTF_8);
    }
}
