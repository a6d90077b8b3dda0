package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.Speaker;
import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.testutil.FakeRoomTransport;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RoomTranscriptBroadcasterTest {

    @Test
    void sendsEntryAsJsonOnTopic() {
        FakeRoomTransport room = new FakeRoomTransport("room-1");
        RoomTranscriptBroadcaster broadcaster = new RoomTranscriptBroadcaster(room, "transcript");

        broadcaster.broadcast(new TranscriptEntry(Speaker.AGENT, "안녕하세요", Instant.parse("2024-01-01T00:00:00Z"), true));

        assertThat(room.sentData).hasSize(1);
        String message = room.sentData.get(0);
        assertThat(message).startsWith("transcript:");
        JSONObject json = new JSONObject(message.substring("transcript:".length()));
        assertThat(json.getString("type")).isEqualTo("transcript");
        assertThat(json.getString("speaker")).isEqualTo("agent");
        assertThat(json.getString("text")).isEqualTo("안녕하세요");
        assertThat(json.getBoolean("final")).isTrue();
    }
}
