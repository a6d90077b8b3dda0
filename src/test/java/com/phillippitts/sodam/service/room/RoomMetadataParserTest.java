package com.phillippitts.sodam.service.room;

import com.phillippitts.sodam.domain.CallDirection;
import com.phillippitts.sodam.domain.RoomMetadata;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoomMetadataParserTest {

    @Test
    void parsesAllFields() {
        RoomMetadata m = RoomMetadataParser.parse(
                "{\"wardId\":\"w-1\",\"callId\":\"c-1\",\"direction\":\"outbound\",\"takeover\":true}");

        assertThat(m.wardId()).contains("w-1");
        assertThat(m.callId()).contains("c-1");
        assertThat(m.direction()).contains(CallDirection.OUTBOUND);
        assertThat(m.takeover()).contains(true);
        assertThat(m.hasIdentity()).isTrue();
    }

    @Test
    void absentOrMalformedPayloadIsEmpty() {
        assertThat(RoomMetadataParser.parse(null)).isEqualTo(RoomMetadata.EMPTY);
        assertThat(RoomMetadataParser.parse("   ")).isEqualTo(RoomMetadata.EMPTY);
        assertThat(RoomMetadataParser.parse("{not json")).isEqualTo(RoomMetadata.EMPTY);
        assertThat(RoomMetadataParser.parse("[1,2]")).isEqualTo(RoomMetadata.EMPTY);
        assertThat(RoomMetadataParser.parse("x".repeat(70_000))).isEqualTo(RoomMetadata.EMPTY);
    }

    @Test
    void identityValuesAreKeptVerbatim() {
        RoomMetadata m = RoomMetadataParser.parse("{\"wardId\":\" 42 \",\"callId\":\"call 7\\t\"}");

        assertThat(m.wardId()).contains(" 42 ");
        assertThat(m.callId()).contains("call 7\t");
    }

    @Test
    void wrongTypesAreTreatedAsAbsent() {
        RoomMetadata m = RoomMetadataParser.parse(
                "{\"wardId\":\"  \",\"callId\":{},\"direction\":\"sideways\",\"takeover\":\"true\"}");

        assertThat(m).isEqualTo(RoomMetadata.EMPTY);
    }

    @Test
    void numericWardIdIsAccepted() {
        RoomMetadata m = RoomMetadataParser.parse("{\"wardId\":42,\"callId\":\" c-9 \"}");

        assertThat(m.wardId()).contains("42");
        assertThat(m.callId()).contains("c-9");
        assertThat(m.takeover()).isEmpty();
    }

    @Test
    void takeoverFalseIsPresent() {
        assertThat(RoomMetadataParser.parse("{\"takeover\":false}").takeover()).contains(false);
    }
}
