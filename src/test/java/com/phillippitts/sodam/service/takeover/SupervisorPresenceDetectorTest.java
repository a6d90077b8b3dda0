package com.phillippitts.sodam.service.takeover;

import com.phillippitts.sodam.domain.ParticipantSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupervisorPresenceDetectorTest {

    private final SupervisorPresenceDetector detector = new SupervisorPresenceDetector("admin_");

    @Test
    void privilegedParticipantPublishingAudioIsPresent() {
        assertThat(detector.isSupervisorPresent(List.of(
                new ParticipantSnapshot("ward-7", 1),
                new ParticipantSnapshot("admin_1", 1)))).isTrue();
    }

    @Test
    void connectedButSilentSupervisorIsNotPresent() {
        assertThat(detector.isSupervisorPresent(List.of(new ParticipantSnapshot("admin_1", 0)))).isFalse();
    }

    @Test
    void nonPrivilegedPublisherIsNotASupervisor() {
        assertThat(detector.isSupervisorPresent(List.of(new ParticipantSnapshot("ward-admin_1", 2)))).isFalse();
    }

    @Test
    void excludedIdentityIsIgnored() {
        List<ParticipantSnapshot> snapshot = List.of(new ParticipantSnapshot("admin_1", 1));
        assertThat(detector.isSupervisorPresentExcluding(snapshot, "admin_1")).isFalse();
        assertThat(detector.isSupervisorPresentExcluding(snapshot, "admin_2")).isTrue();
    }

    @Test
    void nullSnapshotMeansAbsent() {
        assertThat(detector.isSupervisorPresent(null)).isFalse();
    }

    @Test
    void rejectsEmptyPrefix() {
        assertThatThrownBy(() -> new SupervisorPresenceDetector(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
