package com.phillippitts.sodam.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void sodamExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SodamException ex = new SodamException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void sessionStartupExceptionShouldIncludeSetting() {
        SessionStartupException ex = new SessionStartupException("sodam.api.base-url", "URL is required");

        assertThat(ex.getMessage()).contains("URL is required").contains("sodam.api.base-url");
        assertThat(ex.getSetting()).isEqualTo("sodam.api.base-url");
    }

    @Test
    void transcriptStoreExceptionShouldIncludeCallId() {
        RuntimeException cause = new RuntimeException("connection refused");
        TranscriptStoreException ex = new TranscriptStoreException("c-1", "append failed", cause);

        assertThat(ex.getMessage()).contains("c-1");
        assertThat(ex.getCallId()).isEqualTo("c-1");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void notificationExceptionShouldIncludeEndpoint() {
        NotificationException ex = new NotificationException("/v1/rag/index", "Backend POST failed");

        assertThat(ex.getMessage()).contains("/v1/rag/index");
        assertThat(ex.getEndpoint()).isEqualTo("/v1/rag/index");
    }

    @Test
    void allExceptionsShouldBeRuntimeExceptions() {
        assertThat(new SodamException("test")).isInstanceOf(RuntimeException.class);
        assertThat(new SessionStartupException("s", "m")).isInstanceOf(SodamException.class);
        assertThat(new TranscriptStoreException("c", "m", null)).isInstanceOf(SodamException.class);
        assertThat(new NotificationException("e", "m")).isInstanceOf(SodamException.class);
    }
}
