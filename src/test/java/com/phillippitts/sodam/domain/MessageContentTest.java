package com.phillippitts.sodam.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageContentTest {

    @Test
    void textIsTrimmed() {
        assertThat(MessageContent.text("  안녕하세요 ").normalize()).isEqualTo("안녕하세요");
        assertThat(MessageContent.text(null).normalize()).isEmpty();
    }

    @Test
    void fragmentsKeepTextOnlyJoinedWithSpace() {
        MessageContent content = MessageContent.fragments(List.of(
                new MessageContent.Text("오늘 "),
                new MessageContent.Opaque("audio"),
                new MessageContent.Text("   "),
                new MessageContent.Text("날씨가 좋네요")));

        assertThat(content.normalize()).isEqualTo("오늘 날씨가 좋네요");
    }

    @Test
    void fragmentsWithoutTextNormalizeToEmpty() {
        assertThat(MessageContent.fragments(List.of(new MessageContent.Opaque("image"))).normalize()).isEmpty();
        assertThat(MessageContent.fragments(List.of()).normalize()).isEmpty();
    }
}
