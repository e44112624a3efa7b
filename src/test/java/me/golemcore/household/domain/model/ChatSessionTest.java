package me.golemcore.household.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ChatSessionTest {

    @Test
    void shouldDropOldestMessagesBeyondLimit() {
        ChatSession session = ChatSession.builder().id("s1").build();
        Instant at = Instant.parse("2026-03-15T10:00:00Z");

        for (int i = 0; i < 5; i++) {
            session.addMessage(Message.builder().role(Message.ROLE_USER).content("m" + i).timestamp(at).build(), 3);
        }

        assertEquals(3, session.getMessages().size());
        assertEquals("m2", session.getMessages().get(0).getContent());
        assertEquals(at, session.getUpdatedAt());
    }
}
