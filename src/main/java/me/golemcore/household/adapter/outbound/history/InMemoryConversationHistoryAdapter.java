/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.household.adapter.outbound.history;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.model.ChatSession;
import me.golemcore.household.port.outbound.ConversationHistoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps chat sessions in memory for the lifetime of the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryConversationHistoryAdapter implements ConversationHistoryPort {

    private final Clock clock;
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Override
    public ChatSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            ChatSession session = ChatSession.builder()
                    .id(id)
                    .createdAt(clock.instant())
                    .updatedAt(clock.instant())
                    .build();
            log.info("Created new session: {}", id);
            return session;
        });
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void save(ChatSession session) {
        session.setUpdatedAt(clock.instant());
        sessions.put(session.getId(), session);
        log.debug("Saved session: {}", session.getId());
    }

    @Override
    public void delete(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Deleted session: {}", sessionId);
        }
    }
}
