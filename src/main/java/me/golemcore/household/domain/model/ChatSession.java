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

package me.golemcore.household.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A chat session: bounded message history plus the context used to resolve
 * follow-up questions.
 */
@Data
@Builder
public class ChatSession {

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private ConversationContext context = new ConversationContext();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a message and drops the oldest ones beyond {@code maxHistory}.
     */
    public void addMessage(Message message, int maxHistory) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        int overflow = messages.size() - maxHistory;
        if (maxHistory > 0 && overflow > 0) {
            messages.subList(0, overflow).clear();
        }
        this.updatedAt = message.getTimestamp() != null ? message.getTimestamp() : Instant.now();
    }

    /**
     * Forgets history and remembered results. Enabled servers survive.
     */
    public void reset() {
        messages.clear();
        context.clear();
    }
}
