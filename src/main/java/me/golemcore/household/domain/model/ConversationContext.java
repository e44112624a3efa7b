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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session state threaded across turns for follow-up resolution.
 *
 * <p>
 * Not thread-safe. Callers serialize access per session, see
 * {@code ChatService}.
 */
public class ConversationContext {

    private Intent lastIntent;
    private final Map<Intent, IntentResult> lastResultByIntent = new EnumMap<>(Intent.class);
    private List<String> enabledToolServerIds = new ArrayList<>();

    /**
     * Result of a resolved query, kept for follow-ups.
     */
    public record IntentResult(Instant timestamp, Map<String, Object> payload) {
    }

    public Optional<Intent> getLastIntent() {
        return Optional.ofNullable(lastIntent);
    }

    public Optional<IntentResult> getLastResult(Intent intent) {
        return Optional.ofNullable(lastResultByIntent.get(intent));
    }

    /**
     * Stores a successful result and makes its intent the latest one.
     */
    public void recordResult(Intent intent, Map<String, Object> payload, Instant at) {
        lastResultByIntent.put(intent, new IntentResult(at, payload != null ? payload : Map.of()));
        lastIntent = intent;
    }

    /**
     * True when {@code intent} is the latest intent and its result is no older
     * than {@code window} at {@code now}.
     */
    public boolean isRecentLastIntent(Intent intent, Instant now, Duration window) {
        if (lastIntent != intent) {
            return false;
        }
        IntentResult result = lastResultByIntent.get(intent);
        if (result == null) {
            return false;
        }
        Duration age = Duration.between(result.timestamp(), now);
        return !age.isNegative() && age.compareTo(window) <= 0;
    }

    public List<String> getEnabledToolServerIds() {
        return Collections.unmodifiableList(enabledToolServerIds);
    }

    public void setEnabledToolServerIds(List<String> serverIds) {
        this.enabledToolServerIds = serverIds != null ? new ArrayList<>(serverIds) : new ArrayList<>();
    }

    public boolean isServerEnabled(String serverId) {
        return enabledToolServerIds.contains(serverId);
    }

    /**
     * Forgets every remembered result. Enabled servers are kept.
     */
    public void clear() {
        lastIntent = null;
        lastResultByIntent.clear();
    }
}
