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

import java.util.List;

/**
 * Reply to one inbound chat message.
 *
 * @param text
 *            user-visible response
 * @param sessionId
 *            session the reply belongs to
 * @param route
 *            how the reply was produced
 * @param toolsCalled
 *            tool invocations made while producing the reply
 */
public record ChatReply(String text, String sessionId, Route route, List<ToolCallRecord> toolsCalled) {

    public enum Route {
        COMMAND, DETERMINISTIC, ORCHESTRATED, ERROR
    }

    public ChatReply {
        toolsCalled = toolsCalled != null ? List.copyOf(toolsCalled) : List.of();
    }
}
