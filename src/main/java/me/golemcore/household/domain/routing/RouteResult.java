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

package me.golemcore.household.domain.routing;

import me.golemcore.household.domain.model.Intent;
import me.golemcore.household.domain.model.ToolCallRecord;

import java.util.List;

/**
 * Reply produced by a detector.
 *
 * @param text
 *            user-visible reply
 * @param intent
 *            intent recorded in the context, or {@code null} when nothing was
 *            resolved (disabled server, failed tool)
 * @param toolCalls
 *            tool calls made, in order
 */
public record RouteResult(String text, Intent intent, List<ToolCallRecord> toolCalls) {

    public RouteResult {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static RouteResult explanation(String text) {
        return new RouteResult(text, null, List.of());
    }

    public boolean isResolved() {
        return intent != null;
    }
}
