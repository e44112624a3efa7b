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

package me.golemcore.household.domain.loop;

import me.golemcore.household.domain.model.ToolCallRecord;

import java.util.List;

/**
 * Outcome of one orchestration run.
 *
 * @param reply
 *            final model text, or the fixed limit message
 * @param rounds
 *            model calls made
 * @param toolCalls
 *            every tool call executed, in order
 * @param roundLimitReached
 *            true when the run ended because the round budget ran out
 */
public record OrchestrationResult(String reply, int rounds, List<ToolCallRecord> toolCalls,
        boolean roundLimitReached) {

    public OrchestrationResult {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }
}
