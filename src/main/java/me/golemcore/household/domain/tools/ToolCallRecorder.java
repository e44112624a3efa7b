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

package me.golemcore.household.domain.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.model.ToolCallRecord;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.tools.args.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the plain {@link ToolCallRecord}s attached to replies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolCallRecorder {

    private final ObjectMapper objectMapper;

    public ToolCallRecord record(String serverId, String toolName, ToolArguments arguments, ToolCallResult result) {
        return record(serverId, toolName, describe(arguments), result);
    }

    public ToolCallRecord record(String serverId, String toolName, String input, ToolCallResult result) {
        String output = result.isSuccess() ? result.getDisplaySummary() : "error: " + result.getError();
        return new ToolCallRecord(serverId, toolName, input, output);
    }

    public String describe(ToolArguments arguments) {
        Map<String, Object> wire = arguments.toWireMap();
        try {
            return objectMapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            log.debug("[ToolCallRecorder] Cannot render arguments: {}", e.getOriginalMessage());
            return String.valueOf(wire);
        }
    }
}
