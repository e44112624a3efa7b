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

package me.golemcore.household.adapter.outbound.mcp;

import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolFailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the {@code result} member of a {@code tools/call} response into a
 * {@link ToolCallResult}.
 *
 * <p>
 * Text items of {@code content} are joined with newlines into the raw text.
 * The structured payload comes from {@code structuredContent} (an object, or a
 * string holding one) and otherwise from the first text item if it parses as a
 * JSON object.
 */
@Slf4j
public class McpResultParser {

    private static final String NO_OUTPUT = "(no output)";
    private static final int SUMMARY_MAX_LENGTH = 200;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public McpResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ToolCallResult parse(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolCallResult.failure(ToolFailureKind.PROTOCOL_ERROR, "No result from tool: " + toolName);
        }

        List<String> texts = extractTexts(result);
        String rawText = String.join("\n", texts);
        Map<String, Object> payload = extractPayload(result, texts);

        boolean isError = result.path("isError").asBoolean(false);
        if (isError) {
            String error = errorText(payload, rawText);
            ToolCallResult failure = ToolCallResult.failure(ToolFailureKind.EXECUTION_FAILED, error);
            failure.setRawText(rawText);
            failure.setStructuredPayload(payload);
            return failure;
        }

        if (rawText.isEmpty()) {
            rawText = payload != null ? writeJson(payload) : NO_OUTPUT;
        }
        return ToolCallResult.success(rawText, payload, summarize(rawText));
    }

    private List<String> extractTexts(JsonNode result) {
        List<String> texts = new ArrayList<>();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    texts.add(item.get("text").asText());
                }
            }
        }
        return texts;
    }

    private Map<String, Object> extractPayload(JsonNode result, List<String> texts) {
        JsonNode structured = result.get("structuredContent");
        if (structured == null) {
            structured = result.get("structured_content");
        }
        if (structured != null) {
            if (structured.isObject()) {
                return objectMapper.convertValue(structured, MAP_TYPE_REF);
            }
            if (structured.isTextual()) {
                Map<String, Object> parsed = parseObject(structured.asText());
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return texts.isEmpty() ? null : parseObject(texts.get(0));
    }

    private Map<String, Object> parseObject(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return node != null && node.isObject() ? objectMapper.convertValue(node, MAP_TYPE_REF) : null;
        } catch (JsonProcessingException e) {
            log.debug("[McpResult] Text content is not a JSON object: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String errorText(Map<String, Object> payload, String rawText) {
        if (payload != null && payload.get("error") != null) {
            return String.valueOf(payload.get("error"));
        }
        return rawText.isEmpty() ? "Tool reported an error" : rawText;
    }

    private String writeJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.debug("[McpResult] Cannot render payload: {}", e.getOriginalMessage());
            return String.valueOf(payload);
        }
    }

    private static String summarize(String text) {
        String oneLine = text.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= SUMMARY_MAX_LENGTH) {
            return oneLine;
        }
        return oneLine.substring(0, SUMMARY_MAX_LENGTH - 3) + "...";
    }
}
