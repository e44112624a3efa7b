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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known tool servers keyed by stable id: the built-in ledgers plus any custom
 * servers configured as JSON.
 */
@Service
@Slf4j
public class ToolServerRegistry {

    public static final String HSA_LEDGER = "hsa_ledger";
    public static final String CHARITABLE_LEDGER = "charitable_ledger";
    public static final String TEST_ADDITION = "test_addition";

    private static final TypeReference<Map<String, Object>> SETTING_FIELD_TYPE = new TypeReference<>() {
    };

    private final AssistantProperties properties;
    private final Map<String, ToolServerDefinition> definitions;

    public ToolServerRegistry(AssistantProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        Map<String, ToolServerDefinition> all = new LinkedHashMap<>();
        builtinDefinitions().forEach(def -> all.put(def.getId(), def));
        loadCustomDefinitions(properties.getMcp().getCustomServersJson(), objectMapper)
                .forEach(def -> all.put(def.getId(), def));
        this.definitions = Collections.unmodifiableMap(all);
        log.info("[Registry] Tool servers: {}", definitions.keySet());
    }

    public Optional<ToolServerDefinition> resolve(String serverId) {
        return Optional.ofNullable(definitions.get(serverId));
    }

    public Collection<ToolServerDefinition> definitions() {
        return definitions.values();
    }

    /**
     * Keeps the known ids of {@code requested}, without duplicates, in request
     * order. {@code null} means "use the defaults": the configured default list,
     * or every default-enabled server when that list is blank.
     */
    public List<String> normalizeEnabledServerIds(List<String> requested) {
        List<String> candidates = requested;
        if (candidates == null) {
            candidates = configuredDefaults();
            if (candidates.isEmpty()) {
                candidates = definitions.values().stream()
                        .filter(ToolServerDefinition::isDefaultEnabled)
                        .map(ToolServerDefinition::getId)
                        .toList();
            }
        }

        Set<String> result = new LinkedHashSet<>();
        for (String id : candidates) {
            if (id != null && definitions.containsKey(id.strip())) {
                result.add(id.strip());
            }
        }
        return new ArrayList<>(result);
    }

    private List<String> configuredDefaults() {
        String raw = properties.getMcp().getDefaultEnabledServers();
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static List<ToolServerDefinition> builtinDefinitions() {
        ToolServerDefinition hsa = ToolServerDefinition.builder()
                .id(HSA_LEDGER)
                .displayName("HSA Ledger")
                .description("Spreadsheet ledger of HSA expenses and reimbursements.")
                .commandPart("python").commandPart("-m").commandPart("household_mcp.hsa_server")
                .workingDirectoryHint("mcp-server")
                .defaultEnabled(true)
                .toolName("get_unreimbursed_balance")
                .toolName("read_ledger_entries")
                .toolName("update_expense_status")
                .requiresConnection("google")
                .settingsSchema(List.of(
                        setting("google_spreadsheet_id", "Google Spreadsheet ID", true, null),
                        setting("google_worksheet_name", "Worksheet Name", true, "HSA_Ledger")))
                .build();

        ToolServerDefinition charitable = ToolServerDefinition.builder()
                .id(CHARITABLE_LEDGER)
                .displayName("Charitable Ledger")
                .description("Spreadsheet ledger of charitable donations by tax year.")
                .commandPart("python").commandPart("-m").commandPart("household_mcp.charitable_server")
                .workingDirectoryHint("mcp-server")
                .defaultEnabled(true)
                .toolName("get_charitable_summary")
                .toolName("read_charitable_ledger_entries")
                .requiresConnection("google")
                .settingsSchema(List.of(
                        setting("charitable_spreadsheet_id", "Charitable Spreadsheet ID", true, null),
                        setting("charitable_worksheet_name", "Worksheet Name", true, "Charitable_Ledger")))
                .build();

        ToolServerDefinition addition = ToolServerDefinition.builder()
                .id(TEST_ADDITION)
                .displayName("Test Addition")
                .description("Minimal tool server with add_numbers(a, b).")
                .commandPart("python").commandPart("-m").commandPart("household_test_mcp.server")
                .workingDirectoryHint("test-mcp-server")
                .defaultEnabled(false)
                .toolName("add_numbers")
                .build();

        return List.of(hsa, charitable, addition);
    }

    private static Map<String, Object> setting(String key, String label, boolean required, String defaultValue) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("key", key);
        field.put("label", label);
        field.put("type", "string");
        field.put("required", required);
        if (defaultValue != null) {
            field.put("default", defaultValue);
        }
        return field;
    }

    /**
     * Entries without an id or a non-empty command are skipped. A malformed
     * document yields no custom servers at all.
     */
    static List<ToolServerDefinition> loadCustomDefinitions(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[Registry] Ignoring custom servers, invalid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.warn("[Registry] Ignoring custom servers, expected a JSON array");
            return List.of();
        }

        List<ToolServerDefinition> result = new ArrayList<>();
        for (JsonNode item : root) {
            if (!item.isObject()) {
                continue;
            }
            String id = item.path("id").asText("").strip();
            List<String> command = nonBlankStrings(item.get("command"));
            if (id.isEmpty() || command.isEmpty()) {
                log.warn("[Registry] Skipping custom server without id or command: {}", item);
                continue;
            }
            ToolServerDefinition.ToolServerDefinitionBuilder builder = ToolServerDefinition.builder()
                    .id(id)
                    .displayName(textOr(item, "name", id))
                    .description(textOr(item, "description", "Custom tool server"))
                    .command(command)
                    .workingDirectoryHint(textOr(item, "server_path", ""))
                    .defaultEnabled(item.path("default_enabled").asBoolean(false))
                    .toolNames(nonBlankStrings(item.get("tools")))
                    .settingsSchema(settingsSchema(item.get("settings_schema"), objectMapper))
                    .source(ToolServerDefinition.SOURCE_CUSTOM);
            JsonNode connection = item.get("requires_connection");
            if (connection != null && connection.isTextual()) {
                builder.requiresConnection(connection.asText());
            }
            result.add(builder.build());
        }
        return result;
    }

    private static String textOr(JsonNode item, String field, String fallback) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return fallback;
        }
        return node.asText();
    }

    // Fields without a key cannot be stored, so they are dropped
    private static List<Map<String, Object>> settingsSchema(JsonNode node, ObjectMapper objectMapper) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Map<String, Object>> fields = new ArrayList<>();
        for (JsonNode field : node) {
            if (field.isObject() && !field.path("key").asText("").isBlank()) {
                fields.add(objectMapper.convertValue(field, SETTING_FIELD_TYPE));
            }
        }
        return fields;
    }

    private static List<String> nonBlankStrings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            String text = value.asText("");
            if (!text.isBlank()) {
                values.add(text);
            }
        }
        return values;
    }
}
