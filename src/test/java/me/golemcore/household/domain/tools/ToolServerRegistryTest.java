package me.golemcore.household.domain.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.model.ToolServerDefinition;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolServerRegistryTest {

    private static final String CUSTOM_JSON = """
            [
              {"id": "budget", "name": "Budget Sheet", "command": ["node", "budget.js"],
               "server_path": "/srv/budget", "tools": ["get_budget"], "default_enabled": true},
              {"id": "", "command": ["ignored"]},
              {"id": "no_command", "command": []}
            ]
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AssistantProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
    }

    private ToolServerRegistry registry() {
        return new ToolServerRegistry(properties, objectMapper);
    }

    @Test
    void shouldExposeBuiltinServers() {
        ToolServerRegistry registry = registry();

        ToolServerDefinition hsa = registry.resolve(ToolServerRegistry.HSA_LEDGER).orElseThrow();
        assertEquals(List.of("python", "-m", "household_mcp.hsa_server"), hsa.getCommand());
        assertTrue(hsa.exposes("read_ledger_entries"));
        assertTrue(hsa.isDefaultEnabled());
        assertFalse(registry.resolve(ToolServerRegistry.TEST_ADDITION).orElseThrow().isDefaultEnabled());
    }

    @Test
    void shouldDefaultToDefaultEnabledServers() {
        assertEquals(List.of(ToolServerRegistry.HSA_LEDGER, ToolServerRegistry.CHARITABLE_LEDGER),
                registry().normalizeEnabledServerIds(null));
    }

    @Test
    void shouldUseConfiguredDefaults() {
        properties.getMcp().setDefaultEnabledServers(" test_addition , hsa_ledger ");

        assertEquals(List.of(ToolServerRegistry.TEST_ADDITION, ToolServerRegistry.HSA_LEDGER),
                registry().normalizeEnabledServerIds(null));
    }

    @Test
    void shouldDropUnknownAndDuplicateIdsKeepingOrder() {
        List<String> requested = Arrays.asList("charitable_ledger", "ghost", null, "hsa_ledger", "charitable_ledger");

        assertEquals(List.of(ToolServerRegistry.CHARITABLE_LEDGER, ToolServerRegistry.HSA_LEDGER),
                registry().normalizeEnabledServerIds(requested));
    }

    @Test
    void shouldAllowDisablingEverything() {
        assertTrue(registry().normalizeEnabledServerIds(List.of()).isEmpty());
    }

    @Test
    void shouldLoadValidCustomServersOnly() {
        properties.getMcp().setCustomServersJson(CUSTOM_JSON);
        ToolServerRegistry registry = registry();

        ToolServerDefinition budget = registry.resolve("budget").orElseThrow();
        assertEquals("Budget Sheet", budget.getDisplayName());
        assertEquals(ToolServerDefinition.SOURCE_CUSTOM, budget.getSource());
        assertEquals("/srv/budget", budget.getWorkingDirectoryHint());
        assertEquals(List.of("get_budget"), budget.getToolNames());
        assertFalse(registry.resolve("no_command").isPresent());
        assertEquals(4, registry.definitions().size());
        assertTrue(registry.normalizeEnabledServerIds(null).contains("budget"));
    }

    @Test
    void shouldKeepSettingsSchemaOfCustomServer() {
        String json = """
                [{"id": "budget", "command": ["node", "budget.js"],
                  "settings_schema": [
                    {"key": "sheet_id", "label": "Sheet ID", "type": "string", "required": true},
                    {"label": "no key"},
                    "not an object"
                  ]}]
                """;

        ToolServerDefinition budget = ToolServerRegistry.loadCustomDefinitions(json, objectMapper).get(0);

        assertEquals(List.of(Map.of("key", "sheet_id", "label", "Sheet ID", "type", "string", "required", true)),
                budget.getSettingsSchema());
    }

    @Test
    void shouldDefaultToEmptySettingsSchema() {
        properties.getMcp().setCustomServersJson(CUSTOM_JSON);
        ToolServerRegistry registry = registry();

        assertTrue(registry.resolve("budget").orElseThrow().getSettingsSchema().isEmpty());
        assertTrue(registry.resolve(ToolServerRegistry.TEST_ADDITION).orElseThrow().getSettingsSchema().isEmpty());
        assertEquals(2, registry.resolve(ToolServerRegistry.HSA_LEDGER).orElseThrow().getSettingsSchema().size());
    }

    @Test
    void shouldIgnoreMalformedCustomJson() {
        assertTrue(ToolServerRegistry.loadCustomDefinitions("{not json", objectMapper).isEmpty());
        assertTrue(ToolServerRegistry.loadCustomDefinitions("{\"id\": \"x\"}", objectMapper).isEmpty());
        assertTrue(ToolServerRegistry.loadCustomDefinitions("  ", objectMapper).isEmpty());
    }
}
