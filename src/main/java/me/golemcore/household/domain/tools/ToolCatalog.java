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

import me.golemcore.household.domain.model.ToolContract;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.model.ToolServerDefinition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Model-visible tool contracts: which server runs each tool and the JSON
 * schema the model sees for it.
 */
@Service
public class ToolCatalog {

    private static final String TYPE = "type";
    private static final String OBJECT = "object";
    private static final String PROPERTIES = "properties";
    private static final String DESCRIPTION = "description";
    private static final String INTEGER = "integer";
    private static final String STRING = "string";

    private final ToolServerRegistry registry;
    private final Map<String, ToolContract> contracts;

    public ToolCatalog(ToolServerRegistry registry) {
        this.registry = registry;
        Map<String, ToolContract> all = new LinkedHashMap<>();
        for (ToolContract contract : builtinContracts()) {
            all.put(contract.name(), contract);
        }
        // Custom servers only list tool names, so their tools get an open schema
        for (ToolServerDefinition definition : registry.definitions()) {
            if (!ToolServerDefinition.SOURCE_CUSTOM.equals(definition.getSource())) {
                continue;
            }
            for (String toolName : definition.getToolNames()) {
                all.putIfAbsent(toolName, new ToolContract(toolName, definition.getId(),
                        "Tool provided by " + definition.getDisplayName(),
                        Map.of(TYPE, OBJECT, PROPERTIES, Map.of())));
            }
        }
        this.contracts = all;
    }

    public Optional<ToolContract> resolve(String toolName) {
        return Optional.ofNullable(contracts.get(toolName));
    }

    /**
     * Contracts whose server is both known and enabled.
     */
    public List<ToolContract> contractsFor(List<String> enabledServerIds) {
        List<ToolContract> result = new ArrayList<>();
        for (ToolContract contract : contracts.values()) {
            if (enabledServerIds.contains(contract.serverId()) && registry.resolve(contract.serverId()).isPresent()) {
                result.add(contract);
            }
        }
        return result;
    }

    public List<ToolDefinition> modelToolDefinitions(List<String> enabledServerIds) {
        return contractsFor(enabledServerIds).stream()
                .map(ToolContract::toDefinition)
                .toList();
    }

    private static List<ToolContract> builtinContracts() {
        return List.of(
                new ToolContract("get_unreimbursed_balance", ToolServerRegistry.HSA_LEDGER,
                        "Get the total and count of HSA expenses not yet reimbursed.",
                        objectSchema(Map.of(), List.of())),
                new ToolContract("read_ledger_entries", ToolServerRegistry.HSA_LEDGER,
                        "Read HSA ledger entries with optional year, status and column filters.",
                        objectSchema(props(
                                "year", prop(INTEGER, "Service year, e.g. 2025"),
                                "status_filter", enumProp("Reimbursement status",
                                        List.of("reimbursed", "unreimbursed", "not_hsa_eligible")),
                                "limit", limitProp(),
                                "column_filters", columnFiltersProp()), List.of())),
                new ToolContract("update_expense_status", ToolServerRegistry.HSA_LEDGER,
                        "Update the reimbursement status of an existing expense.",
                        objectSchema(props(
                                "expense_id", prop(STRING, "Ledger entry id"),
                                "new_status", enumProp("New reimbursement status",
                                        List.of("reimbursed", "unreimbursed", "not_hsa_eligible")),
                                "reimbursement_date", prop(STRING, "Date reimbursed, YYYY-MM-DD")),
                                List.of("expense_id", "new_status"))),
                new ToolContract("get_charitable_summary", ToolServerRegistry.CHARITABLE_LEDGER,
                        "Summarize charitable donations, optionally for one tax year.",
                        objectSchema(props(
                                "tax_year", prop(INTEGER, "Tax year, e.g. 2025; omit for all years"),
                                "column_filters", columnFiltersProp()), List.of())),
                new ToolContract("read_charitable_ledger_entries", ToolServerRegistry.CHARITABLE_LEDGER,
                        "Read charitable donation entries with optional filters.",
                        objectSchema(props(
                                "tax_year", prop(INTEGER, "Tax year"),
                                "organization", prop(STRING, "Organization name"),
                                "tax_deductible", prop("boolean", "Only deductible (true) or non-deductible (false)"),
                                "limit", limitProp(),
                                "column_filters", columnFiltersProp()), List.of())),
                new ToolContract("add_numbers", ToolServerRegistry.TEST_ADDITION,
                        "Add two numbers.",
                        objectSchema(props(
                                "a", prop("number", "First addend"),
                                "b", prop("number", "Second addend")), List.of("a", "b"))));
    }

    private static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, OBJECT);
        schema.put(PROPERTIES, properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static Map<String, Object> props(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of(TYPE, type, DESCRIPTION, description);
    }

    private static Map<String, Object> enumProp(String description, List<String> values) {
        return Map.of(TYPE, STRING, DESCRIPTION, description, "enum", values);
    }

    private static Map<String, Object> limitProp() {
        return Map.of(TYPE, INTEGER, DESCRIPTION, "Max entries to return (1-1000)");
    }

    private static Map<String, Object> columnFiltersProp() {
        Map<String, Object> filter = objectSchema(props(
                "column", prop(STRING, "Column name"),
                "operator", enumProp("Comparison", List.of("equals", "not_equals", "contains", "starts_with",
                        "ends_with", "in", "gt", "gte", "lt", "lte")),
                "value", prop(STRING, "Value to compare against"),
                "case_sensitive", prop("boolean", "Case-sensitive text match")),
                List.of("column", "value"));
        return Map.of(TYPE, "array", DESCRIPTION, "Row filters", "items", filter);
    }
}
