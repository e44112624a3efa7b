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
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Static definition of a known tool server.
 *
 * <p>
 * Immutable; the registry builds these once at startup and never persists
 * them.
 */
@Value
@Builder
public class ToolServerDefinition {

    public static final String SOURCE_BUILTIN = "builtin";
    public static final String SOURCE_CUSTOM = "custom";

    String id;
    String displayName;
    String description;
    @Singular("commandPart")
    List<String> command;
    String workingDirectoryHint;
    boolean defaultEnabled;
    @Singular
    List<String> toolNames;
    @Builder.Default
    String source = SOURCE_BUILTIN;
    /** External connection the server needs, e.g. "google". */
    String requiresConnection;
    /** Fields the user fills in before the server can run: key, label, type, required, default. */
    @Builder.Default
    List<Map<String, Object>> settingsSchema = List.of();

    public boolean exposes(String toolName) {
        return toolNames.contains(toolName);
    }
}
