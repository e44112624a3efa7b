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
import lombok.Data;

import java.util.Map;

/**
 * Outcome of one tool invocation.
 *
 * <p>
 * {@code structuredPayload} is a best-effort enrichment: it is {@code null}
 * whenever the server returned plain text instead of a JSON object.
 */
@Data
@Builder
public class ToolCallResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String rawText;
    private Map<String, Object> structuredPayload;
    private String displaySummary;
    private String error;
    private ToolFailureKind failureKind;

    public boolean hasStructuredPayload() {
        return structuredPayload != null;
    }

    /**
     * Text to feed back to the model for this result.
     */
    public String toModelContent() {
        if (success) {
            return rawText != null ? rawText : "";
        }
        return "Error: " + (error != null ? error : "tool call failed");
    }

    public static ToolCallResult success(String rawText, Map<String, Object> structuredPayload,
            String displaySummary) {
        return ToolCallResult.builder()
                .success(true)
                .rawText(rawText)
                .structuredPayload(structuredPayload)
                .displaySummary(displaySummary)
                .build();
    }

    public static ToolCallResult failure(ToolFailureKind kind, String error) {
        return ToolCallResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .displaySummary("error: " + error)
                .build();
    }
}
