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

package me.golemcore.household.domain.tools.args;

import java.util.Map;

/**
 * Normalized arguments for one tool call.
 *
 * <p>
 * Produced only by
 * {@link me.golemcore.household.domain.tools.ToolArgumentNormalizer}; each
 * implementation knows which fields its tool accepts and renders exactly
 * those.
 */
public interface ToolArguments {

    /**
     * Arguments as sent in {@code tools/call}. Absent optional fields are
     * omitted, never sent as {@code null}.
     */
    Map<String, Object> toWireMap();
}
