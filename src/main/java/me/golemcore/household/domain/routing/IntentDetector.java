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

import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.port.outbound.ToolSession;

/**
 * One deterministic query shape, answered with a fixed sequence of tool calls
 * instead of the language model.
 *
 * <p>
 * Detectors are tried in ascending {@link #getOrder()}; the first match wins.
 */
public interface IntentDetector {

    String getName();

    int getOrder();

    boolean matches(String message, ConversationContext context);

    /**
     * Answers the message. Called only after {@link #matches} returned true.
     * Updates {@code context} only when the tool calls succeed.
     */
    RouteResult resolve(String message, ConversationContext context, ToolSession tools);
}
