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

public enum ToolFailureKind {

    /**
     * The model asked for a tool that no registered server exposes.
     */
    UNKNOWN_TOOL,

    /**
     * The tool exists but its server is not enabled for the session.
     */
    SERVER_DISABLED,

    /**
     * The server answered the call with a JSON-RPC error.
     */
    PROTOCOL_ERROR,

    /**
     * The server process died or closed stdout mid-conversation.
     */
    UNEXPECTED_EXIT,

    /**
     * Anything else at runtime: flagged results, timeouts, pipe failures.
     */
    EXECUTION_FAILED
}
