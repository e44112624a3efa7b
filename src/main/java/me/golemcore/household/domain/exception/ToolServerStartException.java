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

package me.golemcore.household.domain.exception;

/**
 * The tool server could not be brought to a usable state. No tool call is
 * possible, so this propagates to the caller instead of becoming a failed tool
 * result.
 */
public class ToolServerStartException extends McpException {

    private static final long serialVersionUID = 1L;

    public ToolServerStartException(String serverId, String message) {
        super(serverId, message);
    }

    public ToolServerStartException(String serverId, String message, Throwable cause) {
        super(serverId, message, cause);
    }
}
