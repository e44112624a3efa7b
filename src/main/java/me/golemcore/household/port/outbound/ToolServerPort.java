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

package me.golemcore.household.port.outbound;

import me.golemcore.household.domain.exception.ToolServerStartException;
import me.golemcore.household.domain.model.ToolDefinition;

import java.util.List;

/**
 * Port for running tools hosted by external tool servers.
 */
public interface ToolServerPort {

    /**
     * Opens a scope that owns every server process started through it. The
     * caller must close it; closing stops all of those processes.
     */
    ToolSession openSession();

    /**
     * Starts the server, asks it for its tools and stops it again.
     */
    List<ToolDefinition> listTools(String serverId) throws ToolServerStartException;
}
