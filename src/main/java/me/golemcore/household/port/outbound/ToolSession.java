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
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.tools.args.ToolArguments;

/**
 * Tool calls made during one request. Server processes are started lazily on
 * first use and reused until {@link #close()}.
 */
public interface ToolSession extends AutoCloseable {

    /**
     * Calls {@code toolName} on {@code serverId}.
     *
     * <p>
     * Protocol errors, unexpected exits and transport failures come back as a
     * failed {@link ToolCallResult}. Only a server that cannot be started at
     * all throws.
     *
     * @throws ToolServerStartException
     *             if the server could not be spawned or no protocol version was
     *             accepted
     */
    ToolCallResult callTool(String serverId, String toolName, ToolArguments arguments)
            throws ToolServerStartException;

    /**
     * Stops every process started by this session. Never throws.
     */
    @Override
    void close();
}
