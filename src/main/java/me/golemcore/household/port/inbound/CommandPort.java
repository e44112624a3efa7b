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

package me.golemcore.household.port.inbound;

import java.util.List;

/**
 * Port for slash commands (/new, /balance, ...). Commands bypass the router
 * and the orchestration loop.
 */
public interface CommandPort {

    /**
     * Executes a command for a session.
     *
     * @param command
     *            command name without the leading slash
     * @param args
     *            whitespace-separated arguments after the command
     * @param sessionId
     *            session the command applies to
     */
    CommandResult execute(String command, List<String> args, String sessionId);

    record CommandResult(boolean success, String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String output) {
            return new CommandResult(false, output);
        }
    }
}
