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
 * The process closed stdout or exited while a response was expected.
 */
public class UnexpectedExitException extends McpException {

    private static final long serialVersionUID = 1L;

    private final Integer exitCode;
    private final String stderrTail;

    public UnexpectedExitException(String serverId, Integer exitCode, String stderrTail) {
        super(serverId, buildMessage(serverId, exitCode, stderrTail));
        this.exitCode = exitCode;
        this.stderrTail = stderrTail;
    }

    private static String buildMessage(String serverId, Integer exitCode, String stderrTail) {
        StringBuilder sb = new StringBuilder("Tool server '").append(serverId).append("' exited unexpectedly");
        if (exitCode != null) {
            sb.append(" (exit code ").append(exitCode).append(')');
        }
        if (stderrTail != null && !stderrTail.isBlank()) {
            sb.append(": ").append(stderrTail.strip());
        }
        return sb.toString();
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public String getStderrTail() {
        return stderrTail;
    }
}
