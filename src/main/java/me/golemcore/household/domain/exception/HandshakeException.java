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

import java.util.List;

/**
 * No offered protocol version was accepted, or the server died during the
 * initialize exchange.
 */
public class HandshakeException extends ToolServerStartException {

    private static final long serialVersionUID = 1L;

    private final List<String> attemptedVersions;

    public HandshakeException(String serverId, String message, List<String> attemptedVersions) {
        super(serverId, message);
        this.attemptedVersions = List.copyOf(attemptedVersions);
    }

    public HandshakeException(String serverId, String message, List<String> attemptedVersions, Throwable cause) {
        super(serverId, message, cause);
        this.attemptedVersions = List.copyOf(attemptedVersions);
    }

    public List<String> getAttemptedVersions() {
        return attemptedVersions;
    }
}
