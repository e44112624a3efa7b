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
 * The server answered a request with a JSON-RPC {@code error} member. The
 * error object is kept verbatim.
 */
public class ProtocolException extends McpException {

    private static final long serialVersionUID = 1L;

    private final int code;
    private final String errorPayload;

    public ProtocolException(String serverId, int code, String message, String errorPayload) {
        super(serverId, message);
        this.code = code;
        this.errorPayload = errorPayload;
    }

    public int getCode() {
        return code;
    }

    /**
     * Raw JSON of the server's error object.
     */
    public String getErrorPayload() {
        return errorPayload;
    }
}
