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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operands for {@code add_numbers}. Either may be absent if the model sent
 * something that is not a number; the server reports the error.
 */
public record AddNumbersArgs(Number a, Number b) implements ToolArguments {

    @Override
    public Map<String, Object> toWireMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (a != null) {
            map.put("a", a);
        }
        if (b != null) {
            map.put("b", b);
        }
        return map;
    }
}
