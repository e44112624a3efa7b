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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Row filter applied by ledger read tools.
 */
public record ColumnFilter(String column, Operator operator, Object value, boolean caseSensitive) {

    public enum Operator {
        EQUALS, NOT_EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH, IN, GT, GTE, LT, LTE;

        public String getWireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<Operator> fromWire(String value) {
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(op -> op.getWireValue().equals(normalized))
                    .findFirst();
        }
    }

    public Map<String, Object> toWireMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("column", column);
        map.put("operator", operator.getWireValue());
        map.put("value", value);
        map.put("case_sensitive", caseSensitive);
        return map;
    }
}
