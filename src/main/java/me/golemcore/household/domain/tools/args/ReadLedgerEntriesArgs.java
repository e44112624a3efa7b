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
import java.util.List;
import java.util.Map;

public record ReadLedgerEntriesArgs(Integer year, ReimbursementStatus statusFilter, Integer limit,
        List<ColumnFilter> columnFilters) implements ToolArguments {

    public ReadLedgerEntriesArgs {
        columnFilters = columnFilters != null ? List.copyOf(columnFilters) : List.of();
    }

    @Override
    public Map<String, Object> toWireMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (year != null) {
            map.put("year", year);
        }
        if (statusFilter != null) {
            map.put("status_filter", statusFilter.getWireValue());
        }
        if (limit != null) {
            map.put("limit", limit);
        }
        if (!columnFilters.isEmpty()) {
            map.put("column_filters", columnFilters.stream().map(ColumnFilter::toWireMap).toList());
        }
        return map;
    }
}
