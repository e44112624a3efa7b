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

package me.golemcore.household.domain.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.household.domain.tools.args.AddNumbersArgs;
import me.golemcore.household.domain.tools.args.CharitableSummaryArgs;
import me.golemcore.household.domain.tools.args.ColumnFilter;
import me.golemcore.household.domain.tools.args.PassthroughArgs;
import me.golemcore.household.domain.tools.args.ReadCharitableLedgerEntriesArgs;
import me.golemcore.household.domain.tools.args.ReadLedgerEntriesArgs;
import me.golemcore.household.domain.tools.args.ReimbursementStatus;
import me.golemcore.household.domain.tools.args.ToolArguments;
import me.golemcore.household.domain.tools.args.UnreimbursedBalanceArgs;
import me.golemcore.household.domain.tools.args.UpdateExpenseStatusArgs;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns loosely typed model arguments into the typed arguments a tool
 * accepts.
 *
 * <p>
 * Total: never throws. Numeric strings become numbers, yes/no style strings
 * become booleans, blank strings and unknown fields are dropped, invalid
 * statuses are omitted and limits are clamped to 1..1000.
 */
@Component
@Slf4j
public class ToolArgumentNormalizer {

    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 1000;

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "0");

    public ToolArguments normalize(String toolName, Map<String, Object> rawArgs) {
        Map<String, Object> raw = rawArgs != null ? rawArgs : Map.of();
        if (toolName == null) {
            return new PassthroughArgs(dropBlanks(raw));
        }
        return switch (toolName) {
        case "add_numbers" -> new AddNumbersArgs(toNumber(raw.get("a")), toNumber(raw.get("b")));
        case "get_unreimbursed_balance" -> new UnreimbursedBalanceArgs();
        case "read_ledger_entries" -> new ReadLedgerEntriesArgs(
                toInteger(raw.get("year")),
                toStatus(raw.get("status_filter")),
                toLimit(raw.get("limit")),
                toColumnFilters(raw.get("column_filters")));
        case "update_expense_status" -> new UpdateExpenseStatusArgs(
                toText(raw.get("expense_id")),
                toStatus(raw.get("new_status")),
                toText(raw.get("reimbursement_date")));
        case "get_charitable_summary" -> new CharitableSummaryArgs(
                toInteger(raw.get("tax_year")),
                toColumnFilters(raw.get("column_filters")));
        case "read_charitable_ledger_entries" -> new ReadCharitableLedgerEntriesArgs(
                toInteger(raw.get("tax_year")),
                toText(raw.get("organization")),
                toBoolean(raw.get("tax_deductible")),
                toLimit(raw.get("limit")),
                toColumnFilters(raw.get("column_filters")));
        default -> new PassthroughArgs(dropBlanks(raw));
        };
    }

    /**
     * Integers that fit come back as {@link Integer}, larger ones as
     * {@link Long}, fractions as {@link Double}.
     */
    static Number toNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof Number number) {
            return narrow(new BigDecimal(number.toString()));
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return narrow(new BigDecimal(text.strip()));
            } catch (NumberFormatException e) {
                log.debug("[Normalizer] Not a number: '{}'", text);
                return null;
            }
        }
        return null;
    }

    private static Number narrow(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                long asLong = stripped.longValueExact();
                if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                    return (int) asLong;
                }
                return asLong;
            } catch (ArithmeticException e) {
                return decimal.doubleValue();
            }
        }
        return decimal.doubleValue();
    }

    static Integer toInteger(Object value) {
        Number number = toNumber(value);
        if (number instanceof Integer integer) {
            return integer;
        }
        if (number instanceof Double d && d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
            return d.intValue();
        }
        return null;
    }

    static Integer toLimit(Object value) {
        Number number = toNumber(value);
        if (number == null) {
            return null;
        }
        long limit = number instanceof Double d ? (long) Math.floor(d) : number.longValue();
        return (int) Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));
    }

    static Boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            if (number.doubleValue() == 1) {
                return true;
            }
            return number.doubleValue() == 0 ? false : null;
        }
        if (value instanceof String text) {
            String normalized = text.strip().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(normalized)) {
                return true;
            }
            if (FALSE_VALUES.contains(normalized)) {
                return false;
            }
        }
        return null;
    }

    static String toText(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).strip();
        return text.isEmpty() ? null : text;
    }

    private static ReimbursementStatus toStatus(Object value) {
        String text = toText(value);
        if (text == null) {
            return null;
        }
        Optional<ReimbursementStatus> status = ReimbursementStatus.fromWire(text);
        if (status.isEmpty()) {
            log.debug("[Normalizer] Dropping unknown status '{}'", text);
        }
        return status.orElse(null);
    }

    private static List<ColumnFilter> toColumnFilters(Object value) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        List<ColumnFilter> filters = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            String column = toText(map.get("column"));
            Object filterValue = map.get("value");
            if (column == null || filterValue == null) {
                continue;
            }
            Object operatorRaw = map.get("operator");
            Optional<ColumnFilter.Operator> operator = operatorRaw == null
                    ? Optional.of(ColumnFilter.Operator.EQUALS)
                    : ColumnFilter.Operator.fromWire(String.valueOf(operatorRaw));
            if (operator.isEmpty()) {
                log.debug("[Normalizer] Dropping filter on '{}' with unknown operator '{}'", column, operatorRaw);
                continue;
            }
            Boolean caseSensitive = toBoolean(map.get("case_sensitive"));
            filters.add(new ColumnFilter(column, operator.get(), filterValue, Boolean.TRUE.equals(caseSensitive)));
        }
        return filters;
    }

    private static Map<String, Object> dropBlanks(Map<String, Object> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (value == null || value instanceof String text && text.isBlank()) {
                return;
            }
            result.put(key, value);
        });
        return result;
    }
}
