package me.golemcore.household.domain.tools;

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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolArgumentNormalizerTest {

    private final ToolArgumentNormalizer normalizer = new ToolArgumentNormalizer();

    @Test
    void shouldConvertNumericStringsForAddition() {
        ToolArguments args = normalizer.normalize("add_numbers", Map.of("a", "2", "b", " 2.50 "));

        AddNumbersArgs addition = assertInstanceOf(AddNumbersArgs.class, args);
        assertEquals(2, addition.a());
        assertEquals(2.5, addition.b());
        assertEquals(Map.of("a", 2, "b", 2.5), args.toWireMap());
    }

    @Test
    void shouldOmitOperandThatIsNotANumber() {
        ToolArguments args = normalizer.normalize("add_numbers", Map.of("a", "two", "b", 3));

        assertEquals(Map.of("b", 3), args.toWireMap());
    }

    @Test
    void shouldIgnoreEverythingForBalance() {
        ToolArguments args = normalizer.normalize("get_unreimbursed_balance", Map.of("year", 2024));

        assertInstanceOf(UnreimbursedBalanceArgs.class, args);
        assertTrue(args.toWireMap().isEmpty());
    }

    @Test
    void shouldNormalizeLedgerRead() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("year", "2024");
        raw.put("status_filter", "Unreimbursed");
        raw.put("limit", 5000);
        raw.put("column_filters", List.of(
                Map.of("column", "provider", "operator", "contains", "value", "clinic"),
                Map.of("column", "amount", "value", 100),
                Map.of("column", "category", "operator", "like", "value", "x"),
                Map.of("operator", "equals", "value", "orphan")));
        raw.put("unexpected", "dropped");

        ReadLedgerEntriesArgs args = assertInstanceOf(ReadLedgerEntriesArgs.class,
                normalizer.normalize("read_ledger_entries", raw));

        assertEquals(2024, args.year());
        assertEquals(ReimbursementStatus.UNREIMBURSED, args.statusFilter());
        assertEquals(1000, args.limit());
        assertEquals(2, args.columnFilters().size());
        assertEquals(ColumnFilter.Operator.CONTAINS, args.columnFilters().get(0).operator());
        assertEquals(ColumnFilter.Operator.EQUALS, args.columnFilters().get(1).operator());
        assertFalse(args.toWireMap().containsKey("unexpected"));
    }

    @Test
    void shouldDropUnknownStatusAndClampLowLimit() {
        ReadLedgerEntriesArgs args = assertInstanceOf(ReadLedgerEntriesArgs.class,
                normalizer.normalize("read_ledger_entries", Map.of("status_filter", "pending", "limit", "0")));

        assertNull(args.statusFilter());
        assertEquals(1, args.limit());
        assertFalse(args.toWireMap().containsKey("status_filter"));
    }

    @Test
    void shouldSendTaxYearAsString() {
        ToolArguments args = normalizer.normalize("get_charitable_summary", Map.of("tax_year", 2024.0));

        assertInstanceOf(CharitableSummaryArgs.class, args);
        assertEquals("2024", args.toWireMap().get("tax_year"));
    }

    @Test
    void shouldNormalizeCharitableRead() {
        ReadCharitableLedgerEntriesArgs args = assertInstanceOf(ReadCharitableLedgerEntriesArgs.class,
                normalizer.normalize("read_charitable_ledger_entries",
                        Map.of("organization", "  ", "tax_deductible", "yes", "limit", 25.7)));

        assertNull(args.organization());
        assertEquals(Boolean.TRUE, args.taxDeductible());
        assertEquals(25, args.limit());
    }

    @Test
    void shouldNormalizeStatusUpdate() {
        UpdateExpenseStatusArgs args = assertInstanceOf(UpdateExpenseStatusArgs.class,
                normalizer.normalize("update_expense_status",
                        Map.of("expense_id", 17, "new_status", "not hsa eligible", "reimbursement_date", "")));

        assertEquals("17", args.expenseId());
        assertEquals(ReimbursementStatus.NOT_HSA_ELIGIBLE, args.newStatus());
        assertNull(args.reimbursementDate());
    }

    @Test
    void shouldPassUnknownToolArgumentsThroughWithoutBlanks() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("query", "rent");
        raw.put("empty", " ");
        raw.put("missing", null);

        ToolArguments args = normalizer.normalize("custom_search", raw);

        assertInstanceOf(PassthroughArgs.class, args);
        assertEquals(Map.of("query", "rent"), args.toWireMap());
    }

    @Test
    void shouldPassArgumentsThroughWhenToolNameIsMissing() {
        ToolArguments args = normalizer.normalize(null, Map.of("a", 1, "note", ""));

        assertInstanceOf(PassthroughArgs.class, args);
        assertEquals(Map.of("a", 1), args.toWireMap());
        assertTrue(normalizer.normalize(null, null).toWireMap().isEmpty());
    }

    @Test
    void shouldTolerateNullArguments() {
        assertTrue(normalizer.normalize("read_ledger_entries", null).toWireMap().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = { "true", "YES", "y", "1" })
    void shouldReadTruthyStrings(String value) {
        assertEquals(Boolean.TRUE, ToolArgumentNormalizer.toBoolean(value));
    }

    @ParameterizedTest
    @ValueSource(strings = { "false", "No", "n", "0" })
    void shouldReadFalsyStrings(String value) {
        assertEquals(Boolean.FALSE, ToolArgumentNormalizer.toBoolean(value));
    }

    @Test
    void shouldRejectAmbiguousBooleans() {
        assertNull(ToolArgumentNormalizer.toBoolean("maybe"));
        assertNull(ToolArgumentNormalizer.toBoolean(2));
    }

    @Test
    void shouldWidenLargeIntegersToLong() {
        assertEquals(5_000_000_000L, ToolArgumentNormalizer.toNumber("5000000000"));
        assertNull(ToolArgumentNormalizer.toInteger("5000000000"));
    }
}
