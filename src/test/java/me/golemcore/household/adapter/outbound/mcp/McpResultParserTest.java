package me.golemcore.household.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolFailureKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpResultParserTest {

    private static final String TOOL = "get_unreimbursed_balance";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final McpResultParser parser = new McpResultParser(objectMapper);

    private ToolCallResult parse(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return parser.parse(TOOL, node);
    }

    @Test
    void shouldJoinTextItemsAndSkipOtherContent() throws Exception {
        ToolCallResult result = parse("""
                {"content": [
                  {"type": "text", "text": "line one"},
                  {"type": "image", "data": "..."},
                  {"type": "text", "text": "line two"}
                ]}
                """);

        assertTrue(result.isSuccess());
        assertEquals("line one\nline two", result.getRawText());
        assertNull(result.getStructuredPayload());
        assertEquals("line one line two", result.getDisplaySummary());
    }

    @Test
    void shouldPreferStructuredContent() throws Exception {
        ToolCallResult result = parse("""
                {"content": [{"type": "text", "text": "{\\"count\\": 99}"}],
                 "structuredContent": {"total_unreimbursed": 42.5, "count": 3}}
                """);

        assertEquals(3, result.getStructuredPayload().get("count"));
        assertEquals(42.5, result.getStructuredPayload().get("total_unreimbursed"));
    }

    @Test
    void shouldAcceptStructuredContentAsJsonString() throws Exception {
        ToolCallResult result = parse("""
                {"content": [], "structured_content": "{\\"count\\": 2}"}
                """);

        assertEquals(2, result.getStructuredPayload().get("count"));
        assertEquals("{\"count\":2}", result.getRawText());
    }

    @Test
    void shouldParseFirstTextItemAsPayloadWhenItIsAnObject() throws Exception {
        ToolCallResult result = parse("""
                {"content": [{"type": "text", "text": "{\\"success\\": true, \\"entries\\": []}"}]}
                """);

        assertEquals(Boolean.TRUE, result.getStructuredPayload().get("success"));
    }

    @Test
    void shouldLeavePayloadEmptyForPlainText() throws Exception {
        ToolCallResult result = parse("""
                {"content": [{"type": "text", "text": "4"}]}
                """);

        assertTrue(result.isSuccess());
        assertEquals("4", result.getRawText());
        assertFalse(result.hasStructuredPayload());
    }

    @Test
    void shouldReportNoOutputForEmptyResult() throws Exception {
        ToolCallResult result = parse("{}");

        assertTrue(result.isSuccess());
        assertEquals("(no output)", result.getRawText());
    }

    @Test
    void shouldTurnIsErrorIntoFailureUsingPayloadError() throws Exception {
        ToolCallResult result = parse("""
                {"isError": true,
                 "content": [{"type": "text", "text": "{\\"success\\": false, \\"error\\": \\"Expense not found\\"}"}]}
                """);

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Expense not found", result.getError());
        assertEquals(Boolean.FALSE, result.getStructuredPayload().get("success"));
    }

    @Test
    void shouldTruncateLongSummaries() throws Exception {
        String longText = "x".repeat(500);
        ToolCallResult result = parse("{\"content\": [{\"type\": \"text\", \"text\": \"" + longText + "\"}]}");

        assertEquals(200, result.getDisplaySummary().length());
        assertTrue(result.getDisplaySummary().endsWith("..."));
        assertEquals(500, result.getRawText().length());
    }

    @Test
    void shouldReportMissingResultAsProtocolError() {
        ToolCallResult result = parser.parse(TOOL, null);

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.PROTOCOL_ERROR, result.getFailureKind());
    }
}
