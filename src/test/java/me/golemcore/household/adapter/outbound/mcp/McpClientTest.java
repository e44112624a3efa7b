package me.golemcore.household.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import me.golemcore.household.domain.exception.HandshakeException;
import me.golemcore.household.domain.exception.ProtocolException;
import me.golemcore.household.domain.exception.ReadTimeoutException;
import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.exception.UnexpectedExitException;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.model.ToolFailureKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpClientTest {

    private static final String SERVER_ID = "test_addition";
    private static final String V_NEW = "2025-06-18";
    private static final String V_MID = "2025-03-26";
    private static final String V_OLD = "2024-11-05";
    private static final String TOOL_ADD = "add_numbers";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ScriptedMcpTransport> transports = new ArrayList<>();

    private McpClient client(UnaryOperator<ScriptedMcpTransport> script) {
        return client(script, Duration.ofSeconds(5));
    }

    private McpClient client(UnaryOperator<ScriptedMcpTransport> script, Duration requestTimeout) {
        McpClientSettings settings = new McpClientSettings(List.of(V_NEW, V_MID, V_OLD), Duration.ofSeconds(5),
                requestTimeout, Duration.ofMillis(100));
        McpServerLaunch launch = new McpServerLaunch(List.of("python", "-m", "server"), Path.of("."), Map.of());
        return new McpClient(SERVER_ID, launch, settings, objectMapper, id -> {
            ScriptedMcpTransport transport = script.apply(new ScriptedMcpTransport(id));
            transports.add(transport);
            return transport;
        });
    }

    private ScriptedMcpTransport lastTransport() {
        return transports.get(transports.size() - 1);
    }

    @Test
    void shouldFallBackToOlderProtocolVersionAndRecordIt() throws Exception {
        McpClient client = client(t -> t.acceptOnly(V_MID));

        client.start();

        assertEquals(McpClientState.READY, client.getState());
        assertEquals(V_MID, client.getNegotiatedProtocolVersion());
        assertEquals(List.of(V_NEW, V_MID), lastTransport().offeredVersions());
        assertTrue(lastTransport().receivedNotification("notifications/initialized"));
    }

    @Test
    void shouldFailHandshakeWhenEveryVersionIsRejected() {
        McpClient client = client(t -> t.acceptOnly("1999-01-01").textTool(TOOL_ADD, "4"));

        HandshakeException error = assertThrows(HandshakeException.class, client::start);

        assertEquals(List.of(V_NEW, V_MID, V_OLD), error.getAttemptedVersions());
        assertEquals(SERVER_ID, error.getServerId());
        assertEquals(McpClientState.FAILED, client.getState());
        assertNull(client.getNegotiatedProtocolVersion());
        assertFalse(lastTransport().isAlive());
        assertFalse(lastTransport().receivedNotification("notifications/initialized"));
        assertThrows(IllegalStateException.class, () -> client.callTool(TOOL_ADD, Map.of("a", 2, "b", 2)));
    }

    @Test
    void shouldMatchResponseByIdDespiteStrayLines() throws Exception {
        McpClient client = client(t -> t.textTool(TOOL_ADD, "4").strayLines(
                "Loading spreadsheet...",
                "",
                "[1,2,3]",
                "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\",\"params\":{\"level\":\"info\"}}",
                "{\"jsonrpc\":\"2.0\",\"id\":77,\"method\":\"roots/list\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":999,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"wrong\"}]}}"));
        client.start();

        ToolCallResult result = client.callTool(TOOL_ADD, Map.of("a", 2, "b", 2));

        assertTrue(result.isSuccess());
        assertEquals("4", result.getRawText());
        assertTrue(client.isReady());
    }

    @Test
    void shouldSendToolNameAndArguments() throws Exception {
        McpClient client = client(t -> t.tool(TOOL_ADD, args -> JsonNodeFactory.instance.objectNode()
                .set("structuredContent", JsonNodeFactory.instance.objectNode()
                        .put("sum", args.path("a").asInt() + args.path("b").asInt()))));
        client.start();

        ToolCallResult result = client.callTool(TOOL_ADD, Map.of("a", 2, "b", 3));

        assertEquals(5, ((Number) result.getStructuredPayload().get("sum")).intValue());
        var call = lastTransport().received().stream()
                .filter(message -> "tools/call".equals(message.path("method").asText()))
                .findFirst()
                .orElseThrow();
        assertEquals(TOOL_ADD, call.path("params").path("name").asText());
        assertEquals(2, call.path("params").path("arguments").path("a").asInt());
    }

    @Test
    void shouldTreatStartAsNoOpWhenReady() throws Exception {
        McpClient client = client(UnaryOperator.identity());
        client.start();
        client.start();

        assertEquals(1, transports.size());
        assertEquals(1, lastTransport().offeredVersions().size());
    }

    @Test
    void shouldStopIdempotentlyAndRestartFresh() throws Exception {
        McpClient client = client(t -> t.textTool(TOOL_ADD, "4"));
        client.start();
        client.callTool(TOOL_ADD, Map.of("a", 2, "b", 2));
        ScriptedMcpTransport first = lastTransport();

        client.stop();
        client.stop();

        assertEquals(McpClientState.STOPPED, client.getState());
        assertEquals(1, first.terminateCount());
        assertNull(client.getNegotiatedProtocolVersion());

        client.start();

        assertEquals(2, transports.size());
        assertEquals(McpClientState.READY, client.getState());
        assertEquals(1, lastTransport().received().get(0).path("id").asInt());
    }

    @Test
    void shouldRequireStopBeforeRestartingFailedClient() {
        McpClient client = client(ScriptedMcpTransport::failSpawn);

        assertThrows(SpawnException.class, client::start);
        assertEquals(McpClientState.FAILED, client.getState());
        assertThrows(IllegalStateException.class, client::start);

        client.stop();
        assertThrows(SpawnException.class, client::start);
    }

    @Test
    void shouldMarkFailedWhenServerExitsDuringCall() throws Exception {
        McpClient client = client(ScriptedMcpTransport::exitOnToolCall);
        client.start();

        UnexpectedExitException error = assertThrows(UnexpectedExitException.class,
                () -> client.callTool(TOOL_ADD, Map.of()));

        assertEquals(Integer.valueOf(1), error.getExitCode());
        assertTrue(error.getStderrTail().contains("boom"));
        assertEquals(McpClientState.FAILED, client.getState());
        assertEquals(1, lastTransport().terminateCount());
    }

    @Test
    void shouldTimeOutWhenNoMatchingResponseArrives() throws Exception {
        McpClient client = client(ScriptedMcpTransport::silentOnToolCall, Duration.ofMillis(200));
        client.start();

        ReadTimeoutException error = assertThrows(ReadTimeoutException.class,
                () -> client.callTool(TOOL_ADD, Map.of()));

        assertEquals(Duration.ofMillis(200), error.getTimeout());
        assertEquals(McpClientState.FAILED, client.getState());
    }

    @Test
    void shouldStayReadyAfterJsonRpcError() throws Exception {
        McpClient client = client(t -> t.textTool(TOOL_ADD, "4"));
        client.start();

        ProtocolException error = assertThrows(ProtocolException.class,
                () -> client.callTool("missing_tool", Map.of()));

        assertEquals(-32601, error.getCode());
        assertTrue(client.isReady());
        assertEquals("4", client.callTool(TOOL_ADD, Map.of()).getRawText());
    }

    @Test
    void shouldReturnFailedResultWhenToolReportsError() throws Exception {
        McpClient client = client(t -> t.tool("get_unreimbursed_balance", args -> {
            var result = JsonNodeFactory.instance.objectNode().put("isError", true);
            result.putArray("content").addObject().put("type", "text").put("text", "Sheet not found");
            return result;
        }));
        client.start();

        ToolCallResult result = client.callTool("get_unreimbursed_balance", Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Sheet not found", result.getError());
        assertTrue(client.isReady());
    }

    @Test
    void shouldListAdvertisedTools() throws Exception {
        McpClient client = client(t -> t.textTool(TOOL_ADD, "4").textTool("subtract", "0"));
        client.start();

        List<ToolDefinition> tools = client.listTools();

        assertEquals(List.of(TOOL_ADD, "subtract"), tools.stream().map(ToolDefinition::getName).toList());
        assertEquals("object", tools.get(0).getInputSchema().get("type"));
    }
}
