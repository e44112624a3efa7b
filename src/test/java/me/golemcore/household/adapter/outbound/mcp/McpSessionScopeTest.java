package me.golemcore.household.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.exception.HandshakeException;
import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolFailureKind;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.AddNumbersArgs;
import me.golemcore.household.domain.tools.args.UnreimbursedBalanceArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpSessionScopeTest {

    private static final String TOOL_ADD = "add_numbers";
    private static final String TOOL_BALANCE = "get_unreimbursed_balance";
    private static final String BALANCE_JSON = "{\"total_unreimbursed\":42.5,\"count\":3}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ScriptedMcpTransport> transports = new ArrayList<>();
    private AssistantProperties properties;
    private ToolServerRegistry registry;
    private UnaryOperator<ScriptedMcpTransport> script;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getMcp().setStartupTimeout(Duration.ofSeconds(2));
        properties.getMcp().setRequestTimeout(Duration.ofSeconds(2));
        properties.getMcp().setShutdownGrace(Duration.ofMillis(50));
        registry = new ToolServerRegistry(properties, objectMapper);
        script = t -> t.textTool(TOOL_ADD, "4").textTool(TOOL_BALANCE, BALANCE_JSON);
    }

    private McpSessionScope newScope() {
        McpClientFactory factory = new McpClientFactory(properties, objectMapper, id -> {
            ScriptedMcpTransport transport = script.apply(new ScriptedMcpTransport(id));
            transports.add(transport);
            return transport;
        });
        return new McpSessionScope(factory, registry);
    }

    @Test
    void shouldStartEachServerOnceAndReuseIt() throws Exception {
        try (McpSessionScope scope = newScope()) {
            scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD, new AddNumbersArgs(2, 2));
            scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD, new AddNumbersArgs(3, 4));
            ToolCallResult balance = scope.callTool(ToolServerRegistry.HSA_LEDGER, TOOL_BALANCE,
                    new UnreimbursedBalanceArgs());

            assertEquals(2, scope.getClientCount());
            assertEquals(2, transports.size());
            assertEquals(42.5, ((Number) balance.getStructuredPayload().get("total_unreimbursed")).doubleValue());
        }
    }

    @Test
    void shouldStopEveryClientOnClose() throws Exception {
        McpSessionScope scope = newScope();
        scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD, new AddNumbersArgs(2, 2));
        scope.callTool(ToolServerRegistry.HSA_LEDGER, TOOL_BALANCE, new UnreimbursedBalanceArgs());

        scope.close();
        scope.close();

        assertEquals(0, scope.getClientCount());
        for (ScriptedMcpTransport transport : transports) {
            assertFalse(transport.isAlive());
            assertEquals(1, transport.terminateCount());
        }
        assertThrows(IllegalStateException.class,
                () -> scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD, new AddNumbersArgs(1, 1)));
    }

    @Test
    void shouldReportUnknownServerWithoutStartingAnything() throws Exception {
        try (McpSessionScope scope = newScope()) {
            ToolCallResult result = scope.callTool("nope", TOOL_ADD, new AddNumbersArgs(1, 1));

            assertFalse(result.isSuccess());
            assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getFailureKind());
            assertTrue(transports.isEmpty());
        }
    }

    @Test
    void shouldTurnJsonRpcErrorIntoFailedResult() throws Exception {
        try (McpSessionScope scope = newScope()) {
            ToolCallResult result = scope.callTool(ToolServerRegistry.TEST_ADDITION, "multiply",
                    new AddNumbersArgs(2, 2));

            assertFalse(result.isSuccess());
            assertEquals(ToolFailureKind.PROTOCOL_ERROR, result.getFailureKind());
            assertTrue(result.getError().contains("-32601"));
        }
    }

    @Test
    void shouldRestartServerAfterUnexpectedExit() throws Exception {
        script = ScriptedMcpTransport::exitOnToolCall;
        try (McpSessionScope scope = newScope()) {
            ToolCallResult first = scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD,
                    new AddNumbersArgs(2, 2));
            assertEquals(ToolFailureKind.UNEXPECTED_EXIT, first.getFailureKind());

            script = t -> t.textTool(TOOL_ADD, "4");
            ToolCallResult second = scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD,
                    new AddNumbersArgs(2, 2));

            assertTrue(second.isSuccess());
            assertEquals(2, transports.size());
            assertEquals(1, scope.getClientCount());
        }
    }

    @Test
    void shouldReportTimeoutAsExecutionFailure() throws Exception {
        properties.getMcp().setRequestTimeout(Duration.ofMillis(100));
        script = ScriptedMcpTransport::silentOnToolCall;
        try (McpSessionScope scope = newScope()) {
            ToolCallResult result = scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD,
                    new AddNumbersArgs(2, 2));

            assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
            assertTrue(result.getError().contains("did not answer in time"));
        }
    }

    @Test
    void shouldPropagateStartFailuresAndStillCleanUp() {
        script = ScriptedMcpTransport::failSpawn;
        McpSessionScope scope = newScope();

        assertThrows(SpawnException.class,
                () -> scope.callTool(ToolServerRegistry.TEST_ADDITION, TOOL_ADD, new AddNumbersArgs(2, 2)));

        scope.close();
        assertEquals(0, scope.getClientCount());
    }

    @Test
    void shouldPropagateHandshakeFailure() {
        script = t -> t.acceptOnly("1999-01-01");
        try (McpSessionScope scope = newScope()) {
            HandshakeException error = assertThrows(HandshakeException.class,
                    () -> scope.callTool(ToolServerRegistry.HSA_LEDGER, TOOL_BALANCE, new UnreimbursedBalanceArgs()));
            assertEquals(ToolServerRegistry.HSA_LEDGER, error.getServerId());
        }
        assertFalse(transports.get(0).isAlive());
    }
}
