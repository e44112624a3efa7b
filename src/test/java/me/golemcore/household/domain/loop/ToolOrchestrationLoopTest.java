package me.golemcore.household.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.exception.SpawnException;
import me.golemcore.household.domain.model.ConversationContext;
import me.golemcore.household.domain.model.Intent;
import me.golemcore.household.domain.model.LlmRequest;
import me.golemcore.household.domain.model.LlmResponse;
import me.golemcore.household.domain.model.Message;
import me.golemcore.household.domain.model.ToolCallRecord;
import me.golemcore.household.domain.model.ToolCallResult;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.domain.tools.ToolArgumentNormalizer;
import me.golemcore.household.domain.tools.ToolCallRecorder;
import me.golemcore.household.domain.tools.ToolCatalog;
import me.golemcore.household.domain.tools.ToolServerRegistry;
import me.golemcore.household.domain.tools.args.AddNumbersArgs;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import me.golemcore.household.port.outbound.LlmPort;
import me.golemcore.household.port.outbound.ToolServerPort;
import me.golemcore.household.port.outbound.ToolSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolOrchestrationLoopTest {

    private static final String SESSION_ID = "s1";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    private LlmPort llmPort;
    private ToolServerPort toolServerPort;
    private ToolSession session;
    private AssistantProperties properties;
    private ToolOrchestrationLoop loop;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        toolServerPort = mock(ToolServerPort.class);
        session = mock(ToolSession.class);
        when(toolServerPort.openSession()).thenReturn(session);

        properties = new AssistantProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        ToolServerRegistry registry = new ToolServerRegistry(properties, objectMapper);
        loop = new ToolOrchestrationLoop(llmPort, toolServerPort, new ToolCatalog(registry),
                new ToolArgumentNormalizer(), new ToolCallRecorder(objectMapper), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ConversationContext contextWith(String... serverIds) {
        ConversationContext context = new ConversationContext();
        context.setEnabledToolServerIds(List.of(serverIds));
        return context;
    }

    private static List<Message> history(String text) {
        return List.of(Message.user(text));
    }

    private static LlmResponse text(String content) {
        return LlmResponse.builder().content(content).finishReason("stop").build();
    }

    private static LlmResponse toolCall(String id, String name, Map<String, Object> arguments) {
        return LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder().id(id).name(name).arguments(arguments).build()))
                .finishReason("tool_calls")
                .build();
    }

    private static CompletableFuture<LlmResponse> done(LlmResponse response) {
        return CompletableFuture.completedFuture(response);
    }

    @Test
    void shouldReturnPlainAnswerWithoutTools() throws Exception {
        when(llmPort.chat(any())).thenReturn(done(text("Hello there")));

        OrchestrationResult result = loop.run(SESSION_ID, history("hi"), contextWith());

        assertEquals("Hello there", result.reply());
        assertEquals(1, result.rounds());
        assertFalse(result.roundLimitReached());
        assertTrue(result.toolCalls().isEmpty());
        verify(session).close();
    }

    @Test
    void shouldExecuteToolCallAndFeedResultBack() throws Exception {
        when(llmPort.chat(any()))
                .thenReturn(done(toolCall("call_1", "add_numbers", Map.of("a", "2", "b", 2))))
                .thenReturn(done(text("2 + 2 is 4.")));
        when(session.callTool(eq(ToolServerRegistry.TEST_ADDITION), eq("add_numbers"), any()))
                .thenReturn(ToolCallResult.success("{\"sum\":4}", Map.of("sum", 4), "{\"sum\":4}"));
        ConversationContext context = contextWith(ToolServerRegistry.TEST_ADDITION);

        OrchestrationResult result = loop.run(SESSION_ID, history("add 2 and 2 please"), context);

        assertEquals("2 + 2 is 4.", result.reply());
        assertEquals(2, result.rounds());
        verify(session).callTool(ToolServerRegistry.TEST_ADDITION, "add_numbers", new AddNumbersArgs(2, 2));
        assertEquals(List.of(new ToolCallRecord(ToolServerRegistry.TEST_ADDITION, "add_numbers",
                "{\"a\":2,\"b\":2}", "{\"sum\":4}")), result.toolCalls());
        assertEquals(Intent.ARITHMETIC, context.getLastIntent().orElseThrow());

        ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(requests.capture());
        List<Message> second = requests.getAllValues().get(1).getMessages();
        assertEquals(3, second.size());
        assertTrue(second.get(1).hasToolCalls());
        Message toolMessage = second.get(2);
        assertEquals(Message.ROLE_TOOL, toolMessage.getRole());
        assertEquals("call_1", toolMessage.getToolCallId());
        assertEquals("{\"sum\":4}", toolMessage.getContent());
    }

    @Test
    void shouldOfferOnlyEnabledServersTools() throws Exception {
        when(llmPort.chat(any())).thenReturn(done(text("ok")));

        loop.run(SESSION_ID, history("hi"), contextWith(ToolServerRegistry.HSA_LEDGER));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        List<String> names = request.getValue().getTools().stream().map(ToolDefinition::getName).toList();
        assertEquals(List.of("get_unreimbursed_balance", "read_ledger_entries", "update_expense_status"), names);
        assertEquals(SESSION_ID, request.getValue().getSessionId());
    }

    @Test
    void shouldStopAfterMaxRoundsWithLimitMessage() throws Exception {
        when(llmPort.chat(any()))
                .thenAnswer(invocation -> done(toolCall("call", "add_numbers", Map.of("a", 1, "b", 1))));
        when(session.callTool(any(), any(), any())).thenReturn(ToolCallResult.success("2", null, "2"));

        OrchestrationResult result = loop.run(SESSION_ID, history("loop forever"),
                contextWith(ToolServerRegistry.TEST_ADDITION));

        verify(llmPort, times(4)).chat(any());
        assertTrue(result.roundLimitReached());
        assertEquals(4, result.rounds());
        assertEquals(properties.getToolLoop().getLimitMessage(), result.reply());
        assertEquals(4, result.toolCalls().size());
        verify(session).close();
    }

    @Test
    void shouldReportUnknownToolToModel() throws Exception {
        when(llmPort.chat(any()))
                .thenReturn(done(toolCall("call_x", "delete_everything", Map.of())))
                .thenReturn(done(text("I can't do that.")));

        OrchestrationResult result = loop.run(SESSION_ID, history("wipe it"),
                contextWith(ToolServerRegistry.HSA_LEDGER));

        assertEquals("I can't do that.", result.reply());
        ToolCallRecord record = result.toolCalls().get(0);
        assertEquals("unknown", record.serverId());
        assertEquals("error: Unknown tool: delete_everything", record.output());
        verify(session, never()).callTool(any(), any(), any());
    }

    @Test
    void shouldRefuseToolOfDisabledServer() throws Exception {
        when(llmPort.chat(any()))
                .thenReturn(done(toolCall("call_b", "get_unreimbursed_balance", Map.of())))
                .thenReturn(done(text("The HSA ledger is off.")));
        ConversationContext context = contextWith(ToolServerRegistry.CHARITABLE_LEDGER);

        OrchestrationResult result = loop.run(SESSION_ID, history("balance?"), context);

        verify(session, never()).callTool(any(), any(), any());
        assertEquals("error: Tool server 'hsa_ledger' is disabled for this chat", result.toolCalls().get(0).output());
        assertTrue(context.getLastIntent().isEmpty());
    }

    @Test
    void shouldNotRememberFlaggedFailures() throws Exception {
        when(llmPort.chat(any()))
                .thenReturn(done(toolCall("call_b", "get_unreimbursed_balance", Map.of())))
                .thenReturn(done(text("Something went wrong.")));
        when(session.callTool(any(), any(), any())).thenReturn(ToolCallResult.success(
                "{\"success\":false}", Map.of("success", false), "{\"success\":false}"));
        ConversationContext context = contextWith(ToolServerRegistry.HSA_LEDGER);

        loop.run(SESSION_ID, history("balance?"), context);

        assertTrue(context.getLastIntent().isEmpty());
    }

    @Test
    void shouldCloseSessionWhenServerCannotStart() throws Exception {
        when(llmPort.chat(any())).thenReturn(done(toolCall("call_1", "add_numbers", Map.of("a", 1, "b", 2))));
        when(session.callTool(any(), any(), any()))
                .thenThrow(new SpawnException(ToolServerRegistry.TEST_ADDITION, "Cannot execute 'python'"));

        assertThrows(SpawnException.class, () -> loop.run(SESSION_ID, history("1+2"),
                contextWith(ToolServerRegistry.TEST_ADDITION)));
        verify(session).close();
    }

    @Test
    void shouldCloseSessionWhenModelFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertThrows(CompletionException.class, () -> loop.run(SESSION_ID, history("hi"), contextWith()));
        verify(session).close();
    }
}
