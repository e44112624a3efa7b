package me.golemcore.household.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.household.domain.model.LlmRequest;
import me.golemcore.household.domain.model.LlmResponse;
import me.golemcore.household.domain.model.Message;
import me.golemcore.household.domain.model.ToolDefinition;
import me.golemcore.household.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private ChatModel chatModel;
    private AssistantProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        properties = new AssistantProperties();
        adapter = new Langchain4jAdapter(properties, new ObjectMapper(), chatModel);
    }

    private static ToolDefinition addNumbers() {
        return ToolDefinition.builder()
                .name("add_numbers")
                .description("Add two numbers")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "a", Map.of("type", "number"),
                                "b", Map.of("type", "number")),
                        "required", List.of("a", "b")))
                .build();
    }

    @Test
    void shouldConvertConversationWithToolRoundTrip() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("Be helpful")
                .messages(List.of(
                        Message.user("2+2?"),
                        Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(
                                Message.ToolCall.builder().id("c1").name("add_numbers")
                                        .arguments(Map.of("a", 2)).build()))
                                .build(),
                        Message.builder().role(Message.ROLE_TOOL).toolCallId("c1").toolName("add_numbers")
                                .content("4").build(),
                        Message.assistant("It is 4.")))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage toolCall = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("{\"a\":2}", toolCall.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("c1", result.id());
        assertEquals("4", result.text());
        assertEquals("It is 4.", assertInstanceOf(AiMessage.class, messages.get(4)).text());
    }

    @Test
    void shouldConvertToolSchemas() {
        List<ToolSpecification> tools = adapter.convertTools(LlmRequest.builder().tools(List.of(addNumbers())).build());

        assertEquals(1, tools.size());
        JsonObjectSchema parameters = tools.get(0).parameters();
        assertEquals(List.of("a", "b"), parameters.required());
        assertEquals(2, parameters.properties().size());
    }

    @Test
    void shouldMapSchemaTypes() {
        assertInstanceOf(JsonIntegerSchema.class, adapter.toJsonSchemaElement(Map.of("type", "integer")));
        assertInstanceOf(JsonEnumSchema.class,
                adapter.toJsonSchemaElement(Map.of("type", "string", "enum", List.of("paid", "unpaid"))));
        assertInstanceOf(JsonStringSchema.class, adapter.toJsonSchemaElement(Map.of("type", "whatever")));

        JsonSchemaElement array = adapter.toJsonSchemaElement(Map.of("type", "array", "items", Map.of(
                "type", "object", "properties", Map.of("column", Map.of("type", "string")))));
        JsonArraySchema arraySchema = assertInstanceOf(JsonArraySchema.class, array);
        assertInstanceOf(JsonObjectSchema.class, arraySchema.items());
    }

    @Test
    void shouldReturnToolCallsFromModel() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_1").name("add_numbers").arguments("{\"a\":2,\"b\":2}").build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.user("2+2")))
                .tools(List.of(addNumbers()))
                .build();

        LlmResponse response = adapter.chat(request).join();

        assertTrue(response.hasToolCalls());
        Message.ToolCall call = response.getToolCalls().get(0);
        assertEquals("call_1", call.getId());
        assertEquals(Map.of("a", 2, "b", 2), call.getArguments());
        assertEquals("TOOL_EXECUTION", response.getFinishReason());
        ArgumentCaptor<ChatRequest> sent = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(sent.capture());
        assertEquals(1, sent.getValue().toolSpecifications().size());
    }

    @Test
    void shouldReturnPlainText() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello"))
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder().messages(List.of(Message.user("hi"))).build())
                .join();

        assertFalse(response.hasToolCalls());
        assertEquals("Hello", response.getContent());
        assertEquals("stop", response.getFinishReason());
    }

    @Test
    void shouldWrapNonRetryableFailures() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("invalid api key"));
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.user("2+2")))
                .tools(List.of(addNumbers()))
                .build();

        CompletionException e = assertThrows(CompletionException.class, () -> adapter.chat(request).join());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void shouldTreatMalformedArgumentsAsEmpty() {
        assertTrue(adapter.parseJsonArgs("{not json").isEmpty());
        assertTrue(adapter.parseJsonArgs("").isEmpty());
        assertEquals(Map.of("year", 2025), adapter.parseJsonArgs("{\"year\":2025}"));
    }

    @Test
    void shouldRequireApiKey() {
        Langchain4jAdapter unconfigured = new Langchain4jAdapter(properties, new ObjectMapper());

        assertFalse(unconfigured.isAvailable());
        CompletionException e = assertThrows(CompletionException.class,
                () -> unconfigured.chat(LlmRequest.builder().build()).join());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
