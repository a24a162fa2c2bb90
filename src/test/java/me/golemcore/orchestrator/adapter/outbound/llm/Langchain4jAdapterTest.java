package me.golemcore.orchestrator.adapter.outbound.llm;

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
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.StopReason;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolParameter;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String SEARCH = "research.web_search";
    private static final String MODEL = "claude-sonnet-4-20250514";

    private OrchestratorProperties properties;
    private ChatModel chatModel;
    private AbstractLangchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        OrchestratorProperties.VendorProperties vendor = new OrchestratorProperties.VendorProperties();
        vendor.setApiKey("test-key");
        properties.getLlm().getVendors().put("anthropic", vendor);
        chatModel = mock(ChatModel.class);
        adapter = new AnthropicLlmAdapter(properties, new ObjectMapper()) {
            @Override
            protected ChatModel createModel(String modelName, OrchestratorProperties.VendorProperties config) {
                return chatModel;
            }
        };
    }

    private static ToolDescriptor searchTool() {
        return ToolDescriptor.builder()
                .name(SEARCH)
                .namespace("research")
                .description("Search the web")
                .minPermission(PermissionLevel.GUEST)
                .parameters(List.of(
                        ToolParameter.builder().name("query").type("string").required(true).build(),
                        ToolParameter.builder().name("limit").type("integer").required(false).build(),
                        ToolParameter.builder().name("engine").type("string").required(false)
                                .enumValues(List.of("web", "news")).build()))
                .build();
    }

    // ===== availability =====

    @Test
    void shouldRequireApiKey() {
        assertTrue(adapter.isAvailable());

        properties.getLlm().getVendors().get("anthropic").setApiKey(" ");

        assertFalse(adapter.isAvailable());
    }

    // ===== request conversion =====

    @Test
    void shouldMergeAssistantTextWithFollowingToolCall() {
        ToolNameCodec codec = ToolNameCodec.of(List.of(SEARCH));
        List<Message> source = List.of(
                Message.system("be helpful"),
                Message.builder().role(Message.ROLE_USER).content("find java").build(),
                Message.builder().role(Message.ROLE_ASSISTANT).content("Let me search.").build(),
                Message.builder().role(Message.ROLE_TOOL_CALL).toolCallId("t1").toolName(SEARCH)
                        .toolArguments(Map.of("query", "java")).build(),
                Message.builder().role(Message.ROLE_TOOL_RESULT).toolCallId("t1").toolName(SEARCH)
                        .content("{\"hits\":1}").build());

        List<ChatMessage> converted = adapter.convertMessages(source, codec);

        assertEquals(4, converted.size());
        assertInstanceOf(SystemMessage.class, converted.get(0));
        assertInstanceOf(UserMessage.class, converted.get(1));
        AiMessage ai = assertInstanceOf(AiMessage.class, converted.get(2));
        assertEquals("Let me search.", ai.text());
        ToolExecutionRequest call = ai.toolExecutionRequests().get(0);
        assertEquals("t1", call.id());
        assertEquals("research_web_search", call.name());
        assertEquals("{\"query\":\"java\"}", call.arguments());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, converted.get(3));
        assertEquals("research_web_search", result.toolName());
        assertEquals("{\"hits\":1}", result.text());
    }

    @Test
    void shouldGroupConsecutiveToolCallsIntoSeparateAiMessages() {
        ToolNameCodec codec = ToolNameCodec.of(List.of(SEARCH));
        List<Message> source = List.of(
                Message.builder().role(Message.ROLE_TOOL_CALL).toolCallId("t1").toolName(SEARCH).build(),
                Message.builder().role(Message.ROLE_TOOL_RESULT).toolCallId("t1").toolName(SEARCH).content("a")
                        .build(),
                Message.builder().role(Message.ROLE_TOOL_CALL).toolCallId("t2").toolName(SEARCH).build(),
                Message.builder().role(Message.ROLE_TOOL_RESULT).toolCallId("t2").toolName(SEARCH).content("b")
                        .build());

        List<ChatMessage> converted = adapter.convertMessages(source, codec);

        assertEquals(4, converted.size());
        assertEquals("{}", ((AiMessage) converted.get(0)).toolExecutionRequests().get(0).arguments());
    }

    @Test
    void shouldConvertToolParametersToJsonSchema() {
        ToolNameCodec codec = ToolNameCodec.of(List.of(SEARCH));

        List<ToolSpecification> toolSpecs = adapter.convertTools(List.of(searchTool()), codec);

        ToolSpecification toolSpec = toolSpecs.get(0);
        assertEquals("research_web_search", toolSpec.name());
        assertEquals(List.of("query"), toolSpec.parameters().required());
        assertInstanceOf(JsonIntegerSchema.class, toolSpec.parameters().properties().get("limit"));
        assertInstanceOf(JsonEnumSchema.class, toolSpec.parameters().properties().get("engine"));
    }

    // ===== response conversion =====

    @Test
    void shouldDecodeToolCallsFromResponse() throws Exception {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call-9")
                        .name("research_web_search")
                        .arguments("{\"query\":\"kotlin\",\"limit\":3}")
                        .build())))
                .tokenUsage(new TokenUsage(120, 30))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response);

        LlmResponse result = adapter.chat(LlmRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.builder().role(Message.ROLE_USER).content("find kotlin").build()))
                .tools(List.of(searchTool()))
                .maxTokens(512)
                .build()).get();

        assertEquals(StopReason.TOOL_USE, result.getStopReason());
        Message.ToolCall call = result.getToolCalls().get(0);
        assertEquals(SEARCH, call.getName());
        assertEquals("kotlin", call.getArguments().get("query"));
        assertEquals(3, call.getArguments().get("limit"));
        assertEquals(150, result.getUsage().getTotalTokens());

        ArgumentCaptor<ChatRequest> sent = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(sent.capture());
        assertEquals(1, sent.getValue().toolSpecifications().size());
        assertEquals(512, sent.getValue().maxOutputTokens());
    }

    @Test
    void shouldMapContentFilterToErrorStop() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("I can't help with that."))
                .finishReason(FinishReason.CONTENT_FILTER)
                .build());

        LlmResponse result = adapter.chat(LlmRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.builder().role(Message.ROLE_USER).content("x").build()))
                .tools(List.of())
                .build()).get();

        assertEquals(StopReason.ERROR, result.getStopReason());
        assertTrue(result.getToolCalls().isEmpty());
    }

    @Test
    void shouldPropagateVendorFailureThroughFuture() {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new dev.langchain4j.exception.RateLimitException("429"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.chat(LlmRequest.builder()
                .model(MODEL)
                .messages(List.of(Message.builder().role(Message.ROLE_USER).content("x").build()))
                .tools(List.of())
                .build()).get());

        assertInstanceOf(dev.langchain4j.exception.RateLimitException.class, e.getCause());
    }
}
