package me.golemcore.orchestrator.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
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
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.LlmUsage;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.StopReason;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolParameter;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared langchain4j plumbing for vendor adapters.
 *
 * <p>
 * Converts canonical messages and tool descriptors into langchain4j types and
 * maps the {@link ChatResponse} back into an {@link LlmResponse}. Tool names
 * are encoded per request with {@link ToolNameCodec} and decoded in the
 * response. Vendor SDK retries are disabled; failures propagate so the router
 * can move along the fallback chain.
 *
 * <p>
 * Subclasses only decide how to build a {@link ChatModel} for a model name.
 */
@Slf4j
public abstract class AbstractLangchain4jAdapter implements LlmPort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    protected final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    protected AbstractLangchain4jAdapter(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Build a chat model for a vendor-local model name.
     */
    protected abstract ChatModel createModel(String modelName, OrchestratorProperties.VendorProperties config);

    @Override
    public boolean isAvailable() {
        OrchestratorProperties.VendorProperties config = vendorConfig();
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new IllegalStateException("Vendor not configured: " + getVendor());
            }
            ChatModel model = models.computeIfAbsent(request.getModel(),
                    name -> createModel(name, vendorConfig()));

            ToolNameCodec codec = ToolNameCodec.of(collectToolNames(request));
            List<ChatMessage> messages = convertMessages(request.getMessages(), codec);
            List<ToolSpecification> tools = convertTools(request.getTools(), codec);

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                log.trace("[LLM] Calling {}/{} with {} tools", getVendor(), request.getModel(), tools.size());
                chatRequest.toolSpecifications(tools);
            }
            if (request.getMaxTokens() != null) {
                chatRequest.maxOutputTokens(request.getMaxTokens());
            }

            ChatResponse response = model.chat(chatRequest.build());
            return convertResponse(response, codec, request.getModel());
        });
    }

    protected OrchestratorProperties.VendorProperties vendorConfig() {
        return properties.getLlm().getVendors().get(getVendor());
    }

    List<ChatMessage> convertMessages(List<Message> source, ToolNameCodec codec) {
        List<ChatMessage> messages = new ArrayList<>();
        if (source == null) {
            return messages;
        }
        for (Message msg : source) {
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case Message.ROLE_TOOL_CALL -> appendToolCall(messages, msg, codec);
            case Message.ROLE_TOOL_RESULT -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    codec.encode(msg.getToolName()),
                    msg.getContent() != null ? msg.getContent() : ""));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private void appendToolCall(List<ChatMessage> messages, Message msg, ToolNameCodec codec) {
        ToolExecutionRequest request = ToolExecutionRequest.builder()
                .id(msg.getToolCallId())
                .name(codec.encode(msg.getToolName()))
                .arguments(convertArgsToJson(msg.getToolArguments()))
                .build();

        // Text the model produced alongside the call belongs to the same assistant turn
        int last = messages.size() - 1;
        if (last >= 0 && messages.get(last) instanceof AiMessage previous && !previous.hasToolExecutionRequests()) {
            messages.set(last, AiMessage.from(previous.text(), List.of(request)));
            return;
        }
        messages.add(AiMessage.from(List.of(request)));
    }

    List<ToolSpecification> convertTools(List<ToolDescriptor> tools, ToolNameCodec codec) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        List<ToolSpecification> specifications = new ArrayList<>();
        for (ToolDescriptor tool : tools) {
            JsonObjectSchema.Builder schema = JsonObjectSchema.builder();
            List<String> required = new ArrayList<>();
            if (tool.getParameters() != null) {
                for (ToolParameter parameter : tool.getParameters()) {
                    schema.addProperty(parameter.getName(), toJsonSchemaElement(parameter));
                    if (parameter.isRequired()) {
                        required.add(parameter.getName());
                    }
                }
            }
            if (!required.isEmpty()) {
                schema.required(required);
            }
            specifications.add(ToolSpecification.builder()
                    .name(codec.encode(tool.getName()))
                    .description(tool.getDescription())
                    .parameters(schema.build())
                    .build());
        }
        return specifications;
    }

    private JsonSchemaElement toJsonSchemaElement(ToolParameter parameter) {
        String description = parameter.getDescription() != null && !parameter.getDescription().isBlank()
                ? parameter.getDescription()
                : null;

        if (parameter.getEnumValues() != null && !parameter.getEnumValues().isEmpty()) {
            return JsonEnumSchema.builder().enumValues(parameter.getEnumValues()).description(description).build();
        }

        return switch (parameter.getType()) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> JsonArraySchema.builder()
                .description(description)
                .items(JsonStringSchema.builder().build())
                .build();
        case "object" -> JsonObjectSchema.builder().description(description).build();
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    LlmResponse convertResponse(ChatResponse response, ToolNameCodec codec, String modelName) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = List.of();
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name() != null ? codec.decode(ter.name()) : null)
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            int input = orZero(response.tokenUsage().inputTokenCount());
            int output = orZero(response.tokenUsage().outputTokenCount());
            usage = LlmUsage.of(input, output);
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .stopReason(mapFinishReason(response.finishReason(), !toolCalls.isEmpty()))
                .usage(usage)
                .model(modelName)
                .build();
    }

    private static StopReason mapFinishReason(FinishReason finishReason, boolean hasToolCalls) {
        if (hasToolCalls || finishReason == FinishReason.TOOL_EXECUTION) {
            return StopReason.TOOL_USE;
        }
        if (finishReason == FinishReason.CONTENT_FILTER) {
            return StopReason.ERROR;
        }
        return StopReason.END_TURN;
    }

    private static Set<String> collectToolNames(LlmRequest request) {
        Set<String> names = new LinkedHashSet<>();
        if (request.getTools() != null) {
            request.getTools().forEach(tool -> names.add(tool.getName()));
        }
        if (request.getMessages() != null) {
            for (Message msg : request.getMessages()) {
                if (msg.getToolName() != null) {
                    names.add(msg.getToolName());
                }
            }
        }
        return names;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
