package me.golemcore.orchestrator.domain.loop;

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

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.context.ContextAssembler;
import me.golemcore.orchestrator.domain.context.ConversationSummarizer;
import me.golemcore.orchestrator.domain.context.TokenEstimator;
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.FileReference;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Persona;
import me.golemcore.orchestrator.domain.model.StopReason;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolInvocationResult;
import me.golemcore.orchestrator.domain.model.TurnCancellation;
import me.golemcore.orchestrator.domain.model.TurnOutcome;
import me.golemcore.orchestrator.domain.model.TurnRequest;
import me.golemcore.orchestrator.domain.model.TurnResponse;
import me.golemcore.orchestrator.domain.model.UserAccount;
import me.golemcore.orchestrator.domain.router.ModelRouter;
import me.golemcore.orchestrator.domain.router.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.router.RoutedResponse;
import me.golemcore.orchestrator.domain.tools.ToolRegistry;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.TurnHandlerPort;
import me.golemcore.orchestrator.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs one conversational turn as a state machine:
 *
 * <pre>
 * START -> BUDGET_CHECK -> BUILD_CONTEXT -> CALL_MODEL
 *       -> {TOOL_USE -> EXECUTE_TOOLS -> CALL_MODEL}*
 *       -> {END_TURN | ERROR} -> DONE
 * </pre>
 *
 * <p>
 * Every path ends in a structured {@link TurnResponse}; nothing escapes the
 * loop. Tool calls requested by the model are checked against the tools
 * offered in this turn before anything runs. Each model call is debited from
 * the user's budget. When the caller cancels, results still in flight are
 * discarded and nothing more is persisted.
 */
@Service
@Slf4j
public class AgentLoop implements TurnHandlerPort {

    static final String BUDGET_EXCEEDED_MESSAGE = "You've exceeded your monthly token budget. "
            + "Please contact an admin to increase your limit.";
    static final String ITERATION_LIMIT_MESSAGE = "I wasn't able to complete the task within the allowed number "
            + "of steps. Here's what I have so far.";
    static final String PROVIDER_UNAVAILABLE_MESSAGE = "I can't reach any language model right now. "
            + "Please try again in a few minutes.";
    static final String INTERNAL_ERROR_MESSAGE = "I encountered an internal error. Please try again.";
    static final String CANCELLED_MESSAGE = "The request was cancelled.";

    private final TurnResolver turnResolver;
    private final ContextAssembler contextAssembler;
    private final ModelRouter modelRouter;
    private final ToolRegistry toolRegistry;
    private final ToolBatchExecutor toolBatchExecutor;
    private final ConversationPort conversationPort;
    private final UsageRecorder usageRecorder;
    private final ConversationSummarizer summarizer;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService turnExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "agent-turn-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public AgentLoop(TurnResolver turnResolver, ContextAssembler contextAssembler, ModelRouter modelRouter,
            ToolRegistry toolRegistry, ToolBatchExecutor toolBatchExecutor, ConversationPort conversationPort,
            UsageRecorder usageRecorder, ConversationSummarizer summarizer, OrchestratorProperties properties,
            Clock clock) {
        this.turnResolver = turnResolver;
        this.contextAssembler = contextAssembler;
        this.modelRouter = modelRouter;
        this.toolRegistry = toolRegistry;
        this.toolBatchExecutor = toolBatchExecutor;
        this.conversationPort = conversationPort;
        this.usageRecorder = usageRecorder;
        this.summarizer = summarizer;
        this.properties = properties;
        this.clock = clock;
    }

    @PreDestroy
    public void shutdown() {
        turnExecutor.shutdownNow();
        try {
            turnExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public CompletableFuture<TurnResponse> handleTurn(TurnRequest request, TurnCancellation cancellation) {
        TurnCancellation effective = cancellation != null ? cancellation : TurnCancellation.none();
        return CompletableFuture.supplyAsync(() -> runTurn(request, effective), turnExecutor);
    }

    /**
     * Process a turn on the calling thread.
     */
    public TurnResponse runTurn(TurnRequest request, TurnCancellation cancellation) {
        Turn turn = null;
        try {
            TurnResolver.ResolvedTurn resolved = turnResolver.resolve(request);
            turn = new Turn(resolved.user(), resolved.persona(), resolved.conversation(), request.getServerId(),
                    cancellation);
            log.info("[AgentLoop] Turn for user {} in conversation {} (persona {})", turn.user.getId(),
                    turn.conversation.getId(), turn.persona.getId());
            return run(turn, request);
        } catch (CancellationException e) {
            log.info("[AgentLoop] Turn cancelled: {}", e.getMessage());
            return cancelled(turn);
        } catch (RuntimeException e) {
            log.error("[AgentLoop] Turn failed", e);
            return TurnResponse.builder()
                    .conversationId(turn != null ? turn.conversation.getId() : null)
                    .content(INTERNAL_ERROR_MESSAGE)
                    .files(List.of())
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .outcome(TurnOutcome.INTERNAL_ERROR)
                    .modelCalls(turn != null ? turn.modelCalls : 0)
                    .toolCalls(turn != null ? turn.toolCalls : 0)
                    .build();
        }
    }

    private TurnResponse run(Turn turn, TurnRequest request) {
        // BUDGET_CHECK
        if (!hasBudgetFor(turn.user, request.getContent())) {
            log.info("[AgentLoop] Budget exceeded for user {} (remaining {})", turn.user.getId(),
                    turn.user.getRemainingTokens());
            return respond(turn, BUDGET_EXCEEDED_MESSAGE, "budget_exceeded", TurnOutcome.BUDGET_EXCEEDED, false);
        }

        // BUILD_CONTEXT
        List<Message> working = new ArrayList<>(contextAssembler.build(turn.user, turn.persona, turn.conversation,
                request.getContent(), request.getAttachments()));
        Message incoming = working.get(working.size() - 1);
        persist(turn, List.of(stored(turn, incoming.toBuilder()).build()));

        List<ToolDescriptor> tools = toolRegistry.listTools(turn.user.getPermissionLevel(),
                turn.persona.getAllowedNamespaces());
        Set<String> offered = tools.stream().map(ToolDescriptor::getName).collect(Collectors.toSet());
        int maxIterations = Math.max(1, properties.getLoop().getMaxIterations());
        String lastText = "";

        while (true) {
            // CALL_MODEL
            checkCancelled(turn);
            RoutedResponse routed;
            try {
                routed = modelRouter.complete(LlmRequest.builder()
                        .model(turn.persona.getPreferredModel())
                        .messages(List.copyOf(working))
                        .tools(tools)
                        .maxTokens(turn.persona.getMaxTokensPerRequest())
                        .build());
            } catch (ProviderUnavailableException e) {
                return providerUnavailable(turn, e);
            }
            turn.modelCalls++;
            LlmResponse response = routed.response();
            turn.user = usageRecorder.record(turn.user, turn.conversation.getId(), routed.servedBy(),
                    response.getUsage());
            checkCancelled(turn);

            if (response.getStopReason() != StopReason.TOOL_USE) {
                return finish(turn, response);
            }
            if (!response.getContent().isBlank()) {
                lastText = response.getContent();
            }

            if (turn.modelCalls >= maxIterations) {
                log.warn("[AgentLoop] Iteration limit {} reached in {}", maxIterations, turn.conversation.getId());
                String content = lastText.isBlank() ? ITERATION_LIMIT_MESSAGE
                        : ITERATION_LIMIT_MESSAGE + "\n\n" + lastText;
                persist(turn, List.of(stored(turn, Message.builder()
                        .role(Message.ROLE_ASSISTANT)
                        .content(content)
                        .partial(true)).build()));
                return respond(turn, content, "iteration_limit_reached", TurnOutcome.ITERATION_LIMIT_REACHED, true);
            }

            List<Message.ToolCall> refused = response.getToolCalls().stream()
                    .filter(call -> !offered.contains(call.getName()))
                    .toList();
            if (!refused.isEmpty()) {
                return refuseUnknownTools(turn, response, refused);
            }

            // EXECUTE_TOOLS
            List<Message> produced = executeTools(turn, response);
            checkCancelled(turn);
            persist(turn, produced);
            working.addAll(produced);
        }
    }

    private List<Message> executeTools(Turn turn, LlmResponse response) {
        List<Message.ToolCall> calls = response.getToolCalls();
        Map<String, Object> routingContext = routingContext(turn);
        List<ToolInvocation> invocations = calls.stream()
                .map(call -> ToolInvocation.builder()
                        .toolName(call.getName())
                        .arguments(call.getArguments())
                        .actingUserId(turn.user.getId())
                        .routingContext(routingContext)
                        .build())
                .toList();
        log.debug("[AgentLoop] Executing {} tool call(s): {}", calls.size(),
                calls.stream().map(Message.ToolCall::getName).toList());

        List<ToolInvocationResult> results = toolBatchExecutor.executeAll(invocations);
        turn.toolCalls += calls.size();

        List<Message> produced = new ArrayList<>();
        if (!response.getContent().isBlank()) {
            produced.add(stored(turn, Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .model(response.getModel())).build());
        }
        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);
            ToolInvocationResult result = results.get(i);
            if (!result.isSuccess()) {
                log.info("[AgentLoop] Tool {} failed ({}): {}", call.getName(), result.getFailureKind(),
                        result.getError());
            } else {
                turn.files.addAll(FileReferenceCollector.collect(result.getPayload()));
            }
            produced.add(toolCallMessage(turn, call));
            produced.add(toolResultMessage(turn, call, resultContent(result)));
        }
        return produced;
    }

    private TurnResponse refuseUnknownTools(Turn turn, LlmResponse response, List<Message.ToolCall> refused) {
        String names = refused.stream().map(Message.ToolCall::getName).collect(Collectors.joining(", "));
        log.warn("[AgentLoop] Model requested tool(s) not offered in this turn: {}", names);

        List<Message> produced = new ArrayList<>();
        if (!response.getContent().isBlank()) {
            produced.add(stored(turn, Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .model(response.getModel())).build());
        }
        for (Message.ToolCall call : refused) {
            produced.add(toolCallMessage(turn, call));
            produced.add(toolResultMessage(turn, call, "Error: Unknown tool: " + call.getName()));
        }
        String content = "I tried to use a tool that isn't available to me: " + names + ".";
        produced.add(stored(turn, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .error(true)).build());
        persist(turn, produced);
        return respond(turn, content, "unknown_tool: " + names, TurnOutcome.UNKNOWN_TOOL, false);
    }

    private TurnResponse finish(Turn turn, LlmResponse response) {
        boolean refusedByModel = response.getStopReason() == StopReason.ERROR;
        String content = response.getContent();
        if (refusedByModel && content.isBlank()) {
            content = "The model could not produce a response to this request.";
        }
        persist(turn, List.of(stored(turn, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .model(response.getModel())
                .tokenCount(response.getUsage() != null ? response.getUsage().getOutputTokens() : null)
                .error(refusedByModel)).build()));
        String error = refusedByModel
                ? (response.getError() != null ? response.getError() : "model_stopped_with_error")
                : null;
        return respond(turn, content, error, TurnOutcome.COMPLETED, false);
    }

    private TurnResponse providerUnavailable(Turn turn, ProviderUnavailableException e) {
        log.error("[AgentLoop] No model available after {} attempt(s): {}", e.getAttempts(), e.getLastErrorCode());
        persist(turn, List.of(stored(turn, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(PROVIDER_UNAVAILABLE_MESSAGE)
                .error(true)).build()));
        String error = "provider_unavailable"
                + (e.getLastErrorCode() != null ? ": " + e.getLastErrorCode() : "");
        return respond(turn, PROVIDER_UNAVAILABLE_MESSAGE, error, TurnOutcome.PROVIDER_UNAVAILABLE, false);
    }

    private TurnResponse respond(Turn turn, String content, String error, TurnOutcome outcome, boolean partial) {
        if (outcome != TurnOutcome.BUDGET_EXCEEDED) {
            conversationPort.touch(turn.conversation.getId(), clock.instant());
            summarizer.maybeSummarize(turn.conversation.getId());
        }
        log.info("[AgentLoop] Turn done: {} ({} model call(s), {} tool call(s))", outcome, turn.modelCalls,
                turn.toolCalls);
        return TurnResponse.builder()
                .conversationId(turn.conversation.getId())
                .content(content)
                .files(List.copyOf(turn.files))
                .error(error)
                .partial(partial)
                .outcome(outcome)
                .modelCalls(turn.modelCalls)
                .toolCalls(turn.toolCalls)
                .build();
    }

    private TurnResponse cancelled(Turn turn) {
        return TurnResponse.builder()
                .conversationId(turn != null ? turn.conversation.getId() : null)
                .content(CANCELLED_MESSAGE)
                .files(List.of())
                .error("cancelled")
                .outcome(TurnOutcome.CANCELLED)
                .modelCalls(turn != null ? turn.modelCalls : 0)
                .toolCalls(turn != null ? turn.toolCalls : 0)
                .build();
    }

    private boolean hasBudgetFor(UserAccount user, String content) {
        if (!user.isMetered()) {
            return true;
        }
        long remaining = user.getRemainingTokens();
        long estimate = (long) TokenEstimator.estimate(content) + properties.getLoop().getMinimalCallReserveTokens();
        return remaining > 0 && estimate <= remaining;
    }

    private void checkCancelled(Turn turn) {
        if (turn.cancellation.isCancelled()) {
            throw new CancellationException("Cancelled by caller");
        }
    }

    private void persist(Turn turn, List<Message> messages) {
        checkCancelled(turn);
        conversationPort.appendMessages(turn.conversation.getId(), messages);
    }

    private String resultContent(ToolInvocationResult result) {
        String content;
        if (result.isSuccess()) {
            JsonNode payload = result.getPayload();
            content = payload == null || payload.isNull() ? "" : payload.isTextual() ? payload.asText()
                    : payload.toString();
        } else {
            content = "Error: " + result.getError();
        }
        int max = properties.getTools().getMaxResultLength();
        if (content.length() > max) {
            return content.substring(0, max) + "\n[truncated, " + content.length() + " chars total]";
        }
        return content;
    }

    private Message toolCallMessage(Turn turn, Message.ToolCall call) {
        return stored(turn, Message.builder()
                .role(Message.ROLE_TOOL_CALL)
                .content("")
                .toolCallId(call.getId())
                .toolName(call.getName())
                .toolArguments(call.getArguments())).build();
    }

    private Message toolResultMessage(Turn turn, Message.ToolCall call, String content) {
        return stored(turn, Message.builder()
                .role(Message.ROLE_TOOL_RESULT)
                .content(content)
                .toolCallId(call.getId())
                .toolName(call.getName())).build();
    }

    private Message.MessageBuilder stored(Turn turn, Message.MessageBuilder builder) {
        return builder
                .id(UUID.randomUUID().toString())
                .conversationId(turn.conversation.getId())
                .timestamp(clock.instant());
    }

    private static Map<String, Object> routingContext(Turn turn) {
        Conversation conversation = turn.conversation;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("conversation_id", conversation.getId());
        putIfPresent(context, "platform", conversation.getPlatform());
        putIfPresent(context, "server_id", turn.serverId);
        putIfPresent(context, "channel_id", conversation.getChannelId());
        putIfPresent(context, "thread_id", conversation.getThreadId());
        return context;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    /**
     * Mutable state of a single turn, confined to the thread running it.
     */
    private static final class Turn {
        private UserAccount user;
        private final Persona persona;
        private final Conversation conversation;
        private final String serverId;
        private final TurnCancellation cancellation;
        private final List<FileReference> files = new ArrayList<>();
        private int modelCalls;
        private int toolCalls;

        private Turn(UserAccount user, Persona persona, Conversation conversation, String serverId,
                TurnCancellation cancellation) {
            this.user = user;
            this.persona = persona;
            this.conversation = conversation;
            this.serverId = serverId;
            this.cancellation = cancellation;
        }
    }
}
