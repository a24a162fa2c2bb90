package me.golemcore.orchestrator.domain.context;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.MemorySummary;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.router.ModelRouter;
import me.golemcore.orchestrator.domain.router.RoutedResponse;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ConversationPort;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import me.golemcore.orchestrator.port.outbound.MemorySummaryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Background summarization of long conversations into long-term memory.
 *
 * <p>
 * When the raw messages not yet covered by a summary reach
 * {@code orchestrator.memory.summarize-threshold-messages}, everything except
 * the most recent working-memory window is summarized by the summarization
 * model, together with the previous summary. The result is written as a new
 * immutable {@link MemorySummary} and the conversation is marked summarized
 * through the last covered message. At most one summarization per
 * conversation runs at a time; turns never wait for it.
 *
 * <p>
 * A background sweep also summarizes conversations left idle for longer than
 * the conversation timeout, covering everything not yet summarized. It is
 * scheduled in {@link #start()} every
 * {@code orchestrator.memory.idle-summarization-interval-ms} (0 disables it)
 * and stopped in {@link #shutdown()}. Each sweep also releases cached message
 * logs of idle conversations.
 */
@Service
@Slf4j
public class ConversationSummarizer {

    private static final String SUMMARY_INSTRUCTIONS = "Summarize the following conversation concisely. "
            + "Keep the key facts, decisions, user preferences and any unfinished tasks. "
            + "Write in third person and do not add information that is not in the conversation.";
    private static final int TOOL_RESULT_PREVIEW_CHARS = 300;
    private static final long EMBED_TIMEOUT_MS = 10_000;

    private final ModelRouter modelRouter;
    private final ConversationPort conversationPort;
    private final MemorySummaryPort memorySummaryPort;
    private final EmbeddingPort embeddingPort;
    private final OrchestratorProperties.MemoryProperties config;
    private final Duration conversationTimeout;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "conversation-summarizer");
        thread.setDaemon(true);
        return thread;
    });
    private ScheduledExecutorService idleScheduler;

    public ConversationSummarizer(ModelRouter modelRouter, ConversationPort conversationPort,
            MemorySummaryPort memorySummaryPort, EmbeddingPort embeddingPort, OrchestratorProperties properties,
            Clock clock) {
        this.modelRouter = modelRouter;
        this.conversationPort = conversationPort;
        this.memorySummaryPort = memorySummaryPort;
        this.embeddingPort = embeddingPort;
        this.config = properties.getMemory();
        this.conversationTimeout = Duration.ofMinutes(properties.getLoop().getConversationTimeoutMinutes());
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        long interval = config.getIdleSummarizationIntervalMs();
        if (interval > 0) {
            idleScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "idle-conversation-sweep");
                thread.setDaemon(true);
                return thread;
            });
            idleScheduler.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (idleScheduler != null) {
            idleScheduler.shutdownNow();
            idleScheduler = null;
        }
        executor.shutdownNow();
    }

    /**
     * Summarize conversations idle for longer than the conversation timeout, at
     * most one batch per call. A failing conversation is logged and skipped.
     *
     * @return number of conversations summarized
     */
    public int summarizeIdle() {
        Instant cutoff = clock.instant().minus(conversationTimeout);
        List<Conversation> idle = conversationPort.findIdleUnsummarized(cutoff,
                config.getIdleSummarizationBatchSize());
        int count = 0;
        for (Conversation conversation : idle) {
            if (!inFlight.add(conversation.getId())) {
                continue;
            }
            try {
                if (summarizeWhole(conversation)) {
                    count++;
                }
            } catch (RuntimeException e) {
                log.error("[Summarizer] Idle summarization failed for {}", conversation.getId(), e);
            } finally {
                inFlight.remove(conversation.getId());
            }
        }
        conversationPort.evictInactive(cutoff);
        if (count > 0) {
            log.info("[Summarizer] Summarized {} idle conversation(s)", count);
        }
        return count;
    }

    private void sweepSafely() {
        try {
            summarizeIdle();
        } catch (RuntimeException e) {
            log.warn("[Summarizer] Idle sweep failed: {}", e.getMessage());
        }
    }

    private boolean summarizeWhole(Conversation conversation) {
        List<Message> all = conversationPort.loadMessages(conversation.getId());
        List<Message> uncovered = SummaryBoundary.uncovered(conversation, all);
        String throughId = all.isEmpty()
                ? conversation.getSummarizedThroughMessageId()
                : all.get(all.size() - 1).getId();
        boolean hasDialogue = uncovered.stream().anyMatch(m -> m.isUserMessage() || m.isAssistantMessage());
        if (!hasDialogue) {
            conversationPort.markFullySummarized(conversation.getId(), throughId, conversation.getLastActiveAt());
            return false;
        }
        Optional<MemorySummary> summary = writeSummary(conversation, uncovered, conversation.getLastActiveAt());
        if (summary.isEmpty()) {
            return false;
        }
        conversationPort.markFullySummarized(conversation.getId(), throughId, conversation.getLastActiveAt());
        return true;
    }

    /**
     * Schedule summarization if the conversation crossed the threshold and none is
     * running for it.
     *
     * @return the pending summarization, or a completed empty future when nothing
     *         was scheduled
     */
    public CompletableFuture<Optional<MemorySummary>> maybeSummarize(String conversationId) {
        if (!inFlight.add(conversationId)) {
            log.debug("[Summarizer] Already running for {}", conversationId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.supplyAsync(() -> summarizeIfDue(conversationId), executor)
                    .whenComplete((result, error) -> {
                        inFlight.remove(conversationId);
                        if (error != null) {
                            log.warn("[Summarizer] Failed for {}: {}", conversationId, error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            inFlight.remove(conversationId);
            throw e;
        }
    }

    private Optional<MemorySummary> summarizeIfDue(String conversationId) {
        Optional<Conversation> found = conversationPort.findById(conversationId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Conversation conversation = found.get();
        List<Message> uncovered = SummaryBoundary.uncovered(conversation,
                conversationPort.loadMessages(conversationId));
        if (uncovered.size() < config.getSummarizeThresholdMessages()) {
            return Optional.empty();
        }

        List<Message> toCover = uncovered.subList(0,
                SummaryBoundary.splitIndex(uncovered, config.getWorkingMemoryMessages()));
        if (toCover.isEmpty()) {
            return Optional.empty();
        }

        Message last = toCover.get(toCover.size() - 1);
        Instant coveredThrough = last.getTimestamp() != null ? last.getTimestamp() : clock.instant();
        Optional<MemorySummary> summary = writeSummary(conversation, toCover, coveredThrough);
        summary.ifPresent(s -> conversationPort.markSummarized(conversationId, last.getId(), coveredThrough));
        return summary;
    }

    private Optional<MemorySummary> writeSummary(Conversation conversation, List<Message> toCover,
            Instant coveredThrough) {
        String conversationId = conversation.getId();
        String previousSummary = previousSummary(conversation).orElse(null);
        String transcript = transcript(previousSummary, toCover);

        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.system(SUMMARY_INSTRUCTIONS),
                        Message.builder().role(Message.ROLE_USER).content(transcript).build()))
                .tools(List.of())
                .build();
        RoutedResponse routed = modelRouter.completeForSummarization(request);
        String summaryText = routed.response().getContent();
        if (summaryText == null || summaryText.isBlank()) {
            log.warn("[Summarizer] Empty summary for {}, leaving conversation unsummarized", conversationId);
            return Optional.empty();
        }

        MemorySummary summary = MemorySummary.builder()
                .id(UUID.randomUUID().toString())
                .userId(conversation.getUserId())
                .conversationId(conversationId)
                .summary(summaryText.trim())
                .embedding(embed(summaryText))
                .coveredThrough(coveredThrough)
                .createdAt(clock.instant())
                .build();
        memorySummaryPort.save(summary);
        log.info("[Summarizer] Summarized {} message(s) of {} through {}", toCover.size(), conversationId,
                coveredThrough);
        return Optional.of(summary);
    }

    private Optional<String> previousSummary(Conversation conversation) {
        if (!conversation.isSummarized()) {
            return Optional.empty();
        }
        return memorySummaryPort.findByUser(conversation.getUserId()).stream()
                .filter(s -> Objects.equals(s.getConversationId(), conversation.getId()))
                .max(Comparator.comparing(MemorySummary::getCoveredThrough,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                        .thenComparing(MemorySummary::getCreatedAt,
                                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .map(MemorySummary::getSummary);
    }

    String transcript(String previousSummary, List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        if (previousSummary != null) {
            sb.append("Earlier summary: ").append(previousSummary).append("\n\n");
        }
        for (Message message : messages) {
            switch (message.getRole()) {
            case Message.ROLE_USER -> sb.append("User: ").append(message.getContent()).append('\n');
            case Message.ROLE_ASSISTANT -> sb.append("Assistant: ").append(message.getContent()).append('\n');
            case Message.ROLE_TOOL_CALL -> sb.append("[Called tool ").append(message.getToolName()).append("]\n");
            case Message.ROLE_TOOL_RESULT -> sb.append("[Tool result: ")
                    .append(truncate(message.getContent(), TOOL_RESULT_PREVIEW_CHARS)).append("]\n");
            default -> {
                // system messages are not part of the transcript
            }
            }
        }
        return truncate(sb.toString(), config.getSummaryInputMaxChars());
    }

    private float[] embed(String text) {
        if (!embeddingPort.isAvailable()) {
            return null;
        }
        try {
            return embeddingPort.embed(text).get(EMBED_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Summarizer] Embedding failed, storing summary without vector: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "...";
    }
}
