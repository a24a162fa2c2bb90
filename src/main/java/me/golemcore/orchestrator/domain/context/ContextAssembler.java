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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Attachment;
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.MemorySummary;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Persona;
import me.golemcore.orchestrator.domain.model.UserAccount;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ConversationPort;
import me.golemcore.orchestrator.port.outbound.MemorySummaryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the ordered prompt for a model call.
 *
 * <p>
 * Order:
 * <ol>
 * <li>persona system prompt with the current date</li>
 * <li>relevant long-term memory of the user's other conversations</li>
 * <li>the summary of this conversation's earlier part, if any</li>
 * <li>recent raw messages not covered by that summary, bounded by count and
 * tokens</li>
 * <li>the incoming content followed by attachment references</li>
 * </ol>
 *
 * <p>
 * The result depends only on the inputs, the stored state and the clock's
 * date, so repeated builds without state changes yield equal lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

    private final ConversationPort conversationPort;
    private final MemorySummaryPort memorySummaryPort;
    private final MemoryRecallService memoryRecallService;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public List<Message> build(UserAccount user, Persona persona, Conversation conversation, String incomingContent,
            List<Attachment> attachments) {
        List<Message> prompt = new ArrayList<>();
        prompt.add(Message.system(personaPrompt(persona)));

        List<MemorySummary> memories = memoryRecallService.recall(user.getId(), conversation.getId(),
                incomingContent);
        if (!memories.isEmpty()) {
            StringBuilder sb = new StringBuilder("Relevant context from previous conversations:");
            for (MemorySummary memory : memories) {
                sb.append("\n- ").append(memory.getSummary());
            }
            prompt.add(Message.system(sb.toString()));
        }

        Optional<MemorySummary> ownSummary = conversation.isSummarized()
                ? latestSummaryOf(user.getId(), conversation.getId())
                : Optional.empty();
        ownSummary.ifPresent(summary -> prompt
                .add(Message.system("Summary of earlier conversation:\n" + summary.getSummary())));

        Message incoming = Message.builder()
                .role(Message.ROLE_USER)
                .content(withAttachments(incomingContent, attachments))
                .build();

        int budget = windowTokenBudget(prompt, incoming);
        List<Message> window = RecentWindowSelector.select(unsummarizedHistory(conversation),
                properties.getMemory().getWorkingMemoryMessages(), budget);
        for (Message message : window) {
            prompt.add(forPrompt(message));
        }

        prompt.add(incoming);
        log.debug("[Context] Built prompt for {}: {} memories, summary={}, {} window messages",
                conversation.getId(), memories.size(), ownSummary.isPresent(), window.size());
        return prompt;
    }

    String personaPrompt(Persona persona) {
        LocalDate today = LocalDate.now(clock);
        return persona.getSystemPrompt()
                + "\n\nCurrent date: " + today.format(DateTimeFormatter.ISO_LOCAL_DATE)
                + " (" + today.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + ")";
    }

    static String withAttachments(String content, List<Attachment> attachments) {
        String text = content != null ? content : "";
        if (attachments == null || attachments.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text);
        sb.append("\n\n[Attached files]");
        for (Attachment attachment : attachments) {
            sb.append("\n- ").append(attachment.getFilename() != null ? attachment.getFilename() : "file");
            List<String> details = new ArrayList<>();
            if (attachment.getMimeType() != null) {
                details.add(attachment.getMimeType());
            }
            if (attachment.getSizeBytes() != null) {
                details.add(attachment.getSizeBytes() + " bytes");
            }
            if (attachment.getFileId() != null) {
                details.add("id " + attachment.getFileId());
            }
            if (!details.isEmpty()) {
                sb.append(" (").append(String.join(", ", details)).append(")");
            }
            if (attachment.getUrl() != null) {
                sb.append(": ").append(attachment.getUrl());
            }
        }
        return sb.toString();
    }

    private List<Message> unsummarizedHistory(Conversation conversation) {
        return SummaryBoundary.uncovered(conversation, conversationPort.loadMessages(conversation.getId()))
                .stream()
                .filter(m -> !m.isError())
                .toList();
    }

    private Optional<MemorySummary> latestSummaryOf(String userId, String conversationId) {
        return memorySummaryPort.findByUser(userId).stream()
                .filter(s -> Objects.equals(s.getConversationId(), conversationId))
                .max(Comparator.comparing(MemorySummary::getCoveredThrough,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                        .thenComparing(MemorySummary::getCreatedAt,
                                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
    }

    private int windowTokenBudget(List<Message> fixed, Message incoming) {
        OrchestratorProperties.MemoryProperties memory = properties.getMemory();
        int total = (int) (memory.getContextWindowTokens() * memory.getContextBudgetRatio());
        int used = TokenEstimator.estimate(fixed) + TokenEstimator.estimate(incoming);
        return Math.max(0, total - used);
    }

    private static Message forPrompt(Message stored) {
        return Message.builder()
                .role(stored.getRole())
                .content(stored.getContent())
                .toolCallId(stored.getToolCallId())
                .toolName(stored.getToolName())
                .toolArguments(stored.getToolArguments())
                .build();
    }
}
