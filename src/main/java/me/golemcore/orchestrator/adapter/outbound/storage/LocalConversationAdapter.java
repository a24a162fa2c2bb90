package me.golemcore.orchestrator.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.port.outbound.ConversationPort;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Conversations on the local workspace.
 *
 * <p>
 * Each conversation is a JSON header ({@code conversations/<id>.json}) and an
 * append-only JSONL message log ({@code conversations/<id>.messages.jsonl}).
 * Headers are loaded at startup; message logs are loaded on first access and
 * kept in memory until the conversation goes inactive and
 * {@link #evictInactive} releases them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalConversationAdapter implements ConversationPort {

    private static final String DIR = "conversations";
    private static final String HEADER_EXTENSION = ".json";
    private static final String LOG_EXTENSION = ".messages.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, Conversation> headers = new ConcurrentHashMap<>();
    private final Map<String, List<Message>> logs = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadHeaders() {
        List<String> files = storagePort.listObjects(DIR, "").join();
        for (String file : files) {
            if (!file.endsWith(HEADER_EXTENSION)) {
                continue;
            }
            try {
                String json = storagePort.getText(DIR, file).join();
                Conversation conversation = objectMapper.readValue(json, Conversation.class);
                headers.put(conversation.getId(), conversation);
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[Conversations] Skipping unreadable header {}: {}", file, e.getMessage());
            }
        }
        log.info("[Conversations] Loaded {} conversation(s)", headers.size());
    }

    @Override
    public Optional<Conversation> findById(String conversationId) {
        return Optional.ofNullable(headers.get(conversationId)).map(c -> c.toBuilder().build());
    }

    @Override
    public Optional<Conversation> findActive(String userId, String platform, String channelId, String threadId,
            Instant activeSince) {
        return headers.values().stream()
                .filter(c -> Objects.equals(c.getUserId(), userId))
                .filter(c -> Objects.equals(c.getPlatform(), platform))
                .filter(c -> Objects.equals(c.getChannelId(), channelId))
                .filter(c -> Objects.equals(c.getThreadId(), threadId))
                .filter(c -> c.getLastActiveAt() != null && !c.getLastActiveAt().isBefore(activeSince))
                .max(Comparator.comparing(Conversation::getLastActiveAt))
                .map(c -> c.toBuilder().build());
    }

    @Override
    public void save(Conversation conversation) {
        headers.compute(conversation.getId(), (id, existing) -> persist(conversation.toBuilder().build()));
    }

    @Override
    public void touch(String conversationId, Instant lastActiveAt) {
        update(conversationId, c -> c.toBuilder().lastActiveAt(lastActiveAt).build());
    }

    @Override
    public void markSummarized(String conversationId, String throughMessageId, Instant summarizedThrough) {
        update(conversationId, c -> c.toBuilder()
                .summarized(true)
                .summarizedThrough(summarizedThrough)
                .summarizedThroughMessageId(throughMessageId)
                .build());
    }

    @Override
    public void markFullySummarized(String conversationId, String throughMessageId, Instant summarizedThrough) {
        update(conversationId, c -> c.toBuilder()
                .summarized(true)
                .fullySummarized(true)
                .summarizedThrough(summarizedThrough)
                .summarizedThroughMessageId(throughMessageId)
                .build());
    }

    @Override
    public List<Conversation> findIdleUnsummarized(Instant inactiveBefore, int limit) {
        return headers.values().stream()
                .filter(c -> c.getLastActiveAt() != null && c.getLastActiveAt().isBefore(inactiveBefore))
                .filter(c -> !c.isFullySummarized() || c.getSummarizedThrough() == null
                        || c.getSummarizedThrough().isBefore(c.getLastActiveAt()))
                .sorted(Comparator.comparing(Conversation::getLastActiveAt))
                .limit(limit)
                .map(c -> c.toBuilder().build())
                .toList();
    }

    @Override
    public int evictInactive(Instant inactiveBefore) {
        int evicted = 0;
        for (Map.Entry<String, List<Message>> entry : logs.entrySet()) {
            Conversation header = headers.get(entry.getKey());
            if (header != null && (header.getLastActiveAt() == null
                    || !header.getLastActiveAt().isBefore(inactiveBefore))) {
                continue;
            }
            List<Message> cached = entry.getValue();
            synchronized (cached) {
                if (logs.remove(entry.getKey(), cached)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("[Conversations] Released {} cached message log(s)", evicted);
        }
        return evicted;
    }

    private void update(String conversationId, UnaryOperator<Conversation> change) {
        Conversation updated = headers.computeIfPresent(conversationId,
                (id, existing) -> persist(change.apply(existing)));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown conversation: " + conversationId);
        }
    }

    private Conversation persist(Conversation conversation) {
        try {
            String json = objectMapper.writeValueAsString(conversation);
            storagePort.putTextAtomic(DIR, conversation.getId() + HEADER_EXTENSION, json).join();
            return conversation;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation " + conversation.getId(), e);
        }
    }

    @Override
    public void appendMessages(String conversationId, List<Message> messages) {
        if (messages.isEmpty()) {
            return;
        }
        List<Message> cached = loadLog(conversationId);
        synchronized (cached) {
            if (logs.get(conversationId) != cached) {
                // released while waiting; append through the reloaded log
                appendMessages(conversationId, messages);
                return;
            }
            StringBuilder lines = new StringBuilder();
            for (Message message : messages) {
                try {
                    lines.append(objectMapper.writeValueAsString(message)).append('\n');
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Failed to serialize message " + message.getId(), e);
                }
            }
            storagePort.appendText(DIR, conversationId + LOG_EXTENSION, lines.toString()).join();
            cached.addAll(messages);
        }
    }

    @Override
    public List<Message> loadMessages(String conversationId) {
        List<Message> cached = loadLog(conversationId);
        synchronized (cached) {
            return List.copyOf(cached);
        }
    }

    private List<Message> loadLog(String conversationId) {
        return logs.computeIfAbsent(conversationId, id -> {
            List<Message> messages = new ArrayList<>();
            String content = storagePort.getText(DIR, id + LOG_EXTENSION).join();
            if (content == null) {
                return messages;
            }
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    messages.add(objectMapper.readValue(line, Message.class));
                } catch (JsonProcessingException e) {
                    log.warn("[Conversations] Skipping corrupt message line in {}: {}", id, e.getMessage());
                }
            }
            return messages;
        });
    }
}
