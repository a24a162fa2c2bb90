package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.Message;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of conversations and their append-only message logs.
 */
public interface ConversationPort {

    Optional<Conversation> findById(String conversationId);

    /**
     * Most recently active conversation for the given user and channel whose last
     * activity is not before {@code activeSince}.
     */
    Optional<Conversation> findActive(String userId, String platform, String channelId, String threadId,
            Instant activeSince);

    void save(Conversation conversation);

    /**
     * Atomically update the last activity time without touching other fields.
     */
    void touch(String conversationId, Instant lastActiveAt);

    /**
     * Atomically flag the conversation as summarized through the given message,
     * identified by id and creation time.
     */
    void markSummarized(String conversationId, String throughMessageId, Instant summarizedThrough);

    /**
     * Like {@link #markSummarized} for a conversation whose whole log is covered.
     * {@code summarizedThrough} is the last activity time the summary accounts
     * for.
     */
    void markFullySummarized(String conversationId, String throughMessageId, Instant summarizedThrough);

    /**
     * Up to {@code limit} conversations inactive since before
     * {@code inactiveBefore} that have activity not covered by a full summary,
     * least recently active first.
     */
    List<Conversation> findIdleUnsummarized(Instant inactiveBefore, int limit);

    /**
     * Release cached message logs of conversations inactive since before
     * {@code inactiveBefore}. Logs are reloaded from storage on next access.
     *
     * @return number of released logs
     */
    int evictInactive(Instant inactiveBefore);

    void appendMessages(String conversationId, List<Message> messages);

    /**
     * All messages of the conversation in creation order.
     */
    List<Message> loadMessages(String conversationId);
}
