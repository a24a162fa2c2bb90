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

import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.Message;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Where a conversation's summary ends in its message log.
 *
 * <p>
 * The boundary is the id of the last covered message; messages after it in
 * log order are uncovered. Conversations summarized before ids were recorded
 * fall back to the covered-through timestamp.
 */
final class SummaryBoundary {

    private SummaryBoundary() {
    }

    static List<Message> uncovered(Conversation conversation, List<Message> messages) {
        if (!conversation.isSummarized()) {
            return messages;
        }
        String throughId = conversation.getSummarizedThroughMessageId();
        if (throughId != null) {
            for (int i = messages.size() - 1; i >= 0; i--) {
                if (Objects.equals(messages.get(i).getId(), throughId)) {
                    return messages.subList(i + 1, messages.size());
                }
            }
        }
        Instant through = conversation.getSummarizedThrough();
        if (through == null) {
            return messages;
        }
        return messages.stream()
                .filter(m -> m.getTimestamp() == null || m.getTimestamp().isAfter(through))
                .toList();
    }

    /**
     * Number of leading messages to summarize so that {@code keep} recent ones stay
     * raw. A tool_result is never separated from the tool_call before it.
     */
    static int splitIndex(List<Message> uncovered, int keep) {
        int split = Math.max(0, uncovered.size() - keep);
        while (split > 0 && split < uncovered.size() && uncovered.get(split).isToolResult()) {
            split--;
        }
        return split;
    }
}
