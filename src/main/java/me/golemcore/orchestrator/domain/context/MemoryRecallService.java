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
import me.golemcore.orchestrator.domain.model.MemorySummary;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import me.golemcore.orchestrator.port.outbound.MemorySummaryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Selects long-term memory relevant to an incoming turn.
 *
 * <p>
 * Summaries of the user's other conversations are ranked by cosine similarity
 * between their embedding and the embedding of the incoming content. Ties are
 * broken by recency, then id, so the ranking is stable. When no embedding is
 * available the most recent summaries are returned instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRecallService {

    private static final long EMBED_TIMEOUT_MS = 10_000;

    private static final Comparator<MemorySummary> MOST_RECENT_FIRST = Comparator
            .comparing(MemorySummary::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MemorySummary::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MemorySummaryPort memorySummaryPort;
    private final EmbeddingPort embeddingPort;
    private final OrchestratorProperties properties;

    public List<MemorySummary> recall(String userId, String excludeConversationId, String query) {
        int topK = properties.getMemory().getRecallTopK();
        if (topK <= 0) {
            return List.of();
        }
        List<MemorySummary> candidates = memorySummaryPort.findByUser(userId).stream()
                .filter(s -> !Objects.equals(s.getConversationId(), excludeConversationId))
                .toList();
        if (candidates.isEmpty()) {
            return List.of();
        }

        float[] queryVector = embedQuery(query);
        if (queryVector == null) {
            return candidates.stream().sorted(MOST_RECENT_FIRST).limit(topK).toList();
        }

        List<ScoredSummary> scored = new ArrayList<>();
        for (MemorySummary summary : candidates) {
            float[] vector = summary.getEmbedding();
            double score = vector != null && vector.length == queryVector.length
                    ? embeddingPort.cosineSimilarity(queryVector, vector)
                    : -1.0;
            scored.add(new ScoredSummary(summary, score));
        }
        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredSummary::score).reversed()
                        .thenComparing(ScoredSummary::summary, MOST_RECENT_FIRST))
                .limit(topK)
                .map(ScoredSummary::summary)
                .toList();
    }

    private float[] embedQuery(String query) {
        if (query == null || query.isBlank() || !embeddingPort.isAvailable()) {
            return null;
        }
        try {
            return embeddingPort.embed(query).get(EMBED_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Memory] Query embedding failed, falling back to recent summaries: {}", e.getMessage());
            return null;
        }
    }

    private record ScoredSummary(MemorySummary summary, double score) {
    }
}
