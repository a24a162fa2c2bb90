package me.golemcore.orchestrator.domain.context;

import me.golemcore.orchestrator.domain.model.MemorySummary;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import me.golemcore.orchestrator.port.outbound.MemorySummaryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MemoryRecallServiceTest {

    private static final String USER = "user-1";
    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

    private MemorySummaryPort memorySummaryPort;
    private FakeEmbeddingPort embeddingPort;
    private OrchestratorProperties properties;
    private MemoryRecallService service;

    @BeforeEach
    void setUp() {
        memorySummaryPort = mock(MemorySummaryPort.class);
        embeddingPort = new FakeEmbeddingPort();
        properties = new OrchestratorProperties();
        properties.getMemory().setRecallTopK(2);
        service = new MemoryRecallService(memorySummaryPort, embeddingPort, properties);
    }

    private static MemorySummary summary(String id, String conversationId, float[] embedding, int ageDays) {
        return MemorySummary.builder()
                .id(id)
                .userId(USER)
                .conversationId(conversationId)
                .summary("summary " + id)
                .embedding(embedding)
                .createdAt(T0.minusSeconds(ageDays * 86_400L))
                .build();
    }

    private static List<String> ids(List<MemorySummary> summaries) {
        return summaries.stream().map(MemorySummary::getId).toList();
    }

    @Test
    void shouldRankBySimilarityAndExcludeCurrentConversation() {
        when(memorySummaryPort.findByUser(USER)).thenReturn(List.of(
                summary("far", "c1", new float[] { 0, 1 }, 1),
                summary("close", "c2", new float[] { 1, 0.1f }, 5),
                summary("current", "now", new float[] { 1, 0 }, 0),
                summary("mid", "c3", new float[] { 1, 1 }, 3)));
        embeddingPort.vector = new float[] { 1, 0 };

        List<MemorySummary> recalled = service.recall(USER, "now", "what did we say about X?");

        assertEquals(List.of("close", "mid"), ids(recalled));
    }

    @Test
    void shouldBreakTiesByRecency() {
        when(memorySummaryPort.findByUser(USER)).thenReturn(List.of(
                summary("older", "c1", new float[] { 1, 0 }, 10),
                summary("newer", "c2", new float[] { 1, 0 }, 1)));
        embeddingPort.vector = new float[] { 1, 0 };

        assertEquals(List.of("newer", "older"), ids(service.recall(USER, "now", "q")));
    }

    @Test
    void shouldFallBackToMostRecentWithoutEmbeddings() {
        when(memorySummaryPort.findByUser(USER)).thenReturn(List.of(
                summary("a", "c1", null, 9),
                summary("b", "c2", null, 1),
                summary("c", "c3", null, 4)));
        embeddingPort.available = false;

        assertEquals(List.of("b", "c"), ids(service.recall(USER, "now", "q")));
    }

    @Test
    void shouldRankSummariesWithoutVectorLast() {
        when(memorySummaryPort.findByUser(USER)).thenReturn(List.of(
                summary("novector", "c1", null, 0),
                summary("orthogonal", "c2", new float[] { 0, 1 }, 5)));
        embeddingPort.vector = new float[] { 1, 0 };

        assertEquals(List.of("orthogonal", "novector"), ids(service.recall(USER, "now", "q")));
    }

    @Test
    void shouldReturnNothingForNewUser() {
        when(memorySummaryPort.findByUser(USER)).thenReturn(List.of());

        assertTrue(service.recall(USER, "now", "q").isEmpty());
    }

    private static final class FakeEmbeddingPort implements EmbeddingPort {
        private boolean available = true;
        private float[] vector;

        @Override
        public CompletableFuture<float[]> embed(String text) {
            return CompletableFuture.completedFuture(vector);
        }

        @Override
        public boolean isAvailable() {
            return available;
        }
    }
}
