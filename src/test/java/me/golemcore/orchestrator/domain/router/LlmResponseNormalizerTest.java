package me.golemcore.orchestrator.domain.router;

import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.StopReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmResponseNormalizerTest {

    private static final ModelRef REF = new ModelRef("openai", "gpt-4o");

    @Test
    void shouldFillMissingCallIdsAndForceToolUse() {
        LlmResponse raw = LlmResponse.builder()
                .toolCalls(List.of(
                        Message.ToolCall.builder().name("research.web_search").arguments(Map.of("q", "x")).build(),
                        Message.ToolCall.builder().id("abc").name("files.read").build()))
                .stopReason(StopReason.END_TURN)
                .build();

        LlmResponse normalized = LlmResponseNormalizer.normalize(raw, REF);

        assertEquals(StopReason.TOOL_USE, normalized.getStopReason());
        assertTrue(normalized.getToolCalls().get(0).getId().startsWith("call_"));
        assertEquals("abc", normalized.getToolCalls().get(1).getId());
        assertTrue(normalized.getToolCalls().get(1).getArguments().isEmpty());
        assertEquals("", normalized.getContent());
        assertEquals("openai/gpt-4o", normalized.getModel());
    }

    @Test
    void shouldNotReuseSyntheticCallIdsAcrossResponses() {
        LlmResponse raw = LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder().name("research.web_search").build()))
                .stopReason(StopReason.TOOL_USE)
                .build();

        String first = LlmResponseNormalizer.normalize(raw, REF).getToolCalls().get(0).getId();
        String second = LlmResponseNormalizer.normalize(raw, REF).getToolCalls().get(0).getId();

        assertNotEquals(first, second);
    }

    @Test
    void shouldTreatTextAsEndTurn() {
        LlmResponse normalized = LlmResponseNormalizer.normalize(LlmResponse.builder().content("done").build(), REF);

        assertEquals(StopReason.END_TURN, normalized.getStopReason());
        assertTrue(normalized.getToolCalls().isEmpty());
    }

    @Test
    void shouldKeepErrorStopWithoutCalls() {
        LlmResponse raw = LlmResponse.builder()
                .stopReason(StopReason.ERROR)
                .toolCalls(List.of(Message.ToolCall.builder().name("research.web_search").build()))
                .build();

        LlmResponse normalized = LlmResponseNormalizer.normalize(raw, REF);

        assertEquals(StopReason.ERROR, normalized.getStopReason());
        assertTrue(normalized.getToolCalls().isEmpty());
    }

    @Test
    void shouldRejectMalformedResponses() {
        assertThrows(MalformedLlmResponseException.class, () -> LlmResponseNormalizer.normalize(null, REF));
        assertThrows(MalformedLlmResponseException.class, () -> LlmResponseNormalizer.normalize(
                LlmResponse.builder().stopReason(StopReason.TOOL_USE).build(), REF));
        assertThrows(MalformedLlmResponseException.class, () -> LlmResponseNormalizer.normalize(
                LlmResponse.builder().toolCalls(List.of(Message.ToolCall.builder().name(" ").build())).build(),
                REF));
    }
}
