package me.golemcore.orchestrator.domain.router;

import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.StopReason;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelRouterTest {

    private static final String OPENAI = "openai";
    private static final String ANTHROPIC = "anthropic";
    private static final String GOOGLE = "google";

    private OrchestratorProperties properties;
    private LlmPort openai;
    private LlmPort anthropic;
    private LlmPort google;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getRouter().setDefaultModel("anthropic/claude-sonnet-4-20250514");
        properties.getRouter().setFallbackChain(List.of("openai/gpt-4o", "google/gemini-2.0-flash"));
        openai = adapter(OPENAI, true);
        anthropic = adapter(ANTHROPIC, true);
        google = adapter(GOOGLE, true);
    }

    private static LlmPort adapter(String vendor, boolean available) {
        LlmPort port = mock(LlmPort.class);
        when(port.getVendor()).thenReturn(vendor);
        when(port.isAvailable()).thenReturn(available);
        return port;
    }

    private ModelRouter router() {
        ModelRouter router = new ModelRouter(properties, List.of(openai, anthropic, google));
        router.init();
        return router;
    }

    private static CompletableFuture<LlmResponse> text(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(content)
                .stopReason(StopReason.END_TURN)
                .build());
    }

    private static CompletableFuture<LlmResponse> failure(RuntimeException error) {
        return CompletableFuture.failedFuture(error);
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .messages(List.of(Message.builder().role(Message.ROLE_USER).content("hi").build()))
                .tools(List.of())
                .build();
    }

    @Test
    void shouldRegisterOnlyAvailableVendors() {
        google = adapter(GOOGLE, false);

        ModelRouter router = router();

        assertEquals(Set.of(OPENAI, ANTHROPIC), router.getRegisteredVendors());
        assertFalse(router.isVendorRegistered(GOOGLE));
    }

    @Test
    void shouldBuildDeduplicatedChainStartingWithRequestedModel() {
        properties.getRouter().setFallbackChain(List.of("gpt-4o", "openai/gpt-4o", "bogus-model",
                "anthropic/claude-sonnet-4-20250514"));

        List<ModelRef> chain = router().buildChain("anthropic/claude-sonnet-4-20250514");

        assertEquals(List.of(new ModelRef(ANTHROPIC, "claude-sonnet-4-20250514"), new ModelRef(OPENAI, "gpt-4o")),
                chain);
    }

    @Test
    void shouldServeFromFirstEntryAndStripVendorPrefix() {
        when(anthropic.chat(any())).thenReturn(text("hello"));

        RoutedResponse routed = router().complete(request());

        assertEquals(1, routed.attempts());
        assertEquals(new ModelRef(ANTHROPIC, "claude-sonnet-4-20250514"), routed.servedBy());
        assertEquals("hello", routed.response().getContent());
        assertEquals("anthropic/claude-sonnet-4-20250514", routed.response().getModel());
        ArgumentCaptor<LlmRequest> sent = ArgumentCaptor.forClass(LlmRequest.class);
        verify(anthropic).chat(sent.capture());
        assertEquals("claude-sonnet-4-20250514", sent.getValue().getModel());
    }

    @Test
    void shouldMakeExactlyKPlusOneAttemptsWhenFirstKFail() {
        when(anthropic.chat(any())).thenReturn(failure(new RuntimeException("[llm.langchain4j.rate_limit] 429")));
        when(openai.chat(any())).thenReturn(failure(new RuntimeException("[llm.langchain4j.internal_server] 500")));
        when(google.chat(any())).thenReturn(text("from gemini"));

        RoutedResponse routed = router().complete(request());

        assertEquals(3, routed.attempts());
        assertEquals(GOOGLE, routed.servedBy().vendor());
        verify(anthropic, times(1)).chat(any());
        verify(openai, times(1)).chat(any());
        verify(google, times(1)).chat(any());
    }

    @Test
    void shouldFailAfterExactlyNAttemptsWhenEveryEntryFails() {
        when(anthropic.chat(any())).thenReturn(failure(new RuntimeException("[llm.langchain4j.rate_limit] 429")));
        when(openai.chat(any())).thenReturn(failure(new RuntimeException("[llm.langchain4j.authentication] 401")));
        when(google.chat(any())).thenReturn(failure(new RuntimeException("[llm.langchain4j.timeout] slow")));

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> router().complete(request()));

        assertEquals(3, e.getAttempts());
        assertEquals(LlmErrorClassifier.LANGCHAIN4J_TIMEOUT, e.getLastErrorCode());
    }

    @Test
    void shouldSkipUnregisteredVendorsWithoutCountingAttempts() {
        anthropic = adapter(ANTHROPIC, false);
        when(openai.chat(any())).thenReturn(failure(new RuntimeException("boom")));
        when(google.chat(any())).thenReturn(text("ok"));

        RoutedResponse routed = router().complete(request());

        assertEquals(2, routed.attempts());
        verify(anthropic, never()).chat(any());
    }

    @Test
    void shouldAdvanceOnMalformedResponse() {
        when(anthropic.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .stopReason(StopReason.TOOL_USE)
                .build()));
        when(openai.chat(any())).thenReturn(text("fine"));

        RoutedResponse routed = router().complete(request());

        assertEquals(2, routed.attempts());
        assertEquals("fine", routed.response().getContent());
    }

    @Test
    void shouldStopChainWhenAborted() {
        when(anthropic.chat(any())).thenReturn(failure(new CancellationException("stop")));

        assertThrows(CancellationException.class, () -> router().complete(request()));
        verify(openai, never()).chat(any());
    }

    @Test
    void shouldUseRequestedModelBeforeDefault() {
        when(openai.chat(any())).thenReturn(text("mini"));

        RoutedResponse routed = router().complete(request().toBuilder().model("gpt-4o-mini").build());

        assertEquals(new ModelRef(OPENAI, "gpt-4o-mini"), routed.servedBy());
        verify(anthropic, never()).chat(any());
    }

    @Test
    void shouldRouteSummarizationToConfiguredModel() {
        properties.getRouter().setSummarizationModel("google/gemini-2.0-flash");
        when(google.chat(any())).thenReturn(text("summary"));

        RoutedResponse routed = router().completeForSummarization(request());

        assertEquals(GOOGLE, routed.servedBy().vendor());
        assertTrue(routed.response().getContent().contains("summary"));
    }

    @Test
    void shouldFailWithZeroAttemptsWhenNothingIsRegistered() {
        openai = adapter(OPENAI, false);
        anthropic = adapter(ANTHROPIC, false);
        google = adapter(GOOGLE, false);

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> router().complete(request()));

        assertEquals(0, e.getAttempts());
    }
}
