package me.golemcore.orchestrator.adapter.inbound.web.controller;

import me.golemcore.orchestrator.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.orchestrator.adapter.inbound.web.dto.TurnApiRequest;
import me.golemcore.orchestrator.domain.model.Attachment;
import me.golemcore.orchestrator.domain.model.FileReference;
import me.golemcore.orchestrator.domain.model.TurnCancellation;
import me.golemcore.orchestrator.domain.model.TurnOutcome;
import me.golemcore.orchestrator.domain.model.TurnRequest;
import me.golemcore.orchestrator.domain.model.TurnResponse;
import me.golemcore.orchestrator.port.inbound.TurnHandlerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnsControllerTest {

    private static final String TURNS_URI = "/api/turns";

    private TurnHandlerPort turnHandler;
    private TurnsController controller;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        turnHandler = mock(TurnHandlerPort.class);
        controller = new TurnsController(turnHandler);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static TurnApiRequest request(String content) {
        return TurnApiRequest.builder()
                .platform("discord")
                .platformUserId("42")
                .username("alice")
                .serverId("srv")
                .channelId("chan")
                .content(content)
                .build();
    }

    @Test
    void shouldRunTurnAndReturnResponse() {
        when(turnHandler.handleTurn(any(), any())).thenReturn(CompletableFuture.completedFuture(
                TurnResponse.builder()
                        .conversationId("conv-1")
                        .content("Here you go")
                        .files(List.of(new FileReference("https://files.example/a.png", "a.png", "image/png")))
                        .outcome(TurnOutcome.COMPLETED)
                        .modelCalls(2)
                        .toolCalls(1)
                        .build()));

        webTestClient.post()
                .uri(TURNS_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request("draw something"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.conversationId").isEqualTo("conv-1")
                .jsonPath("$.content").isEqualTo("Here you go")
                .jsonPath("$.files[0].url").isEqualTo("https://files.example/a.png")
                .jsonPath("$.files[0].mimeType").isEqualTo("image/png")
                .jsonPath("$.outcome").isEqualTo("COMPLETED")
                .jsonPath("$.partial").isEqualTo(false)
                .jsonPath("$.modelCalls").isEqualTo(2)
                .jsonPath("$.toolCalls").isEqualTo(1)
                .jsonPath("$.error").doesNotExist();

        ArgumentCaptor<TurnRequest> captor = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnHandler).handleTurn(captor.capture(), any());
        TurnRequest turn = captor.getValue();
        assertEquals("discord", turn.getPlatform());
        assertEquals("42", turn.getPlatformUserId());
        assertEquals("srv", turn.getServerId());
        assertEquals("draw something", turn.getContent());
        assertTrue(turn.getAttachments().isEmpty());
    }

    @Test
    void shouldReturnStructuredFailureOutcomesWithOk() {
        when(turnHandler.handleTurn(any(), any())).thenReturn(CompletableFuture.completedFuture(
                TurnResponse.builder()
                        .content("budget")
                        .error("budget_exceeded")
                        .outcome(TurnOutcome.BUDGET_EXCEEDED)
                        .files(List.of())
                        .build()));

        webTestClient.post()
                .uri(TURNS_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request("hi"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.outcome").isEqualTo("BUDGET_EXCEEDED")
                .jsonPath("$.error").isEqualTo("budget_exceeded");
    }

    @Test
    void shouldRejectRequestWithoutIdentity() {
        TurnApiRequest missing = request("hi");
        missing.setPlatformUserId(" ");

        webTestClient.post()
                .uri(TURNS_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(missing)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("platform and platformUserId are required");

        verify(turnHandler, never()).handleTurn(any(), any());
    }

    @Test
    void shouldRejectEmptyTurn() {
        webTestClient.post()
                .uri(TURNS_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request(""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("content or attachments are required");
    }

    @Test
    void shouldAcceptAttachmentsWithoutContent() {
        when(turnHandler.handleTurn(any(), any())).thenReturn(CompletableFuture.completedFuture(
                TurnResponse.builder().content("ok").outcome(TurnOutcome.COMPLETED).files(List.of()).build()));
        TurnApiRequest withFile = request(null);
        withFile.setAttachments(List.of(Attachment.builder().filename("a.txt").url("https://f/a.txt").build()));

        webTestClient.post()
                .uri(TURNS_URI)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(withFile)
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void shouldCancelTurnWhenSubscriberGoesAway() {
        ArgumentCaptor<TurnCancellation> captor = ArgumentCaptor.forClass(TurnCancellation.class);
        when(turnHandler.handleTurn(any(), captor.capture())).thenReturn(new CompletableFuture<>());

        Disposable subscription = controller.handleTurn(request("long task")).subscribe();
        assertFalse(captor.getValue().isCancelled());
        subscription.dispose();

        assertTrue(captor.getValue().isCancelled());
    }

    @Test
    void shouldEmitResponseWhenTurnCompletes() {
        CompletableFuture<TurnResponse> pending = new CompletableFuture<>();
        when(turnHandler.handleTurn(any(), any())).thenReturn(pending);

        StepVerifier.create(controller.handleTurn(request("hi")))
                .then(() -> pending.complete(TurnResponse.builder()
                        .conversationId("conv-1")
                        .content("late answer")
                        .outcome(TurnOutcome.COMPLETED)
                        .build()))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.OK, entity.getStatusCode());
                    assertEquals("late answer", entity.getBody().getContent());
                    assertTrue(entity.getBody().getFiles().isEmpty());
                })
                .verifyComplete();
    }
}
