package me.golemcore.orchestrator.adapter.inbound.web.controller;

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
import me.golemcore.orchestrator.adapter.inbound.web.dto.TurnApiRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.TurnApiResponse;
import me.golemcore.orchestrator.domain.model.FileReference;
import me.golemcore.orchestrator.domain.model.TurnCancellation;
import me.golemcore.orchestrator.domain.model.TurnRequest;
import me.golemcore.orchestrator.domain.model.TurnResponse;
import me.golemcore.orchestrator.port.inbound.TurnHandlerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turn intake for front ends. A client disconnect cancels the turn.
 */
@RestController
@RequestMapping("/api/turns")
@RequiredArgsConstructor
@Slf4j
public class TurnsController {

    private final TurnHandlerPort turnHandler;

    @PostMapping
    public Mono<ResponseEntity<TurnApiResponse>> handleTurn(@RequestBody TurnApiRequest request) {
        validate(request);
        TurnCancellation cancellation = new TurnCancellation();
        TurnRequest turn = TurnRequest.builder()
                .platform(request.getPlatform())
                .platformUserId(request.getPlatformUserId())
                .username(request.getUsername())
                .serverId(request.getServerId())
                .channelId(request.getChannelId())
                .threadId(request.getThreadId())
                .content(request.getContent())
                .attachments(request.getAttachments() != null ? request.getAttachments() : List.of())
                .build();
        return Mono.fromFuture(() -> turnHandler.handleTurn(turn, cancellation))
                .map(response -> ResponseEntity.ok(toDto(response)))
                .doOnCancel(() -> {
                    log.info("[API] Client disconnected, cancelling turn for {}/{}", request.getPlatform(),
                            request.getPlatformUserId());
                    cancellation.cancel();
                });
    }

    private static void validate(TurnApiRequest request) {
        if (isBlank(request.getPlatform()) || isBlank(request.getPlatformUserId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "platform and platformUserId are required");
        }
        boolean hasAttachments = request.getAttachments() != null && !request.getAttachments().isEmpty();
        if (isBlank(request.getContent()) && !hasAttachments) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "content or attachments are required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static TurnApiResponse toDto(TurnResponse response) {
        List<TurnApiResponse.FileDto> files = response.getFiles() == null ? List.of()
                : response.getFiles().stream().map(TurnsController::toFileDto).toList();
        return TurnApiResponse.builder()
                .conversationId(response.getConversationId())
                .content(response.getContent())
                .files(files)
                .error(response.getError())
                .partial(response.isPartial())
                .outcome(response.getOutcome() != null ? response.getOutcome().name() : null)
                .modelCalls(response.getModelCalls())
                .toolCalls(response.getToolCalls())
                .build();
    }

    private static TurnApiResponse.FileDto toFileDto(FileReference file) {
        return TurnApiResponse.FileDto.builder()
                .url(file.url())
                .filename(file.filename())
                .mimeType(file.mimeType())
                .build();
    }
}
