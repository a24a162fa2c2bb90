package me.golemcore.orchestrator.domain.loop;

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
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.Persona;
import me.golemcore.orchestrator.domain.model.TurnRequest;
import me.golemcore.orchestrator.domain.model.UserAccount;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ConversationPort;
import me.golemcore.orchestrator.port.outbound.PersonaPort;
import me.golemcore.orchestrator.port.outbound.UserAccountPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves who is talking, as which persona, and in which conversation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnResolver {

    private final UserAccountPort userAccountPort;
    private final PersonaPort personaPort;
    private final ConversationPort conversationPort;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public ResolvedTurn resolve(TurnRequest request) {
        if (request.getPlatform() == null || request.getPlatformUserId() == null) {
            throw new IllegalArgumentException("platform and platformUserId are required");
        }
        UserAccount user = userAccountPort.findOrCreate(request.getPlatform(), request.getPlatformUserId(),
                request.getUsername());
        Persona persona = personaPort.resolve(request.getPlatform(), request.getServerId());
        Conversation conversation = resolveConversation(user, persona, request);
        return new ResolvedTurn(user, persona, conversation);
    }

    private Conversation resolveConversation(UserAccount user, Persona persona, TurnRequest request) {
        Instant now = clock.instant();
        Instant activeSince = now.minus(Duration.ofMinutes(properties.getLoop().getConversationTimeoutMinutes()));
        Optional<Conversation> active = conversationPort.findActive(user.getId(), request.getPlatform(),
                request.getChannelId(), request.getThreadId(), activeSince);
        if (active.isPresent()) {
            Conversation resumed = active.get();
            conversationPort.touch(resumed.getId(), now);
            resumed.setLastActiveAt(now);
            return resumed;
        }

        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .userId(user.getId())
                .personaId(persona.getId())
                .platform(request.getPlatform())
                .channelId(request.getChannelId())
                .threadId(request.getThreadId())
                .startedAt(now)
                .lastActiveAt(now)
                .build();
        conversationPort.save(conversation);
        log.info("[TurnResolver] Started conversation {} for user {}", conversation.getId(), user.getId());
        return conversation;
    }

    public record ResolvedTurn(UserAccount user, Persona persona, Conversation conversation) {
    }
}
