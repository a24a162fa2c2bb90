package me.golemcore.orchestrator.adapter.outbound.persona;

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
import me.golemcore.orchestrator.domain.model.Persona;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.PersonaPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Personas declared under {@code orchestrator.personas}. Lookup order:
 * platform and server, platform only, the persona flagged
 * {@code default-persona}, then a built-in assistant persona.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredPersonaAdapter implements PersonaPort {

    static final String BUILT_IN_ID = "default";

    private final OrchestratorProperties properties;

    @Override
    public Persona resolve(String platform, String serverId) {
        List<OrchestratorProperties.PersonaProperties> personas = properties.getPersonas();

        Optional<OrchestratorProperties.PersonaProperties> match = Optional.empty();
        if (serverId != null) {
            match = personas.stream()
                    .filter(p -> Objects.equals(p.getPlatform(), platform) && serverId.equals(p.getServerId()))
                    .findFirst();
        }
        if (match.isEmpty()) {
            match = personas.stream()
                    .filter(p -> Objects.equals(p.getPlatform(), platform) && p.getServerId() == null)
                    .findFirst();
        }
        if (match.isEmpty()) {
            match = personas.stream().filter(OrchestratorProperties.PersonaProperties::isDefaultPersona).findFirst();
        }
        return match.map(this::toPersona).orElseGet(this::builtIn);
    }

    private Persona toPersona(OrchestratorProperties.PersonaProperties config) {
        return Persona.builder()
                .id(config.getId())
                .name(config.getName())
                .systemPrompt(config.getSystemPrompt() != null ? config.getSystemPrompt()
                        : properties.getLoop().getDefaultSystemPrompt())
                .allowedNamespaces(List.copyOf(config.getAllowedNamespaces()))
                .preferredModel(config.getPreferredModel())
                .maxTokensPerRequest(config.getMaxTokensPerRequest())
                .build();
    }

    private Persona builtIn() {
        return Persona.builder()
                .id(BUILT_IN_ID)
                .name("Assistant")
                .systemPrompt(properties.getLoop().getDefaultSystemPrompt())
                .allowedNamespaces(List.copyOf(properties.getLoop().getDefaultNamespaces()))
                .build();
    }
}
