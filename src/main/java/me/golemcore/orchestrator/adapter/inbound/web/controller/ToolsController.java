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
import me.golemcore.orchestrator.adapter.inbound.web.dto.ProviderStatusDto;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ToolDto;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.ProviderHealth;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.tools.ToolRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool catalog inspection and manual refresh.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDto>>> listTools(
            @RequestParam(defaultValue = "guest") String level,
            @RequestParam List<String> namespaces) {
        PermissionLevel permission = PermissionLevel.parse(level)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Unknown permission level: " + level));
        List<ToolDto> tools = toolRegistry.listTools(permission, namespaces).stream()
                .map(ToolsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(tools));
    }

    @GetMapping("/providers")
    public Mono<ResponseEntity<List<ProviderStatusDto>>> listProviders() {
        return Mono.just(ResponseEntity.ok(toProviderDtos(toolRegistry.getProviderHealth())));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<Map<String, Object>>> refresh() {
        return Mono.fromCallable(toolRegistry::discover)
                .subscribeOn(Schedulers.boundedElastic())
                .map(healthy -> {
                    log.info("[API] Manual tool refresh: {} healthy provider(s)", healthy);
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("healthyProviders", healthy);
                    result.put("providers", toProviderDtos(toolRegistry.getProviderHealth()));
                    return ResponseEntity.ok(result);
                });
    }

    static List<ProviderStatusDto> toProviderDtos(List<ProviderHealth> health) {
        return health.stream()
                .map(h -> ProviderStatusDto.builder()
                        .namespace(h.namespace())
                        .url(h.url())
                        .healthy(h.healthy())
                        .toolCount(h.toolCount())
                        .expiresAt(h.expiresAt())
                        .lastError(h.lastError())
                        .build())
                .toList();
    }

    private static ToolDto toDto(ToolDescriptor tool) {
        return ToolDto.builder()
                .name(tool.getName())
                .namespace(tool.getNamespace())
                .description(tool.getDescription())
                .minPermission(tool.getMinPermission().wireName())
                .inputSchema(tool.toInputSchema())
                .build();
    }
}
