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
import me.golemcore.orchestrator.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ProviderStatusDto;
import me.golemcore.orchestrator.domain.router.ModelRouter;
import me.golemcore.orchestrator.domain.tools.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * Service health. Status is {@code DEGRADED} when no model vendor is
 * registered or any configured tool provider is unhealthy.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final ModelRouter modelRouter;
    private final ToolRegistry toolRegistry;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        List<String> vendors = modelRouter.getRegisteredVendors().stream().sorted().toList();
        List<ProviderStatusDto> providers = ToolsController.toProviderDtos(toolRegistry.getProviderHealth());
        boolean degraded = vendors.isEmpty() || providers.stream().anyMatch(p -> !p.isHealthy());

        HealthResponse response = HealthResponse.builder()
                .status(degraded ? "DEGRADED" : "UP")
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .vendors(vendors)
                .providers(providers)
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
