package me.golemcore.orchestrator.domain.model;

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

import java.time.Instant;
import java.util.List;

/**
 * Validated manifest of one provider. Replaced as a whole on refresh.
 */
public record ToolManifest(String namespace, List<ToolDescriptor> tools, Instant fetchedAt, Instant expiresAt) {

    public ToolManifest {
        tools = List.copyOf(tools);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
