package me.golemcore.orchestrator.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.MemorySummary;
import me.golemcore.orchestrator.port.outbound.MemorySummaryPort;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory summaries as one JSONL file per user ({@code memory/<userId>.jsonl}).
 * Entries are only ever appended.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMemorySummaryAdapter implements MemorySummaryPort {

    private static final String DIR = "memory";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, List<MemorySummary>> byUser = new ConcurrentHashMap<>();

    @Override
    public void save(MemorySummary summary) {
        List<MemorySummary> cached = load(summary.getUserId());
        synchronized (cached) {
            try {
                storagePort.appendText(DIR, summary.getUserId() + ".jsonl",
                        objectMapper.writeValueAsString(summary) + "\n").join();
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize memory summary " + summary.getId(), e);
            }
            cached.add(summary);
        }
    }

    @Override
    public List<MemorySummary> findByUser(String userId) {
        List<MemorySummary> cached = load(userId);
        synchronized (cached) {
            return List.copyOf(cached);
        }
    }

    private List<MemorySummary> load(String userId) {
        return byUser.computeIfAbsent(userId, id -> {
            List<MemorySummary> summaries = new ArrayList<>();
            String content = storagePort.getText(DIR, id + ".jsonl").join();
            if (content == null) {
                return summaries;
            }
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    summaries.add(objectMapper.readValue(line, MemorySummary.class));
                } catch (JsonProcessingException e) {
                    log.warn("[Memory] Skipping corrupt summary line for {}: {}", id, e.getMessage());
                }
            }
            return summaries;
        });
    }
}
