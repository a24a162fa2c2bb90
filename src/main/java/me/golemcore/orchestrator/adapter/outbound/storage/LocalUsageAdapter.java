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
import me.golemcore.orchestrator.domain.model.UsageRecord;
import me.golemcore.orchestrator.port.outbound.StoragePort;
import me.golemcore.orchestrator.port.outbound.UsagePort;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Usage log as monthly JSONL files ({@code usage/2026-10.jsonl}). Write
 * failures are logged and never fail the turn.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalUsageAdapter implements UsagePort {

    private static final String DIR = "usage";
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public void record(UsageRecord record) {
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            storagePort.appendText(DIR, MONTH.format(record.getTimestamp()) + ".jsonl", line).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Usage] Failed to record usage for {}: {}", record.getUserId(), e.getMessage());
        }
    }
}
