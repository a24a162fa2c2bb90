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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.orchestrator.domain.model.FileReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts files surfaced by tool results: a {@code url} at the top level of
 * the result object, or inside entries of a {@code files} array.
 */
final class FileReferenceCollector {

    private static final String DEFAULT_FILENAME = "file";

    private FileReferenceCollector() {
    }

    static List<FileReference> collect(JsonNode payload) {
        List<FileReference> files = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            return files;
        }
        addIfFile(payload, files);
        JsonNode nested = payload.get("files");
        if (nested != null && nested.isArray()) {
            for (JsonNode entry : nested) {
                if (entry.isObject()) {
                    addIfFile(entry, files);
                }
            }
        }
        return files;
    }

    private static void addIfFile(JsonNode node, List<FileReference> files) {
        JsonNode url = node.get("url");
        if (url == null || !url.isTextual() || url.asText().isBlank()) {
            return;
        }
        files.add(new FileReference(url.asText(), text(node, "filename", DEFAULT_FILENAME),
                text(node, "mime_type", null)));
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }
}
