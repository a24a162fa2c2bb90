package me.golemcore.orchestrator.adapter.outbound.llm;

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

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Per-request mapping between namespaced tool names ({@code search.web}) and
 * the vendor-safe alphabet {@code [a-zA-Z0-9_-]{1,64}}.
 */
final class ToolNameCodec {

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final int MAX_LENGTH = 64;

    private final Map<String, String> encoded = new HashMap<>();
    private final Map<String, String> decoded = new HashMap<>();

    static ToolNameCodec of(Collection<String> names) {
        ToolNameCodec codec = new ToolNameCodec();
        for (String name : names) {
            codec.encode(name);
        }
        return codec;
    }

    String encode(String name) {
        String existing = encoded.get(name);
        if (existing != null) {
            return existing;
        }
        String base = sanitize(name);
        String candidate = base;
        int suffix = 2;
        while (decoded.containsKey(candidate)) {
            String tail = "_" + suffix++;
            candidate = base.substring(0, Math.min(base.length(), MAX_LENGTH - tail.length())) + tail;
        }
        encoded.put(name, candidate);
        decoded.put(candidate, name);
        return candidate;
    }

    /**
     * Original name for a vendor-side name; names the codec never issued are
     * returned unchanged.
     */
    String decode(String vendorName) {
        return decoded.getOrDefault(vendorName, vendorName);
    }

    private static String sanitize(String name) {
        String safe = UNSAFE.matcher(name).replaceAll("_");
        if (safe.isEmpty()) {
            safe = "tool";
        }
        return safe.length() > MAX_LENGTH ? safe.substring(0, MAX_LENGTH) : safe;
    }
}
