package me.golemcore.orchestrator.domain.router;

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

import java.util.Locale;

/**
 * A (vendor, model) pair. Written as {@code vendor/model}; a bare model id
 * resolves its vendor from the model family prefix.
 */
public record ModelRef(String vendor, String model) {

    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String GOOGLE = "google";

    public static ModelRef parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Model reference is empty");
        }
        String trimmed = reference.trim();
        int slash = trimmed.indexOf('/');
        if (slash > 0 && slash < trimmed.length() - 1) {
            return new ModelRef(trimmed.substring(0, slash).toLowerCase(Locale.ROOT), trimmed.substring(slash + 1));
        }
        return new ModelRef(vendorForModel(trimmed), trimmed);
    }

    static String vendorForModel(String model) {
        String lower = model.toLowerCase(Locale.ROOT);
        if (lower.startsWith("claude")) {
            return ANTHROPIC;
        }
        if (lower.startsWith("gemini")) {
            return GOOGLE;
        }
        if (lower.startsWith("gpt") || lower.startsWith("o1") || lower.startsWith("o3") || lower.startsWith("o4")) {
            return OPENAI;
        }
        throw new IllegalArgumentException("Cannot infer vendor for model: " + model);
    }

    @Override
    public String toString() {
        return vendor + "/" + model;
    }
}
