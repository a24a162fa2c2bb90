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

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered permission tiers. A tool is visible to a caller when the caller's
 * level is at least the tool's minimum level.
 */
public enum PermissionLevel {

    GUEST, USER, ADMIN, OWNER;

    public boolean allows(PermissionLevel required) {
        return required != null && this.ordinal() >= required.ordinal();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PermissionLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (PermissionLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
