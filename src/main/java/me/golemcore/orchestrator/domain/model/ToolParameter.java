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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * Typed parameter of a tool as declared by its provider manifest.
 */
@Data
@Builder
public class ToolParameter {

    public static final Set<String> SUPPORTED_TYPES = Set.of("string", "integer", "number", "boolean", "array",
            "object");

    private String name;
    private String type;
    private String description;
    private boolean required;
    private List<String> enumValues;
}
