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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tool as offered to the model. The name is always namespaced
 * ({@code provider.tool}).
 */
@Data
@Builder
public class ToolDescriptor {

    private String name;
    private String namespace;
    private String description;
    private List<ToolParameter> parameters;
    private PermissionLevel minPermission;

    /**
     * JSON-schema style view of the parameters ({@code type}, {@code properties},
     * {@code required}).
     */
    public Map<String, Object> toInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        if (parameters != null) {
            for (ToolParameter parameter : parameters) {
                Map<String, Object> property = new LinkedHashMap<>();
                property.put("type", parameter.getType());
                if (parameter.getDescription() != null) {
                    property.put("description", parameter.getDescription());
                }
                if (parameter.getEnumValues() != null && !parameter.getEnumValues().isEmpty()) {
                    property.put("enum", parameter.getEnumValues());
                }
                properties.put(parameter.getName(), property);
                if (parameter.isRequired()) {
                    required.add(parameter.getName());
                }
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }
}
