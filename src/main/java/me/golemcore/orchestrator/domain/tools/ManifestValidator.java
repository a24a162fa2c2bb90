package me.golemcore.orchestrator.domain.tools;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolParameter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of provider manifests.
 *
 * <p>
 * Accepts either a bare array of tools or an object with a {@code tools}
 * array. Every tool must be named {@code namespace.tool} with the provider's
 * own namespace, carry a description and declare parameters with supported
 * types. Any violation rejects the whole manifest. The permission is read from
 * {@code min_permission}, falling back to {@code required_permission}; a tool
 * declaring neither is restricted to owners.
 */
@Slf4j
public final class ManifestValidator {

    private ManifestValidator() {
    }

    public static List<ToolDescriptor> validate(String namespace, JsonNode manifest) {
        if (manifest == null || manifest.isNull() || manifest.isMissingNode()) {
            throw new ManifestValidationException("Empty manifest");
        }
        JsonNode toolsNode = manifest.isArray() ? manifest : manifest.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            throw new ManifestValidationException("Manifest has no tools array");
        }

        List<ToolDescriptor> tools = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String prefix = namespace + ".";
        for (JsonNode toolNode : toolsNode) {
            if (!toolNode.isObject()) {
                throw new ManifestValidationException("Tool entry is not an object");
            }
            String name = requireText(toolNode, "name", "tool");
            if (!name.startsWith(prefix) || name.length() == prefix.length()) {
                throw new ManifestValidationException("Tool " + name + " is outside namespace " + namespace);
            }
            if (!seen.add(name)) {
                throw new ManifestValidationException("Duplicate tool " + name);
            }
            String description = requireText(toolNode, "description", name);

            tools.add(ToolDescriptor.builder()
                    .name(name)
                    .namespace(namespace)
                    .description(description)
                    .parameters(parseParameters(name, toolNode.get("parameters")))
                    .minPermission(parsePermission(name, permissionNode(toolNode)))
                    .build());
        }
        return tools;
    }

    private static List<ToolParameter> parseParameters(String toolName, JsonNode parametersNode) {
        List<ToolParameter> parameters = new ArrayList<>();
        if (parametersNode == null || parametersNode.isNull()) {
            return parameters;
        }
        if (!parametersNode.isArray()) {
            throw new ManifestValidationException("Parameters of " + toolName + " must be an array");
        }
        for (JsonNode parameterNode : parametersNode) {
            String name = requireText(parameterNode, "name", toolName + " parameter");
            String type = requireText(parameterNode, "type", toolName + "." + name);
            if (!ToolParameter.SUPPORTED_TYPES.contains(type)) {
                throw new ManifestValidationException("Unsupported type " + type + " for " + toolName + "." + name);
            }
            List<String> enumValues = null;
            JsonNode enumNode = parameterNode.get("enum");
            if (enumNode != null && enumNode.isArray()) {
                enumValues = new ArrayList<>();
                for (JsonNode value : enumNode) {
                    enumValues.add(value.asText());
                }
            }
            parameters.add(ToolParameter.builder()
                    .name(name)
                    .type(type)
                    .description(parameterNode.path("description").asText(""))
                    .required(parameterNode.path("required").asBoolean(true))
                    .enumValues(enumValues)
                    .build());
        }
        return parameters;
    }

    private static JsonNode permissionNode(JsonNode toolNode) {
        JsonNode node = toolNode.get("min_permission");
        if (node == null || node.isNull()) {
            node = toolNode.get("required_permission");
        }
        return node;
    }

    private static PermissionLevel parsePermission(String toolName, JsonNode node) {
        if (node == null || node.isNull()) {
            log.warn("[ToolRegistry] No permission declared on {}, restricting to owner", toolName);
            return PermissionLevel.OWNER;
        }
        return PermissionLevel.parse(node.asText()).orElseGet(() -> {
            log.warn("[ToolRegistry] Unknown permission '{}' on {}, restricting to owner", node.asText(),
                    toolName);
            return PermissionLevel.OWNER;
        });
    }

    private static String requireText(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ManifestValidationException("Missing " + field + " in " + context);
        }
        return value.asText();
    }
}
