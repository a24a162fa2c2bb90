package me.golemcore.orchestrator.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.PermissionLevel;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.ToolParameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestValidatorTest {

    private static final String NAMESPACE = "research";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldAcceptObjectWithToolsArray() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate(NAMESPACE, json("""
                {"tools": [{
                  "name": "research.web_search",
                  "description": "Search the web",
                  "parameters": [
                    {"name": "query", "type": "string", "description": "What to search"},
                    {"name": "limit", "type": "integer", "required": false}
                  ],
                  "min_permission": "user"
                }]}
                """));

        assertEquals(1, tools.size());
        ToolDescriptor tool = tools.get(0);
        assertEquals("research.web_search", tool.getName());
        assertEquals(NAMESPACE, tool.getNamespace());
        assertEquals(PermissionLevel.USER, tool.getMinPermission());
        ToolParameter query = tool.getParameters().get(0);
        assertTrue(query.isRequired());
        assertEquals("What to search", query.getDescription());
        assertFalse(tool.getParameters().get(1).isRequired());
        assertNull(query.getEnumValues());
    }

    @Test
    void shouldAcceptBareArrayAndRestrictUndeclaredPermissionToOwner() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate(NAMESPACE, json("""
                [{"name": "research.ping", "description": "Ping"}]
                """));

        assertEquals(PermissionLevel.OWNER, tools.get(0).getMinPermission());
        assertTrue(tools.get(0).getParameters().isEmpty());
    }

    @Test
    void shouldReadRequiredPermissionFromModuleManifest() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate("file_manager", json("""
                {"module_name": "file_manager", "description": "Files",
                 "tools": [
                   {"name": "file_manager.delete_all", "description": "Delete everything",
                    "parameters": [], "required_permission": "owner"},
                   {"name": "file_manager.list", "description": "List files",
                    "parameters": [], "required_permission": "guest"}
                 ]}
                """));

        assertEquals(PermissionLevel.OWNER, tools.get(0).getMinPermission());
        assertFalse(PermissionLevel.GUEST.allows(tools.get(0).getMinPermission()));
        assertEquals(PermissionLevel.GUEST, tools.get(1).getMinPermission());
    }

    @Test
    void shouldPreferMinPermissionOverRequiredPermission() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate(NAMESPACE, json("""
                [{"name": "research.ping", "description": "Ping",
                  "min_permission": "admin", "required_permission": "guest"}]
                """));

        assertEquals(PermissionLevel.ADMIN, tools.get(0).getMinPermission());
    }

    @Test
    void shouldRestrictUnknownPermissionToOwner() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate(NAMESPACE, json("""
                [{"name": "research.ping", "description": "Ping", "min_permission": "superuser"}]
                """));

        assertEquals(PermissionLevel.OWNER, tools.get(0).getMinPermission());
    }

    @Test
    void shouldReadEnumValues() throws Exception {
        List<ToolDescriptor> tools = ManifestValidator.validate(NAMESPACE, json("""
                [{"name": "research.search", "description": "Search",
                  "parameters": [{"name": "engine", "type": "string", "enum": ["web", "news"]}]}]
                """));

        assertEquals(List.of("web", "news"), tools.get(0).getParameters().get(0).getEnumValues());
    }

    @Test
    void shouldRejectToolOutsideNamespace() throws Exception {
        JsonNode manifest = json("""
                [{"name": "files.read", "description": "Read"}]
                """);

        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, manifest));
    }

    @Test
    void shouldRejectDuplicateNames() throws Exception {
        JsonNode manifest = json("""
                [{"name": "research.a", "description": "A"}, {"name": "research.a", "description": "A again"}]
                """);

        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, manifest));
    }

    @Test
    void shouldRejectMissingDescription() throws Exception {
        JsonNode manifest = json("""
                [{"name": "research.a"}]
                """);

        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, manifest));
    }

    @Test
    void shouldRejectUnsupportedParameterType() throws Exception {
        JsonNode manifest = json("""
                [{"name": "research.a", "description": "A",
                  "parameters": [{"name": "when", "type": "date"}]}]
                """);

        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, manifest));
    }

    @Test
    void shouldRejectManifestWithoutTools() throws Exception {
        JsonNode manifest = json("""
                {"name": "research"}
                """);

        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, manifest));
        assertThrows(ManifestValidationException.class, () -> ManifestValidator.validate(NAMESPACE, null));
    }
}
