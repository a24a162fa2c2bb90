package me.golemcore.orchestrator.adapter.outbound.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.tools.ToolProviderException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.ToolProviderPort;
import me.golemcore.orchestrator.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeignToolProviderAdapterTest {

    private static final String NAMESPACE = "research";
    private static final String BASE_URL = "http://research.local:8000";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private FeignToolProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new FeignToolProviderAdapter(new FeignClientFactory(client, objectMapper),
                new OrchestratorProperties());
    }

    private static ToolProviderPort.ExecuteRequest request(Map<String, Object> routingContext) {
        return new ToolProviderPort.ExecuteRequest("research.web_search", Map.of("query", "java"), "user-1",
                routingContext);
    }

    @Test
    void shouldFetchManifest() {
        engine.enqueueJson(200, "{\"tools\": [{\"name\": \"research.web_search\"}]}");

        JsonNode manifest = adapter.fetchManifest(NAMESPACE, BASE_URL);

        assertEquals("research.web_search", manifest.get("tools").get(0).get("name").asText());
        OkHttpMockEngine.CapturedRequest captured = engine.takeRequest();
        assertEquals("GET", captured.method());
        assertEquals("/manifest", captured.target());
    }

    @Test
    void shouldPostExecuteEnvelope() throws Exception {
        engine.enqueueJson(200, "{\"success\": true, \"result\": {\"answer\": 42}}");

        JsonNode reply = adapter.execute(NAMESPACE, BASE_URL, request(null));

        assertEquals(42, reply.get("result").get("answer").asInt());
        OkHttpMockEngine.CapturedRequest captured = engine.takeRequest();
        assertEquals("POST", captured.method());
        assertEquals("/execute", captured.target());
        JsonNode body = objectMapper.readTree(captured.body());
        assertEquals("research.web_search", body.get("tool_name").asText());
        assertEquals("java", body.get("arguments").get("query").asText());
        assertEquals("user-1", body.get("acting_user").asText());
        assertFalse(body.has("routing_context"));
    }

    @Test
    void shouldIncludeRoutingContextWhenGiven() throws Exception {
        engine.enqueueJson(200, "{\"success\": true}");

        adapter.execute(NAMESPACE, BASE_URL, request(Map.of("channel_id", "c-1")));

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("c-1", body.get("routing_context").get("channel_id").asText());
    }

    @Test
    void shouldClassifyServerErrorAsUnavailable() {
        engine.enqueueJson(503, "{\"detail\": \"overloaded\"}");

        ToolProviderException e = assertThrows(ToolProviderException.class,
                () -> adapter.execute(NAMESPACE, BASE_URL, request(null)));

        assertEquals(ToolProviderException.Kind.UNAVAILABLE, e.getKind());
        assertEquals(503, e.getStatusCode());
        assertEquals(NAMESPACE, e.getNamespace());
    }

    @Test
    void shouldClassifyClientErrorAsRejected() {
        engine.enqueueJson(403, "{\"detail\": \"forbidden\"}");

        ToolProviderException e = assertThrows(ToolProviderException.class,
                () -> adapter.execute(NAMESPACE, BASE_URL, request(null)));

        assertEquals(ToolProviderException.Kind.REJECTED, e.getKind());
        assertEquals(403, e.getStatusCode());
    }

    @Test
    void shouldClassifyIoFailureAsUnavailableWithoutRetrying() {
        engine.enqueueFailure(new IOException("connection reset"));

        ToolProviderException e = assertThrows(ToolProviderException.class,
                () -> adapter.fetchManifest(NAMESPACE, BASE_URL));

        assertEquals(ToolProviderException.Kind.UNAVAILABLE, e.getKind());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldClassifyUnparseableBodyAsUnavailable() {
        engine.enqueueText(200, "<html>not json</html>", "text/html");

        ToolProviderException e = assertThrows(ToolProviderException.class,
                () -> adapter.fetchManifest(NAMESPACE, BASE_URL));

        assertEquals(ToolProviderException.Kind.UNAVAILABLE, e.getKind());
        assertTrue(e.getMessage().contains(NAMESPACE));
    }
}
