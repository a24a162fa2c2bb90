package me.golemcore.orchestrator.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.FileReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileReferenceCollectorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldCollectTopLevelAndNestedFiles() throws Exception {
        String json = """
                {
                  "url": "https://files.example/chart.png",
                  "filename": "chart.png",
                  "mime_type": "image/png",
                  "files": [
                    {"url": "https://files.example/data.csv"},
                    {"filename": "no-url.txt"},
                    "not an object"
                  ]
                }
                """;

        List<FileReference> files = FileReferenceCollector.collect(objectMapper.readTree(json));

        assertEquals(List.of(
                new FileReference("https://files.example/chart.png", "chart.png", "image/png"),
                new FileReference("https://files.example/data.csv", "file", null)), files);
    }

    @Test
    void shouldIgnoreNonObjectPayloads() throws Exception {
        assertTrue(FileReferenceCollector.collect(objectMapper.readTree("\"https://files.example/x\"")).isEmpty());
        assertTrue(FileReferenceCollector.collect(objectMapper.readTree("[]")).isEmpty());
        assertTrue(FileReferenceCollector.collect(null).isEmpty());
    }

    @Test
    void shouldIgnoreBlankUrl() throws Exception {
        assertTrue(FileReferenceCollector.collect(objectMapper.readTree("{\"url\": \" \"}")).isEmpty());
    }
}
