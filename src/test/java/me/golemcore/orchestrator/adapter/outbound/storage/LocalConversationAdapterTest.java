package me.golemcore.orchestrator.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.orchestrator.domain.model.Conversation;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalConversationAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");
    private static final String USER_ID = "u1";
    private static final String PLATFORM = "discord";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;
    private ObjectMapper objectMapper;
    private LocalConversationAdapter adapter;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        adapter = newAdapter();
    }

    private LocalConversationAdapter newAdapter() {
        LocalConversationAdapter created = new LocalConversationAdapter(storageAdapter, objectMapper);
        created.loadHeaders();
        return created;
    }

    private static Conversation conversation(String id, String channelId, Instant lastActiveAt) {
        return Conversation.builder()
                .id(id)
                .userId(USER_ID)
                .platform(PLATFORM)
                .channelId(channelId)
                .startedAt(lastActiveAt)
                .lastActiveAt(lastActiveAt)
                .build();
    }

    @Test
    void shouldFindMostRecentActiveConversationInChannel() {
        adapter.save(conversation("old", "chan", NOW.minusSeconds(600)));
        adapter.save(conversation("recent", "chan", NOW.minusSeconds(60)));
        adapter.save(conversation("other-channel", "elsewhere", NOW));

        Optional<Conversation> active = adapter.findActive(USER_ID, PLATFORM, "chan", null, NOW.minusSeconds(1800));

        assertEquals("recent", active.orElseThrow().getId());
    }

    @Test
    void shouldNotReturnConversationIdleLongerThanTimeout() {
        adapter.save(conversation("stale", "chan", NOW.minusSeconds(3600)));

        assertTrue(adapter.findActive(USER_ID, PLATFORM, "chan", null, NOW.minusSeconds(1800)).isEmpty());
    }

    @Test
    void shouldTouchAndMarkSummarizedWithoutLosingFields() {
        adapter.save(conversation("c1", "chan", NOW.minusSeconds(600)));

        adapter.touch("c1", NOW);
        adapter.markSummarized("c1", "m9", NOW.minusSeconds(300));

        Conversation stored = adapter.findById("c1").orElseThrow();
        assertEquals(NOW, stored.getLastActiveAt());
        assertTrue(stored.isSummarized());
        assertEquals(NOW.minusSeconds(300), stored.getSummarizedThrough());
        assertEquals("m9", stored.getSummarizedThroughMessageId());
        assertFalse(stored.isFullySummarized());
        assertEquals("chan", stored.getChannelId());
    }

    @Test
    void shouldRejectUpdatesOfUnknownConversation() {
        assertThrows(IllegalArgumentException.class, () -> adapter.touch("missing", NOW));
    }

    @Test
    void shouldAppendAndReloadMessagesInOrder() {
        adapter.save(conversation("c1", "chan", NOW));
        adapter.appendMessages("c1", List.of(
                Message.builder().id("m1").role(Message.ROLE_USER).content("hi").timestamp(NOW).build(),
                Message.builder().id("m2").role(Message.ROLE_TOOL_CALL).content("").toolCallId("tc1")
                        .toolName("research.search").toolArguments(Map.of("q", "x")).timestamp(NOW).build()));
        adapter.appendMessages("c1", List.of(
                Message.builder().id("m3").role(Message.ROLE_ASSISTANT).content("done").error(true).build()));

        LocalConversationAdapter reloaded = newAdapter();
        List<Message> messages = reloaded.loadMessages("c1");

        assertEquals(List.of("m1", "m2", "m3"), messages.stream().map(Message::getId).toList());
        assertEquals(Map.of("q", "x"), messages.get(1).getToolArguments());
        assertTrue(messages.get(2).isError());
        assertEquals(NOW, reloaded.findById("c1").orElseThrow().getLastActiveAt());
    }

    @Test
    void shouldSkipCorruptMessageLines() throws Exception {
        Files.writeString(tempDir.resolve("conversations").resolve("c1.messages.jsonl"),
                "{\"id\":\"m1\",\"role\":\"user\",\"content\":\"ok\"}\nnot json\n");

        List<Message> messages = adapter.loadMessages("c1");

        assertEquals(1, messages.size());
        assertEquals("ok", messages.get(0).getContent());
    }

    @Test
    void shouldFindIdleConversationsNotFullySummarized() {
        Instant cutoff = NOW.minusSeconds(1800);
        adapter.save(conversation("active", "a", NOW.minusSeconds(60)));
        adapter.save(conversation("idle-older", "b", NOW.minusSeconds(7200)));
        adapter.save(conversation("idle", "c", NOW.minusSeconds(3600)));
        adapter.save(conversation("done", "d", NOW.minusSeconds(3600)));
        adapter.markFullySummarized("done", "m1", NOW.minusSeconds(3600));
        adapter.save(conversation("resumed", "e", NOW.minusSeconds(2400)));
        adapter.markFullySummarized("resumed", "m1", NOW.minusSeconds(4000));

        List<Conversation> idle = adapter.findIdleUnsummarized(cutoff, 10);

        assertEquals(List.of("idle-older", "idle", "resumed"), idle.stream().map(Conversation::getId).toList());
        assertEquals(List.of("idle-older"),
                adapter.findIdleUnsummarized(cutoff, 1).stream().map(Conversation::getId).toList());
    }

    @Test
    void shouldReleaseCachedLogsOfInactiveConversationsOnly() throws Exception {
        adapter.save(conversation("idle", "a", NOW.minusSeconds(3600)));
        adapter.save(conversation("active", "b", NOW));
        adapter.appendMessages("idle", List.of(
                Message.builder().id("m1").role(Message.ROLE_USER).content("before").build()));
        adapter.appendMessages("active", List.of(
                Message.builder().id("m1").role(Message.ROLE_USER).content("live").build()));

        int released = adapter.evictInactive(NOW.minusSeconds(1800));
        Files.writeString(tempDir.resolve("conversations").resolve("idle.messages.jsonl"),
                "{\"id\":\"m2\",\"role\":\"user\",\"content\":\"written elsewhere\"}\n",
                StandardOpenOption.APPEND);
        Files.writeString(tempDir.resolve("conversations").resolve("active.messages.jsonl"),
                "{\"id\":\"m2\",\"role\":\"user\",\"content\":\"written elsewhere\"}\n",
                StandardOpenOption.APPEND);

        assertEquals(1, released);
        assertEquals(List.of("m1", "m2"), adapter.loadMessages("idle").stream().map(Message::getId).toList());
        assertEquals(List.of("m1"), adapter.loadMessages("active").stream().map(Message::getId).toList());
    }

    @Test
    void shouldAppendAfterReleaseWithoutLosingMessages() {
        adapter.save(conversation("c1", "a", NOW.minusSeconds(3600)));
        adapter.appendMessages("c1", List.of(
                Message.builder().id("m1").role(Message.ROLE_USER).content("one").build()));
        adapter.evictInactive(NOW);

        adapter.appendMessages("c1", List.of(
                Message.builder().id("m2").role(Message.ROLE_ASSISTANT).content("two").build()));

        assertEquals(List.of("m1", "m2"), adapter.loadMessages("c1").stream().map(Message::getId).toList());
        assertEquals(List.of("m1", "m2"), newAdapter().loadMessages("c1").stream().map(Message::getId).toList());
    }
}
