package me.golemcore.orchestrator.domain.context;

import me.golemcore.orchestrator.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecentWindowSelectorTest {

    private static Message user(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }

    private static Message assistant(String content) {
        return Message.builder().role(Message.ROLE_ASSISTANT).content(content).build();
    }

    private static Message call(String id) {
        return Message.builder().role(Message.ROLE_TOOL_CALL).content("").toolCallId(id).toolName("research.x")
                .build();
    }

    private static Message result(String id) {
        return Message.builder().role(Message.ROLE_TOOL_RESULT).content("r").toolCallId(id).toolName("research.x")
                .build();
    }

    private static List<String> contents(List<Message> messages) {
        return messages.stream().map(m -> m.getRole() + ":" + m.getContent()).toList();
    }

    @Test
    void shouldKeepMostRecentMessagesWithinCount() {
        List<Message> history = List.of(user("1"), assistant("2"), user("3"), assistant("4"));

        List<Message> window = RecentWindowSelector.select(history, 2, 10_000);

        assertEquals(List.of("user:3", "assistant:4"), contents(window));
    }

    @Test
    void shouldDropToolRunAtomicallyWhenItDoesNotFit() {
        List<Message> history = List.of(user("q"), call("a"), result("a"), call("b"), result("b"), assistant("done"));

        List<Message> window = RecentWindowSelector.select(history, 4, 10_000);

        assertEquals(List.of("assistant:done"), contents(window));
    }

    @Test
    void shouldKeepWholeToolRunWhenItFits() {
        List<Message> history = List.of(user("q"), call("a"), result("a"), assistant("done"));

        List<Message> window = RecentWindowSelector.select(history, 10, 10_000);

        assertEquals(4, window.size());
    }

    @Test
    void shouldDropOrphanedToolMessages() {
        List<Message> history = List.of(result("gone"), user("q"), call("pending"), assistant("a"));

        List<Message> window = RecentWindowSelector.select(history, 10, 10_000);

        assertEquals(List.of("user:q", "assistant:a"), contents(window));
    }

    @Test
    void shouldRespectTokenBudget() {
        List<Message> history = List.of(user("x".repeat(400)), user("short"));

        List<Message> window = RecentWindowSelector.select(history, 10, 20);

        assertEquals(List.of("user:short"), contents(window));
        assertTrue(RecentWindowSelector.select(history, 10, 0).isEmpty());
    }
}
