package com.agentwatch.monitor.session;

import com.agentwatch.monitor.TranscriptLines;
import com.agentwatch.monitor.transcript.LogEntry;
import com.agentwatch.monitor.transcript.TranscriptTailer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionInfoReducerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final SessionInfoReducer reducer = new SessionInfoReducer(Clock.fixed(NOW, ZoneOffset.UTC));

    private static List<LogEntry> entries(String... lines) {
        return java.util.Arrays.stream(lines)
                .map(l -> TranscriptTailer.parseLine(l).orElseThrow())
                .toList();
    }

    @Test
    void reduce_collectsIdentityTokensAndTurns() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.user("2025-01-01T10:00:00Z", "fix the build"),
                TranscriptLines.assistantText("2025-01-01T10:00:05Z", "on it", "end_turn"),
                TranscriptLines.user("2025-01-01T10:01:00Z", "thanks"),
                TranscriptLines.assistant("2025-01-01T10:01:10Z", "[{\"type\":\"text\",\"text\":\"ok\"}]",
                        "end_turn", 100, 40, 30)));

        assertEquals(TranscriptLines.SESSION, info.sessionId());
        assertEquals("brave-otter", info.slug());
        assertEquals("/work/alpha", info.cwd());
        assertEquals("main", info.gitBranch());
        assertEquals("2.0.14", info.version());
        assertEquals("claude-sonnet-4-5", info.model());
        assertEquals(2, info.turnCount());
        assertEquals("thanks", info.lastUserMessage());
        assertEquals(new TokenCounts(110, 45, 32), info.tokens());
        assertEquals(Instant.parse("2025-01-01T10:00:00Z"), info.startedAt());
        assertEquals(Instant.parse("2025-01-01T10:01:10Z"), info.lastActivity());
        assertEquals("end_turn", info.lastAssistantStopReason());
        assertNull(info.waitReason());
    }

    @Test
    void reduce_noEntries_usesClockForTimestamps() {
        SessionInfo info = reducer.reduce(List.of());

        assertEquals("", info.sessionId());
        assertEquals(0, info.turnCount());
        assertEquals(TokenCounts.ZERO, info.tokens());
        assertEquals(NOW, info.startedAt());
        assertEquals(NOW, info.lastActivity());
    }

    @Test
    void reduce_truncatesLongUserMessage() {
        String longText = "x".repeat(150);
        SessionInfo info = reducer.reduce(entries(TranscriptLines.user("2025-01-01T10:00:00Z", longText)));

        assertEquals("x".repeat(100) + "…", info.lastUserMessage());
    }

    @Test
    void reduce_userMessageFromFirstTextBlock() {
        SessionInfo info = reducer.reduce(entries(TranscriptLines.userBlocks("2025-01-01T10:00:00Z",
                "[{\"type\":\"image\"},{\"type\":\"text\",\"text\":\"\"},{\"type\":\"text\",\"text\":\"look here\"}]")));

        assertEquals("look here", info.lastUserMessage());
    }

    @Test
    void reduce_toolResultOnlyUserEntry_keepsPreviousMessage() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.user("2025-01-01T10:00:00Z", "run tests"),
                TranscriptLines.assistantTool("2025-01-01T10:00:01Z", "tu_1", "Bash"),
                TranscriptLines.toolResult("2025-01-01T10:00:02Z", "tu_1")));

        assertEquals("run tests", info.lastUserMessage());
        assertEquals(2, info.turnCount());
    }

    @Test
    void reduce_currentToolsReplacedByNewestToolEntry() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.assistant("2025-01-01T10:00:00Z",
                        "[{\"type\":\"tool_use\",\"id\":\"a\",\"name\":\"Read\"},{\"type\":\"tool_use\",\"id\":\"b\",\"name\":\"Grep\"}]",
                        "tool_use", 1, 1, 0),
                TranscriptLines.toolResult("2025-01-01T10:00:01Z", "a"),
                TranscriptLines.toolResult("2025-01-01T10:00:01Z", "b"),
                TranscriptLines.assistantTool("2025-01-01T10:00:02Z", "c", "Edit"),
                TranscriptLines.toolResult("2025-01-01T10:00:03Z", "c"),
                TranscriptLines.assistantText("2025-01-01T10:00:04Z", "done", "end_turn")));

        assertEquals(List.of("Edit"), info.currentTools());
    }

    @Test
    void reduce_pendingQuestionTool_waitsForUser() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.user("2025-01-01T10:00:00Z", "plan it"),
                TranscriptLines.assistantTool("2025-01-01T10:00:01Z", "tu_q", "AskUserQuestion")));

        assertEquals(WaitReason.USER_QUESTION, info.waitReason());
        assertEquals(List.of("AskUserQuestion"), info.waitToolNames());
    }

    @Test
    void reduce_pendingOtherTool_waitsForPermission() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.assistant("2025-01-01T10:00:01Z",
                        "[{\"type\":\"tool_use\",\"id\":\"a\",\"name\":\"Read\"},{\"type\":\"tool_use\",\"id\":\"b\",\"name\":\"Bash\"}]",
                        "tool_use", 1, 1, 0),
                TranscriptLines.toolResult("2025-01-01T10:00:02Z", "a")));

        assertEquals(WaitReason.PERMISSION, info.waitReason());
        assertEquals(List.of("Bash"), info.waitToolNames());
    }

    @Test
    void reduce_allToolsResolved_noWaitReason() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.assistantTool("2025-01-01T10:00:01Z", "tu_1", "Bash"),
                TranscriptLines.toolResult("2025-01-01T10:00:02Z", "tu_1")));

        assertNull(info.waitReason());
        assertTrue(info.waitToolNames().isEmpty());
    }

    @Test
    void reduce_onlyNewestAssistantEntryIsConsidered() {
        // An older unresolved tool is ignored once a newer assistant entry exists
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.assistantTool("2025-01-01T10:00:01Z", "old", "AskUserQuestion"),
                TranscriptLines.assistantText("2025-01-01T10:00:02Z", "moving on", "end_turn")));

        assertNull(info.waitReason());
        assertEquals("end_turn", info.lastAssistantStopReason());
    }

    @Test
    void reduce_resultBeforeInvocation_doesNotResolveIt() {
        SessionInfo info = reducer.reduce(entries(
                TranscriptLines.toolResult("2025-01-01T10:00:00Z", "tu_1"),
                TranscriptLines.assistantTool("2025-01-01T10:00:01Z", "tu_1", "Bash")));

        assertEquals(WaitReason.PERMISSION, info.waitReason());
    }
}
