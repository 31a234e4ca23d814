package com.agentwatch.hooks;

import com.agentwatch.monitor.provider.HookAcceptingMonitor;
import com.agentwatch.monitor.provider.SessionRegistration;
import com.agentwatch.monitor.session.ActivityPhase;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;
import com.agentwatch.monitor.transcript.TranscriptTailer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HookEventDispatcherTest {

    @TempDir
    Path tempDir;

    private RecordingMonitor claude;
    private HookEventDispatcher dispatcher;

    /**
     * Records every write the dispatcher makes.
     */
    static final class RecordingMonitor implements HookAcceptingMonitor {
        final List<String> calls = new ArrayList<>();
        final List<SessionRegistration> registrations = new ArrayList<>();

        @Override
        public boolean updateActivityPhase(String sessionId, ActivityPhase phase) {
            calls.add(sessionId + " phase " + phase.wire());
            return true;
        }

        @Override
        public boolean updateSessionState(String sessionId, SessionState state) {
            calls.add(sessionId + " state " + state.wire());
            return true;
        }

        @Override
        public SessionSnapshot registerSession(SessionRegistration registration) {
            registrations.add(registration);
            calls.add(registration.sessionId() + " register");
            return SessionSnapshot.builder()
                    .provider("claude")
                    .sessionId(registration.sessionId())
                    .state(SessionState.ACTIVE)
                    .activityPhase(ActivityPhase.BUSY)
                    .build();
        }
    }

    @BeforeEach
    void setUp() {
        claude = new RecordingMonitor();
        dispatcher = new HookEventDispatcher(Map.of("claude", claude), new TranscriptTailer());
    }

    private static String event(String name, String extra) {
        return "{\"hook_event_name\":\"" + name + "\",\"session_id\":\"s1\",\"cwd\":\"/work/alpha\""
                + (extra.isEmpty() ? "" : "," + extra) + "}";
    }

    @Test
    void userPromptSubmit_marksBusy() {
        HookDispatchResult result = dispatcher.dispatch(event("UserPromptSubmit", "\"prompt\":\"go\""));

        assertTrue(result.isAccepted());
        assertEquals(List.of("s1 phase busy"), claude.calls);
    }

    @Test
    void sessionEnd_completesSession() {
        dispatcher.dispatch(event("SessionEnd", "\"reason\":\"exit\""));

        assertEquals(List.of("s1 state completed"), claude.calls);
    }

    @Test
    void notification_mapsPromptTypes() {
        dispatcher.dispatch(event("Notification", "\"notification_type\":\"permission_prompt\""));
        dispatcher.dispatch(event("Notification", "\"notification_type\":\"idle_prompt\""));
        dispatcher.dispatch(event("Notification", "\"notification_type\":\"elicitation_dialog\""));
        dispatcher.dispatch(event("Notification", "\"notification_type\":\"auth_success\""));

        assertEquals(List.of("s1 phase waiting_permission", "s1 phase waiting_question",
                "s1 phase waiting_question"), claude.calls);
    }

    @Test
    void sessionStart_registersAndNotifiesListeners() {
        List<String> started = new ArrayList<>();
        dispatcher.addSessionStartListener((event, snapshot) -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.addSessionStartListener((event, snapshot) -> started.add(snapshot.sessionId() + "@" + event.cwd()));

        HookDispatchResult result = dispatcher.dispatch(event("SessionStart",
                "\"source\":\"startup\",\"model\":\"claude-opus\",\"transcript_path\":\"/tmp/s1.jsonl\""));

        assertTrue(result.isAccepted());
        assertEquals(List.of("s1@/work/alpha"), started);
        SessionRegistration registration = claude.registrations.get(0);
        assertEquals("claude-opus", registration.model());
        assertEquals(Path.of("/tmp/s1.jsonl"), registration.transcriptPath());
    }

    @Test
    void stop_marksInteractableAndForwardsLastReply() throws Exception {
        Path transcript = tempDir.resolve("s1.jsonl");
        Files.writeString(transcript,
                "{\"type\":\"assistant\",\"message\":{\"role\":\"assistant\",\"stop_reason\":\"end_turn\","
                        + "\"content\":[{\"type\":\"text\",\"text\":\"All tests pass.\"}]}}\n");
        List<String> replies = new ArrayList<>();
        dispatcher.addAssistantResponseListener((event, response) -> replies.add(response));

        dispatcher.dispatch(event("Stop", "\"transcript_path\":\"" + transcript.toString().replace("\\", "\\\\") + "\""));

        assertEquals(List.of("s1 phase interactable"), claude.calls);
        assertEquals(List.of("All tests pass."), replies);
    }

    @Test
    void stop_withoutTranscript_skipsListeners() {
        List<String> replies = new ArrayList<>();
        dispatcher.addAssistantResponseListener((event, response) -> replies.add(response));

        dispatcher.dispatch(event("Stop", ""));

        assertEquals(List.of("s1 phase interactable"), claude.calls);
        assertTrue(replies.isEmpty());
    }

    @Test
    void unknownEventName_isAcceptedWithoutEffect() {
        assertTrue(dispatcher.dispatch(event("PreCompact", "")).isAccepted());
        assertTrue(claude.calls.isEmpty());
    }

    @Test
    void invalidJson_isRejected() {
        assertEquals(HookDispatchResult.Status.INVALID_JSON, dispatcher.dispatch("{oops").status());
        assertEquals(HookDispatchResult.Status.INVALID_JSON, dispatcher.dispatch("null").status());
        assertEquals(HookDispatchResult.Status.INVALID_JSON, dispatcher.dispatch("[1,2]").status());
        assertTrue(claude.calls.isEmpty());
    }

    @Test
    void missingFields_areRejected() {
        HookDispatchResult result = dispatcher.dispatch("{\"hook_event_name\":\"Stop\"}");

        assertEquals(HookDispatchResult.Status.MISSING_FIELDS, result.status());
        assertTrue(claude.calls.isEmpty());
    }

    @Test
    void unknownProvider_isRejected() {
        HookDispatchResult result = dispatcher.dispatch(event("Stop", "\"provider\":\"gemini\""));

        assertEquals(HookDispatchResult.Status.UNKNOWN_PROVIDER, result.status());
        assertTrue(claude.calls.isEmpty());
    }

    @Test
    void parsedEvent_defaultsProviderAndIgnoresUnknownFields() throws Exception {
        HookEvent parsed = new ObjectMapper().readValue(event("Stop", "\"stop_hook_active\":false"), HookEvent.class);

        assertEquals("claude", parsed.provider());
        assertEquals("Stop", parsed.hookEventName());
        assertEquals("/work/alpha", parsed.cwd());
    }
}
