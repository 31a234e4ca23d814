package com.agentwatch.hooks;

import com.agentwatch.monitor.provider.HookAcceptingMonitor;
import com.agentwatch.monitor.provider.SessionRegistration;
import com.agentwatch.monitor.session.ActivityPhase;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;
import com.agentwatch.monitor.transcript.LastAssistantResponse;
import com.agentwatch.monitor.transcript.TranscriptTailer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes hook events to the monitor of their provider.
 * <p>
 * {@code Stop} marks the session interactable and forwards the last reply,
 * {@code UserPromptSubmit} marks it busy, {@code SessionStart} registers it,
 * {@code SessionEnd} completes it, and {@code Notification} maps permission
 * and question prompts to the matching waiting phase. Other event names are
 * accepted and ignored. Listener failures are logged per listener.
 */
@Slf4j
public class HookEventDispatcher {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, HookAcceptingMonitor> monitors;
    private final TranscriptTailer tailer;
    private final List<SessionStartListener> sessionStartListeners = new CopyOnWriteArrayList<>();
    private final List<AssistantResponseListener> responseListeners = new CopyOnWriteArrayList<>();

    /**
     * @param monitors monitors keyed by provider name
     * @param tailer   used to read the last reply on {@code Stop}
     */
    public HookEventDispatcher(Map<String, ? extends HookAcceptingMonitor> monitors, TranscriptTailer tailer) {
        this.monitors = Map.copyOf(monitors);
        this.tailer = tailer;
    }

    public void addSessionStartListener(SessionStartListener listener) {
        sessionStartListeners.add(listener);
    }

    public void addAssistantResponseListener(AssistantResponseListener listener) {
        responseListeners.add(listener);
    }

    /**
     * Parse and dispatch a raw hook payload.
     */
    public HookDispatchResult dispatch(String json) {
        HookEvent event;
        try {
            event = json == null ? null : MAPPER.readValue(json, HookEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Hook payload rejected: {}", e.getOriginalMessage());
            return HookDispatchResult.rejected(HookDispatchResult.Status.INVALID_JSON, e.getOriginalMessage());
        }
        if (event == null) {
            return HookDispatchResult.rejected(HookDispatchResult.Status.INVALID_JSON, "empty payload");
        }
        return dispatch(event);
    }

    public HookDispatchResult dispatch(HookEvent event) {
        if (isBlank(event.hookEventName()) || isBlank(event.sessionId())) {
            log.warn("Hook event missing hook_event_name or session_id");
            return HookDispatchResult.rejected(HookDispatchResult.Status.MISSING_FIELDS,
                    "hook_event_name and session_id are required");
        }
        HookAcceptingMonitor monitor = monitors.get(event.provider());
        if (monitor == null) {
            log.warn("Hook event for unknown provider {}", event.provider());
            return HookDispatchResult.rejected(HookDispatchResult.Status.UNKNOWN_PROVIDER,
                    "Unknown provider: " + event.provider());
        }

        log.debug("Hook {} for {}:{}", event.hookEventName(), event.provider(), event.sessionId());
        switch (event.hookEventName()) {
            case HookEvent.STOP -> onStop(monitor, event);
            case HookEvent.USER_PROMPT_SUBMIT -> monitor.updateActivityPhase(event.sessionId(), ActivityPhase.BUSY);
            case HookEvent.SESSION_START -> onSessionStart(monitor, event);
            case HookEvent.SESSION_END -> monitor.updateSessionState(event.sessionId(), SessionState.COMPLETED);
            case HookEvent.NOTIFICATION -> onNotification(monitor, event);
            default -> log.debug("Ignoring hook event {}", event.hookEventName());
        }
        return HookDispatchResult.accepted();
    }

    private void onStop(HookAcceptingMonitor monitor, HookEvent event) {
        monitor.updateActivityPhase(event.sessionId(), ActivityPhase.INTERACTABLE);
        if (responseListeners.isEmpty() || tailer == null) {
            return;
        }
        Path transcript = toPath(event.transcriptPath());
        if (transcript == null) {
            return;
        }
        Optional<String> response = LastAssistantResponse.extract(tailer, transcript);
        if (response.isEmpty()) {
            return;
        }
        for (AssistantResponseListener listener : responseListeners) {
            try {
                listener.onAssistantResponse(event, response.get());
            } catch (Exception e) {
                log.error("Assistant response listener failed for {}: {}", event.sessionId(), e.getMessage(), e);
            }
        }
    }

    private void onSessionStart(HookAcceptingMonitor monitor, HookEvent event) {
        SessionSnapshot snapshot = monitor.registerSession(new SessionRegistration(
                event.sessionId(), event.cwd(), toPath(event.transcriptPath()), event.model()));
        for (SessionStartListener listener : sessionStartListeners) {
            try {
                listener.onSessionStart(event, snapshot);
            } catch (Exception e) {
                log.error("Session start listener failed for {}: {}", event.sessionId(), e.getMessage(), e);
            }
        }
    }

    private void onNotification(HookAcceptingMonitor monitor, HookEvent event) {
        String type = event.notificationType();
        if (HookEvent.PERMISSION_PROMPT.equals(type)) {
            monitor.updateActivityPhase(event.sessionId(), ActivityPhase.WAITING_PERMISSION);
        } else if (HookEvent.IDLE_PROMPT.equals(type) || HookEvent.ELICITATION_DIALOG.equals(type)) {
            monitor.updateActivityPhase(event.sessionId(), ActivityPhase.WAITING_QUESTION);
        } else {
            log.debug("Ignoring notification type {}", type);
        }
    }

    private static Path toPath(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            log.warn("Hook transcript path invalid: {}", value);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
