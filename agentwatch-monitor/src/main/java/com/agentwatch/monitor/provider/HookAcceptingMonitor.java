package com.agentwatch.monitor.provider;

import com.agentwatch.monitor.session.ActivityPhase;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;

/**
 * Write path for hook events. Each update replaces the session's snapshot
 * and notifies refresh listeners.
 */
public interface HookAcceptingMonitor {

    /**
     * @return false when the session is unknown
     */
    boolean updateActivityPhase(String sessionId, ActivityPhase phase);

    /**
     * @return false when the session is unknown
     */
    boolean updateSessionState(String sessionId, SessionState state);

    /**
     * Add a skeleton snapshot for a session discovery has not reported yet.
     * Returns the existing snapshot when the session is already known.
     */
    SessionSnapshot registerSession(SessionRegistration registration);
}
