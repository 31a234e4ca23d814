package com.agentwatch.hooks;

import com.agentwatch.monitor.session.SessionSnapshot;

/**
 * Notified after a {@code SessionStart} hook registered its session.
 */
@FunctionalInterface
public interface SessionStartListener {

    void onSessionStart(HookEvent event, SessionSnapshot snapshot) throws Exception;
}
