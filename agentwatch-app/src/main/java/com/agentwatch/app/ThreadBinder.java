package com.agentwatch.app;

import com.agentwatch.hooks.HookEvent;
import com.agentwatch.monitor.session.SessionSnapshot;

import java.util.Optional;

/**
 * Chat-side collaborator that opens or finds the thread for a new session.
 * Returns empty when the session should not be bound to a thread.
 */
@FunctionalInterface
public interface ThreadBinder {

    Optional<ThreadBinding> bindThread(HookEvent event, SessionSnapshot snapshot) throws Exception;
}
