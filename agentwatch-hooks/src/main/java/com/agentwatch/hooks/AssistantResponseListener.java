package com.agentwatch.hooks;

/**
 * Receives the final reply text of a turn when a {@code Stop} hook arrives.
 */
@FunctionalInterface
public interface AssistantResponseListener {

    void onAssistantResponse(HookEvent event, String response) throws Exception;
}
