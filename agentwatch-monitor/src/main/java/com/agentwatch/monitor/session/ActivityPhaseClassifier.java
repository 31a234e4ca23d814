package com.agentwatch.monitor.session;

import java.util.List;

/**
 * Maps reducer output to an {@link ActivityPhase}. Rules are checked in
 * order and the first match wins, so a pending wait outranks an
 * {@code end_turn} stop reason.
 */
public final class ActivityPhaseClassifier {

    public static final String END_TURN = "end_turn";

    private ActivityPhaseClassifier() {
    }

    public static ActivityPhase classify(SessionInfo info) {
        return classify(info.waitReason(), info.waitToolNames(), info.lastAssistantStopReason());
    }

    public static ActivityPhase classify(WaitReason waitReason, List<String> waitToolNames,
            String lastAssistantStopReason) {
        if (waitReason == WaitReason.USER_QUESTION) {
            return ActivityPhase.WAITING_QUESTION;
        }
        if (waitReason == WaitReason.PERMISSION) {
            return ActivityPhase.WAITING_PERMISSION;
        }
        boolean noPendingTools = waitToolNames == null || waitToolNames.isEmpty();
        if (END_TURN.equals(lastAssistantStopReason) && noPendingTools) {
            return ActivityPhase.INTERACTABLE;
        }
        return ActivityPhase.BUSY;
    }
}
