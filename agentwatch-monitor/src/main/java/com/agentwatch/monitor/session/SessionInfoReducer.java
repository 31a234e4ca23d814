package com.agentwatch.monitor.session;

import com.agentwatch.monitor.transcript.ContentBlock;
import com.agentwatch.monitor.transcript.LogEntry;
import com.agentwatch.monitor.transcript.TokenUsage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds a transcript tail into a {@link SessionInfo}.
 * <p>
 * The pending-tool pass walks backwards from the newest entry; its cost is
 * linear in the tail window.
 */
public class SessionInfoReducer {

    static final int MAX_USER_MESSAGE_LENGTH = 100;
    static final String ELLIPSIS = "…";

    private final Clock clock;

    public SessionInfoReducer() {
        this(Clock.systemUTC());
    }

    public SessionInfoReducer(Clock clock) {
        this.clock = clock;
    }

    public SessionInfo reduce(List<LogEntry> entries) {
        String sessionId = "";
        String slug = "";
        String cwd = "";
        String gitBranch = null;
        String version = null;
        String model = null;
        int turnCount = 0;
        String lastUserMessage = null;
        List<String> currentTools = List.of();
        long input = 0;
        long output = 0;
        long cached = 0;
        Instant startedAt = null;
        Instant lastActivity = null;
        String lastStopReason = null;

        for (LogEntry entry : entries) {
            // Identity: last non-empty value wins
            if (notEmpty(entry.sessionId())) sessionId = entry.sessionId();
            if (notEmpty(entry.slug())) slug = entry.slug();
            if (notEmpty(entry.cwd())) cwd = entry.cwd();
            if (notEmpty(entry.gitBranch())) gitBranch = entry.gitBranch();
            if (notEmpty(entry.version())) version = entry.version();

            Instant ts = entry.timestamp();
            if (ts != null) {
                if (startedAt == null || ts.isBefore(startedAt)) startedAt = ts;
                if (lastActivity == null || ts.isAfter(lastActivity)) lastActivity = ts;
            }

            if (entry instanceof LogEntry.UserEntry user) {
                turnCount++;
                String text = user.text();
                if (text != null) {
                    lastUserMessage = truncate(text);
                }
            } else if (entry instanceof LogEntry.AssistantEntry assistant) {
                if (notEmpty(assistant.model())) model = assistant.model();
                lastStopReason = assistant.stopReason();

                TokenUsage usage = assistant.usage();
                if (usage != null) {
                    input += usage.inputTokens();
                    output += usage.outputTokens();
                    cached += usage.cacheReadInputTokens();
                }

                List<String> tools = assistant.toolUses().stream()
                        .map(ContentBlock::name)
                        .filter(SessionInfoReducer::notEmpty)
                        .toList();
                if (!tools.isEmpty()) {
                    currentTools = tools;
                }
            }
        }

        PendingTools pending = findPendingTools(entries);
        Instant now = clock.instant();

        return SessionInfo.builder()
                .sessionId(sessionId)
                .slug(slug)
                .cwd(cwd)
                .gitBranch(gitBranch)
                .version(version)
                .model(model)
                .turnCount(turnCount)
                .lastUserMessage(lastUserMessage)
                .currentTools(currentTools)
                .tokens(new TokenCounts(input, output, cached))
                .startedAt(startedAt != null ? startedAt : now)
                .lastActivity(lastActivity != null ? lastActivity : now)
                .waitReason(pending.reason())
                .waitToolNames(pending.toolNames())
                .lastAssistantStopReason(lastStopReason)
                .build();
    }

    private record PendingTools(WaitReason reason, List<String> toolNames) {
        static final PendingTools NONE = new PendingTools(null, List.of());
    }

    /**
     * Only the newest assistant entry is inspected. If it invoked no tools,
     * nothing is pending; otherwise its invocations without a matching
     * tool_result in a later user entry are.
     */
    private static PendingTools findPendingTools(List<LogEntry> entries) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (!(entries.get(i) instanceof LogEntry.AssistantEntry assistant)) {
                continue;
            }
            List<ContentBlock> toolUses = assistant.toolUses().stream()
                    .filter(b -> notEmpty(b.id()))
                    .toList();
            if (toolUses.isEmpty()) {
                return PendingTools.NONE;
            }

            Set<String> resolved = new HashSet<>();
            for (int j = i + 1; j < entries.size(); j++) {
                if (!(entries.get(j) instanceof LogEntry.UserEntry user)) {
                    continue;
                }
                for (ContentBlock block : user.blocks()) {
                    if (block.isToolResult() && notEmpty(block.toolUseId())) {
                        resolved.add(block.toolUseId());
                    }
                }
            }

            List<ContentBlock> pending = toolUses.stream()
                    .filter(t -> !resolved.contains(t.id()))
                    .toList();
            if (pending.isEmpty()) {
                return PendingTools.NONE;
            }
            boolean asksUser = pending.stream()
                    .anyMatch(t -> WaitReason.ASK_USER_QUESTION_TOOL.equals(t.name()));
            List<String> names = new ArrayList<>();
            for (ContentBlock t : pending) {
                if (notEmpty(t.name())) {
                    names.add(t.name());
                }
            }
            return new PendingTools(asksUser ? WaitReason.USER_QUESTION : WaitReason.PERMISSION, names);
        }
        return PendingTools.NONE;
    }

    static String truncate(String text) {
        if (text.length() <= MAX_USER_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_USER_MESSAGE_LENGTH) + ELLIPSIS;
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
