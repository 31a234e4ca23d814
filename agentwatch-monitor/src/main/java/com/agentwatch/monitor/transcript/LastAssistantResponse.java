package com.agentwatch.monitor.transcript;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the newest assistant reply text from a transcript tail.
 */
public final class LastAssistantResponse {

    /** Chat message length limit used by the notification side. */
    public static final int DEFAULT_MAX_LENGTH = 1900;

    private LastAssistantResponse() {
    }

    public static Optional<String> extract(TranscriptTailer tailer, Path transcriptPath) {
        return extract(tailer, transcriptPath, DEFAULT_MAX_LENGTH);
    }

    /**
     * Walk the tail backwards to the newest assistant entry with non-blank
     * text blocks and return them joined by newlines. Tool-use and other
     * blocks are ignored.
     */
    public static Optional<String> extract(TranscriptTailer tailer, Path transcriptPath, int maxLength) {
        List<LogEntry> entries = tailer.tail(transcriptPath);
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (!(entries.get(i) instanceof LogEntry.AssistantEntry assistant)) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (ContentBlock block : assistant.blocks()) {
                if (block.isText() && block.text() != null && !block.text().isEmpty()) {
                    parts.add(block.text());
                }
            }
            String full = String.join("\n", parts).trim();
            if (full.isEmpty()) {
                continue;
            }
            if (full.length() > maxLength) {
                return Optional.of(full.substring(0, maxLength) + "...");
            }
            return Optional.of(full);
        }
        return Optional.empty();
    }
}
