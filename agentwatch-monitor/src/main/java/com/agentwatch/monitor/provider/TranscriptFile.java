package com.agentwatch.monitor.provider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate transcript reported by discovery.
 *
 * @param sessionId      session id the file belongs to (usually its base name)
 * @param projectPath    project directory the session runs in; null when the
 *                       provider's layout does not reveal it
 * @param lastModifiedMs file modification time in epoch milliseconds
 */
public record TranscriptFile(Path path, String sessionId, String projectPath, long lastModifiedMs) {

    public TranscriptFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sessionId, "sessionId");
    }
}
