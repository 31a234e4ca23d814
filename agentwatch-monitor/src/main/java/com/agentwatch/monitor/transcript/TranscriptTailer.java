package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the trailing byte window of a newline-delimited JSON transcript.
 * <p>
 * Stateless: every call re-reads the window, so tailing an unchanged file
 * twice yields equal entry lists. When the window does not start at byte 0
 * the first (possibly partial) line is dropped. Lines that fail to parse are
 * skipped; read failures yield an empty list.
 */
@Slf4j
public class TranscriptTailer {

    public static final int DEFAULT_WINDOW_BYTES = 256_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final int windowBytes;

    public TranscriptTailer() {
        this(DEFAULT_WINDOW_BYTES);
    }

    public TranscriptTailer(int windowBytes) {
        if (windowBytes <= 0) {
            throw new IllegalArgumentException("windowBytes must be positive: " + windowBytes);
        }
        this.windowBytes = windowBytes;
    }

    public int getWindowBytes() {
        return windowBytes;
    }

    /**
     * Tail the transcript using this tailer's window.
     */
    public List<LogEntry> tail(Path path) {
        return tail(path, windowBytes);
    }

    /**
     * Tail the last {@code bytes} of the transcript, oldest entry first.
     */
    public List<LogEntry> tail(Path path, int bytes) {
        String text;
        long start;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return List.of();
            }
            start = Math.max(0, size - bytes);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            channel.position(start);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("Transcript not found: {}", path);
            return List.of();
        } catch (IOException e) {
            log.warn("Failed to read transcript {}: {}", path, e.getMessage());
            return List.of();
        }

        String[] lines = text.split("\n", -1);
        List<LogEntry> entries = new ArrayList<>(lines.length);
        // A window that starts mid-file almost always starts mid-line
        for (int i = start > 0 ? 1 : 0; i < lines.length; i++) {
            parseLine(lines[i]).ifPresent(entries::add);
        }
        return entries;
    }

    /**
     * Parse one transcript line. Blank and malformed lines yield empty.
     */
    public static Optional<LogEntry> parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(trimmed, LogEntry.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
