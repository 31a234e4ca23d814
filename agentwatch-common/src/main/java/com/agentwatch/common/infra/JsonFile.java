package com.agentwatch.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file load/save with atomic replace and owner-only file permissions.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Read a JSON file as a tree. Returns null if the file does not exist or is
     * blank.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static JsonNode readTree(Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return null;
        }
        return MAPPER.readTree(raw);
    }

    /**
     * Save data as a JSON file. The document is written to a sibling temp file
     * and moved over the target so readers never observe a partial write.
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String json = MAPPER.writeValueAsString(data) + "\n";
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tempFile, json,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        restrictPermissions(tempFile);
        Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX file system, e.g. Windows
        }
    }
}
