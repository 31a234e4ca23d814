package com.agentwatch.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    @TempDir
    Path tempDir;

    @Test
    void saveThenRead() throws IOException {
        Path path = tempDir.resolve("nested").resolve("data.json");

        JsonFile.save(path, Map.of("version", 1));

        JsonNode node = JsonFile.readTree(path);
        assertNotNull(node);
        assertEquals(1, node.get("version").asInt());
        assertFalse(Files.exists(path.resolveSibling("data.json.tmp")));
    }

    @Test
    void readTree_missingFile_returnsNull() throws IOException {
        assertNull(JsonFile.readTree(tempDir.resolve("missing.json")));
    }

    @Test
    void readTree_blankFile_returnsNull() throws IOException {
        Path path = tempDir.resolve("blank.json");
        Files.writeString(path, "  \n");
        assertNull(JsonFile.readTree(path));
    }

    @Test
    void readTree_invalidJson_throws() throws IOException {
        Path path = tempDir.resolve("bad.json");
        Files.writeString(path, "{ nope");
        assertThrows(IOException.class, () -> JsonFile.readTree(path));
    }
}
