package com.ouroboros.core.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateFilesTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writeAtomically replaces content and leaves no temp files behind")
    void writeAtomicallyReplaces() throws Exception {
        Path target = tempDir.resolve("nested/dir/state.json");

        StateFiles.writeAtomically(target, "first".getBytes(StandardCharsets.UTF_8));
        StateFiles.writeAtomically(target, "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", Files.readString(target));
        try (var files = Files.list(target.getParent())) {
            assertEquals(List.of(target.getFileName()), files.map(Path::getFileName).toList());
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("writeAtomically keeps an existing mode and gives new files rw-r--r--")
    void writeAtomicallyPermissions() throws Exception {
        Path existing = tempDir.resolve("tool.sh");
        Files.writeString(existing, "old");
        Files.setPosixFilePermissions(existing, PosixFilePermissions.fromString("rwxr-x---"));
        Path created = tempDir.resolve("new.txt");

        StateFiles.writeAtomically(existing, "new".getBytes(StandardCharsets.UTF_8));
        StateFiles.writeAtomically(created, "new".getBytes(StandardCharsets.UTF_8));

        assertEquals("rwxr-x---", StateFiles.permissionsOf(existing));
        assertEquals("rw-r--r--", StateFiles.permissionsOf(created));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("writeAtomically applies explicit permissions")
    void writeAtomicallyExplicitPermissions() throws Exception {
        Path target = tempDir.resolve("run.sh");

        StateFiles.writeAtomically(target, "x".getBytes(StandardCharsets.UTF_8),
                PosixFilePermissions.fromString("rwxr-xr-x"));

        assertEquals("rwxr-xr-x", StateFiles.permissionsOf(target));
    }

    @Test
    @DisplayName("appendLine writes one JSON document per line")
    void appendLineWritesJsonLines() throws Exception {
        Path file = tempDir.resolve("log.jsonl");

        StateFiles.appendLine(file, Map.of("n", 1));
        StateFiles.appendLine(file, Map.of("n", 2));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertEquals("{\"n\":1}", lines.get(0));
        assertEquals("{\"n\":2}", lines.get(1));
    }

    @Test
    @DisplayName("mapper writes instants as ISO-8601 strings")
    void mapperWritesIsoInstants() throws Exception {
        String json = StateFiles.mapper().writeValueAsString(Map.of("at", Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals("{\"at\":\"2026-01-01T00:00:00Z\"}", json);
    }
}
