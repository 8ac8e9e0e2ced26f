package com.ouroboros.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * File helpers shared by the persisted stores: a JSON mapper for state files,
 * atomic replace, and single-line appends.
 */
public final class StateFiles {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new ParameterNamesModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /** Mode given to files that did not exist before, in place of the 0600 temp-file default. */
    public static final Set<PosixFilePermission> DEFAULT_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private StateFiles() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Writes {@code bytes} to a sibling temp file and moves it over {@code target},
     * so readers see either the old or the new content, never a partial write.
     * An existing target keeps its permissions; a new one gets {@link #DEFAULT_FILE_PERMISSIONS}.
     */
    public static void writeAtomically(Path target, byte[] bytes) throws IOException {
        writeAtomically(target, bytes, null);
    }

    /**
     * Same as {@link #writeAtomically(Path, byte[])} but forces {@code permissions}
     * (ignored on file systems without POSIX attributes). {@code null} keeps the
     * target's current permissions.
     */
    public static void writeAtomically(Path target, byte[] bytes, Set<PosixFilePermission> permissions)
            throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            Files.write(tmp, bytes);
            if (supportsPosix(tmp)) {
                Set<PosixFilePermission> mode = permissions;
                if (mode == null) {
                    mode = Files.exists(target) ? Files.getPosixFilePermissions(target) : DEFAULT_FILE_PERMISSIONS;
                }
                Files.setPosixFilePermissions(tmp, mode);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (java.nio.file.AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * POSIX permissions of {@code file} in {@code rwxr-xr-x} form, or {@code null}
     * when the file system has no POSIX attributes.
     */
    public static String permissionsOf(Path file) throws IOException {
        if (!supportsPosix(file)) {
            return null;
        }
        return PosixFilePermissions.toString(Files.getPosixFilePermissions(file));
    }

    private static boolean supportsPosix(Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    /**
     * Appends one JSON document as a single line.
     */
    public static void appendLine(Path file, Object value) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        String line = MAPPER.writeValueAsString(value) + System.lineSeparator();
        Files.writeString(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
