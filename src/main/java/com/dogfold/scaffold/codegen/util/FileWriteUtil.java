package com.dogfold.scaffold.codegen.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * File operations used by the generators. Nothing here overwrites an existing file.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file that must not exist yet, creating parent directories if needed.
     *
     * @return {@code true} if the file was created, {@code false} if it already existed
     */
    public static boolean writeIfAbsent(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        try {
            Files.writeString(filePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Copies a file to a destination that must not exist yet.
     *
     * @return {@code true} if the file was copied, {@code false} if the destination already existed
     */
    public static boolean copyIfAbsent(Path source, Path destination) throws IOException {
        Path parentDir = destination.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        try {
            Files.copy(source, destination);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Creates a directory and its parents.
     *
     * @return {@code true} if the directory did not exist before
     */
    public static boolean createDirectories(Path dir) throws IOException {
        boolean existed = Files.isDirectory(dir);
        Files.createDirectories(dir);
        return !existed;
    }

    /**
     * Recursively deletes a directory.
     *
     * @return {@code true} if something was deleted
     */
    public static boolean deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to delete: " + path, e);
                    }
                });
        }
        return true;
    }
}
