package com.luacomposer.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files with the given extension under a root directory, at any depth.
     *
     * <p>Results are sorted by their path relative to the root so discovery is
     * deterministic across platforms and file systems.
     *
     * @param rootPath root directory to search from
     * @param extension extension including the dot, e.g. {@code .lua}
     * @return matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String extension) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(extension))
                .sorted(Comparator.comparing(path -> ModuleIdentity.toPortable(rootPath.relativize(path))))
                .toList();
        }
    }

    /**
     * Reads a file as UTF-8 text.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Checks whether {@code path}, once normalized, lies inside {@code root}.
     *
     * @param root absolute, normalized root directory
     * @param path path to check
     * @return true if the path is the root or below it
     */
    public static boolean isInside(Path root, Path path) {
        return path.toAbsolutePath().normalize().startsWith(root);
    }

    /**
     * Counts the lines of a text the way editors do: a trailing line break does not start a new line.
     *
     * @param text text to count
     * @return number of lines, {@code 0} for empty text
     */
    public static long countLines(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        long lines = text.chars().filter(c -> c == '\n').count();
        return text.endsWith("\n") ? lines : lines + 1;
    }
}
