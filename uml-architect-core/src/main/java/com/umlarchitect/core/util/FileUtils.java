package com.umlarchitect.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final String ANY_DIRECTORY_PREFIX = "**/";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Patterns are matched against the path relative to {@code rootPath}. A leading
     * {@code **}{@code /} also matches files directly inside the root.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        return findFiles(rootPath, globPattern, List.of());
    }

    /**
     * Finds files matching {@code includePattern} and none of {@code excludePatterns}.
     *
     * @param rootPath root directory to search from
     * @param includePattern glob pattern files must match
     * @param excludePatterns glob patterns that drop a file
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String includePattern, List<String> excludePatterns)
            throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matches(relativePath, includePattern)
                        && excludePatterns.stream().noneMatch(exclude -> matches(relativePath, exclude));
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Checks a relative path against a glob pattern.
     *
     * @param relativePath path relative to the search root
     * @param globPattern glob pattern
     * @return true if the path matches
     */
    public static boolean matches(Path relativePath, String globPattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        if (matcher.matches(relativePath)) {
            return true;
        }
        if (globPattern.startsWith(ANY_DIRECTORY_PREFIX) && relativePath.getNameCount() == 1) {
            PathMatcher rootMatcher = FileSystems.getDefault()
                .getPathMatcher("glob:" + globPattern.substring(ANY_DIRECTORY_PREFIX.length()));
            return rootMatcher.matches(relativePath);
        }
        return false;
    }

    /**
     * Returns a relative path as a string with forward slashes on every platform.
     *
     * @param relativePath relative path
     * @return slash-separated path
     */
    public static String toUnixPath(Path relativePath) {
        return relativePath.toString().replace('\\', '/');
    }

    /**
     * Replaces the extension of a slash-separated path.
     *
     * <p>{@code replaceExtension("com/example/Order.java", "puml")} returns
     * {@code "com/example/Order.puml"}. A path without an extension gets one appended.
     *
     * @param path slash-separated path
     * @param newExtension extension without dot
     * @return path with the new extension
     */
    public static String replaceExtension(String path, String newExtension) {
        int lastSlash = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        String base = lastDot > lastSlash + 1 ? path.substring(0, lastDot) : path;
        return base + "." + newExtension;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
