package org.tabula.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system helpers: recursive listing and file name decomposition.
 */
public final class FileUtils {

    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    private FileUtils() {
    }

    /**
     * Lists regular files below {@code rootDir} at any depth, sorted by path.
     */
    public static List<Path> findFiles(final Path rootDir, final String fileFilter) throws IOException {
        if (!Files.isDirectory(rootDir)) {
            LOGGER.log(Level.WARNING, "Dir not found: {0}. Empty list.", rootDir);
            return Collections.emptyList();
        }
        final PathMatcher fileMatcher = (fileFilter != null && !fileFilter.isBlank())
                ? FileSystems.getDefault().getPathMatcher(fileFilter) : path -> true;
        try (Stream<Path> paths = Files.walk(rootDir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> fileMatcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * @return file name without its last extension ({@code report.2024.csv} gives {@code report.2024})
     */
    public static String stem(final Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * @return lower-case extension without the dot, or an empty string
     */
    public static String extension(final Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * @return lower-case extension with its dot ({@code .csv}), or an empty string
     */
    public static String fileType(final Path path) {
        String ext = extension(path);
        return ext.isEmpty() ? "" : "." + ext;
    }

    /**
     * Path of {@code file} relative to {@code baseDir}; just the file name when it lies outside it.
     */
    public static Path relativeTo(final Path file, final Path baseDir) {
        Path absoluteFile = file.toAbsolutePath().normalize();
        Path absoluteBase = baseDir.toAbsolutePath().normalize();
        if (absoluteFile.startsWith(absoluteBase) && !absoluteFile.equals(absoluteBase)) {
            return absoluteBase.relativize(absoluteFile);
        }
        return file.getFileName();
    }
}
