package org.pragmatica.unionize.cli;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Utility for collecting Python source files from paths.
 */
public final class FileCollector {
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("__pycache__",
                                                                  "venv",
                                                                  "node_modules",
                                                                  "site-packages");

    private FileCollector() {}

    /**
     * Collect Python files from a list of paths (files or directories).
     * Directories are scanned recursively for {@code *.py}, skipping hidden, cache and virtualenv
     * directories. Files are taken as given.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of Python file paths, sorted per directory
     */
    public static List<Path> collectPythonFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();
        for (var path : paths) {
            if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                errorHandler.accept("No such file or directory: " + path);
            }
        }
        return files;
    }

    private static void collectFromDirectory(Path root, List<Path> files, Consumer<String> errorHandler) {
        var found = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return dir.equals(root) || !isSkipped(dir)
                           ? FileVisitResult.CONTINUE
                           : FileVisitResult.SKIP_SUBTREE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName()
                                                     .toString()
                                                     .endsWith(".py")) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    errorHandler.accept("Error scanning " + file + ": " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            errorHandler.accept("Error scanning " + root + ": " + e.getMessage());
        }
        found.sort(null);
        files.addAll(found);
    }

    private static boolean isSkipped(Path directory) {
        var name = directory.getFileName()
                            .toString();
        return name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name);
    }
}
