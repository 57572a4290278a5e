package com.deporacle.engine.blast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Enumerates the source files of a project, skipping build output, dependencies and hidden directories.
 *
 * @author Naveed Gung
 */
final class SourceFileWalker {

    private static final Logger log = LoggerFactory.getLogger(SourceFileWalker.class);

    static final Set<String> IGNORED_DIRS = Set.of(
            "node_modules", ".git", "dist", "build", "out", "coverage",
            ".next", ".nuxt", "__pycache__", ".turbo", ".venv", "venv");

    static final Set<String> SCRIPT_EXTENSIONS = Set.of(
            ".js", ".ts", ".jsx", ".tsx", ".mjs", ".mts", ".cjs", ".cts");

    static final String PYTHON_EXTENSION = ".py";

    private SourceFileWalker() {
    }

    /** Source files under {@code root}, sorted. An unreadable or missing root yields an empty list. */
    static List<Path> walk(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    return IGNORED_DIRS.contains(name) || name.startsWith(".")
                            ? FileVisitResult.SKIP_SUBTREE
                            : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isSource(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Could not scan source tree {}: {}", root, e.getMessage());
            return List.of();
        }
        Collections.sort(files);
        return files;
    }

    static boolean isSource(Path file) {
        String ext = extensionOf(file);
        return SCRIPT_EXTENSIONS.contains(ext) || PYTHON_EXTENSION.equals(ext);
    }

    static boolean isPython(Path file) {
        return PYTHON_EXTENSION.equals(extensionOf(file));
    }

    /** File content as UTF-8. Malformed bytes, such as a Latin-1 comment, are replaced rather than rejected. */
    static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
