package com.vidnyan.breakdown.scanner;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Scans a source tree for files a front-end can read.
 * Build output and tool directories are skipped.
 */
@Component
public class SourceFileScanner {

    private static final Set<String> SKIPPED_DIRECTORIES =
            Set.of("target", "build", "out", ".git", ".gradle", ".idea", "node_modules");

    /**
     * Scan and return all accepted files below {@code root}, sorted by path.
     */
    public List<Path> scanSourceFiles(Path root, Predicate<Path> accepted) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> !isInSkippedDirectory(root.relativize(p)))
                    .filter(accepted)
                    .sorted()
                    .toList();
        }
    }

    private boolean isInSkippedDirectory(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (SKIPPED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
