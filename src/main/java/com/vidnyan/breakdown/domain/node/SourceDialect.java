package com.vidnyan.breakdown.domain.node;

import com.vidnyan.breakdown.domain.exception.UnsupportedDialectException;

import java.util.List;
import java.util.Locale;

/**
 * Source dialects the engine can derive imports for, detected by file extension.
 */
public enum SourceDialect {
    KOTLIN("kotlin", List.of(".kt", ".kts")),
    JAVA("java", List.of(".java"));

    private final String sourceRoot;
    private final List<String> extensions;

    SourceDialect(String sourceRoot, List<String> extensions) {
        this.sourceRoot = sourceRoot;
        this.extensions = extensions;
    }

    /**
     * Directory name that conventionally holds this dialect's sources (src/main/&lt;root&gt;).
     */
    public String sourceRoot() {
        return sourceRoot;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Detect the dialect of a path.
     * @throws UnsupportedDialectException for any other extension
     */
    public static SourceDialect fromPath(String path) {
        if (path != null) {
            String lower = path.toLowerCase(Locale.ROOT);
            for (SourceDialect dialect : values()) {
                for (String extension : dialect.extensions) {
                    if (lower.endsWith(extension)) {
                        return dialect;
                    }
                }
            }
        }
        throw new UnsupportedDialectException(path);
    }
}
