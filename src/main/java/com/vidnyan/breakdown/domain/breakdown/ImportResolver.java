package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.UnsupportedDialectException;
import com.vidnyan.breakdown.domain.node.SourceDialect;

/**
 * Derives the import path of a class from the file it was declared in.
 *
 * The package is the directory part of the path below the dialect's source
 * root ({@code src/main/kotlin}, {@code src/test/java}, ...). Without such a
 * root the package the front-end reported wins; a bare {@code kotlin/} or
 * {@code java/} directory is only used when no package was declared.
 */
public class ImportResolver {

    /**
     * @throws UnsupportedDialectException when the file is neither Kotlin nor Java
     */
    public String resolve(String path, String declaredPackage, String className) {
        SourceDialect dialect = SourceDialect.fromPath(path);
        String pkg = packageFromPath(path, dialect);
        if (pkg == null && declaredPackage != null && !declaredPackage.isBlank()) {
            pkg = declaredPackage.trim();
        }
        if (pkg == null) {
            pkg = packageBelow(normalize(path), "/" + dialect.sourceRoot() + "/");
        }
        if (pkg == null) {
            pkg = "";
        }
        return pkg.isEmpty() ? className : pkg + "." + className;
    }

    /**
     * Package below a {@code src/main} or {@code src/test} source root, or null
     * when the path has neither.
     */
    static String packageFromPath(String path, SourceDialect dialect) {
        String normalized = normalize(path);
        String root = dialect.sourceRoot();
        String pkg = packageBelow(normalized, "/src/main/" + root + "/");
        return pkg != null ? pkg : packageBelow(normalized, "/src/test/" + root + "/");
    }

    private static String packageBelow(String normalized, String marker) {
        int idx = normalized.indexOf(marker);
        if (idx < 0) {
            return null;
        }
        String relative = normalized.substring(idx + marker.length());
        int lastSlash = relative.lastIndexOf('/');
        return lastSlash < 0 ? "" : relative.substring(0, lastSlash).replace('/', '.');
    }

    private static String normalize(String path) {
        return "/" + path.replace('\\', '/');
    }
}
