package com.vidnyan.breakdown.application.port.out;

import com.vidnyan.breakdown.domain.node.Node;

import java.nio.file.Path;

/**
 * Port for front-ends that turn a file into a {@link Node.SourceFile} tree.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface SyntaxTreeSource {

    /**
     * Check if this front-end can read the given file.
     */
    boolean supports(Path file);

    /**
     * Read a file into a tree.
     * @throws com.vidnyan.breakdown.domain.exception.ParseInputException when the file cannot be read or parsed
     */
    Node.SourceFile read(Path file);

    /**
     * Get the front-end name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
