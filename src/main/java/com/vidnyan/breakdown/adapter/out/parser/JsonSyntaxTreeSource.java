package com.vidnyan.breakdown.adapter.out.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.application.port.out.SyntaxTreeSource;
import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads trees that an external front-end (e.g. a Kotlin parser) has already
 * serialized as JSON. Files are recognised by the configured tree suffix,
 * so {@code MainView.kt.ast.json} describes {@code MainView.kt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonSyntaxTreeSource implements SyntaxTreeSource {

    private final ObjectMapper objectMapper;
    private final BreakdownProperties properties;

    @Override
    public boolean supports(Path file) {
        return file.getFileName() != null
                && file.getFileName().toString().endsWith(properties.getTreeSuffix());
    }

    @Override
    public Node.SourceFile read(Path file) {
        Node root;
        try {
            root = objectMapper.readValue(file.toFile(), Node.class);
        } catch (IOException e) {
            throw new ParseInputException("Invalid syntax tree in " + file + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Node.SourceFile sourceFile)) {
            throw new ParseInputException("Expected a SourceFile root in " + file + " but found "
                    + (root == null ? "nothing" : root.getClass().getSimpleName()));
        }
        if (sourceFile.path() != null && !sourceFile.path().isBlank()) {
            return sourceFile;
        }
        // Path defaults to the described source file
        String described = describedPath(file);
        log.debug("Tree {} has no path, using {}", file, described);
        return new Node.SourceFile(described, sourceFile.packageName(), sourceFile.declarations());
    }

    private String describedPath(Path file) {
        String path = file.toString().replace('\\', '/');
        return path.substring(0, path.length() - properties.getTreeSuffix().length());
    }
}
