package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.exception.UnsupportedDialectException;
import com.vidnyan.breakdown.domain.graph.UINodeDigraph;
import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.model.ClassBreakdown;
import com.vidnyan.breakdown.domain.model.UINode;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One pass over one file's top-level declarations.
 *
 * Structured declarations go through the class engine, the UI graph builder
 * and the import resolver; top-level functions are collected as raw text.
 * A class is committed to the result maps only after all three steps
 * succeeded. A session is used for exactly one file.
 */
@Slf4j
public final class BreakdownSession {

    private final Node.SourceFile file;
    private final BreakdownContext context;
    private final ClassBreakdownEngine classEngine;
    private final UINodeGraphBuilder graphBuilder;
    private final ImportResolver importResolver;

    private final Map<String, ClassBreakdown> classBreakdowns = new LinkedHashMap<>();
    private final Map<String, List<UINode>> detectedUIControls = new LinkedHashMap<>();
    private final Map<String, UINodeDigraph> viewNodeGraphs = new LinkedHashMap<>();
    private final Map<String, String> viewImports = new LinkedHashMap<>();
    private final List<String> independentFunctions = new ArrayList<>();
    private boolean finished;

    BreakdownSession(
            Node.SourceFile file,
            BreakdownContext context,
            ClassBreakdownEngine classEngine,
            UINodeGraphBuilder graphBuilder,
            ImportResolver importResolver) {
        this.file = file;
        this.context = context;
        this.classEngine = classEngine;
        this.graphBuilder = graphBuilder;
        this.importResolver = importResolver;
    }

    /**
     * Run the pass.
     * @throws ParseInputException for a structurally invalid top-level declaration
     * @throws com.vidnyan.breakdown.domain.exception.DepthExceededException past the nesting ceiling
     */
    public BreakdownResult run() {
        if (finished) {
            throw new IllegalStateException("Session already ran for " + file.path());
        }
        finished = true;

        for (Node declaration : file.declarations()) {
            if (declaration instanceof Node.StructuredDecl structured) {
                breakDownClass(structured);
            } else if (declaration instanceof Node.FuncDecl func) {
                independentFunctions.add(func.text() != null && !func.text().isBlank()
                        ? func.text()
                        : MethodBodyAnalyzer.renderSignature(func));
            } else {
                log.debug("Ignoring top-level {} in {}",
                        declaration == null ? "null" : declaration.getClass().getSimpleName(), file.path());
            }
        }

        if (context.unclassifiedShapes() > 0) {
            log.debug("{}: {} unrecognised shapes degraded", file.path(), context.unclassifiedShapes());
        }
        return new BreakdownResult(
                file.path(),
                Collections.unmodifiableMap(classBreakdowns),
                Collections.unmodifiableMap(detectedUIControls),
                Collections.unmodifiableMap(viewNodeGraphs),
                Collections.unmodifiableMap(viewImports),
                Collections.unmodifiableList(independentFunctions));
    }

    private void breakDownClass(Node.StructuredDecl structured) {
        String className = structured.name();
        if (className == null || className.isBlank()) {
            throw new ParseInputException("Structured declaration without a name in " + file.path());
        }
        if (classBreakdowns.containsKey(className)) {
            throw new ParseInputException("Duplicate class " + className + " in " + file.path());
        }
        context.enterClass(className);

        ClassBreakdown breakdown = classEngine.breakDown(className, structured, context);
        UINodeDigraph graph = graphBuilder.build(structured.members(), context);
        String viewImport = null;
        try {
            viewImport = importResolver.resolve(file.path(), file.packageName(), className);
        } catch (UnsupportedDialectException e) {
            log.warn("No import for {}: {}", className, e.getMessage());
        }

        classBreakdowns.put(className, breakdown);
        if (!graph.isEmpty()) {
            detectedUIControls.put(className, graph.getVertices());
            viewNodeGraphs.put(className, graph);
        }
        if (viewImport != null) {
            viewImports.put(className, viewImport);
        }
    }
}
