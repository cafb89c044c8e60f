package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.node.Node;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;

/**
 * Entry point of the breakdown engine. Holds only the read-only vocabulary and
 * stateless components, so one instance can serve many threads; every call
 * opens a fresh {@link BreakdownSession}.
 */
public class BreakdownEngine {

    private final BreakdownVocabulary vocabulary;
    private final int maxDepth;
    private final ClassBreakdownEngine classEngine;
    private final UINodeGraphBuilder graphBuilder;
    private final ImportResolver importResolver;

    public BreakdownEngine(BreakdownVocabulary vocabulary, int maxDepth) {
        this.vocabulary = vocabulary;
        this.maxDepth = maxDepth;
        MethodBodyAnalyzer analyzer = new MethodBodyAnalyzer();
        this.classEngine = new ClassBreakdownEngine(new PropertyClassifier(analyzer), analyzer);
        this.graphBuilder = new UINodeGraphBuilder();
        this.importResolver = new ImportResolver();
    }

    public static BreakdownEngine withDefaults() {
        return new BreakdownEngine(BreakdownVocabulary.defaults(), BreakdownContext.DEFAULT_MAX_DEPTH);
    }

    /**
     * Break one file down.
     */
    public BreakdownResult breakdown(Node.SourceFile file) {
        return openSession(file).run();
    }

    public BreakdownSession openSession(Node.SourceFile file) {
        if (file == null) {
            throw new ParseInputException("No source file tree supplied");
        }
        BreakdownContext context = new BreakdownContext(vocabulary, maxDepth, file.path());
        return new BreakdownSession(file, context, classEngine, graphBuilder, importResolver);
    }

    public BreakdownVocabulary vocabulary() {
        return vocabulary;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
