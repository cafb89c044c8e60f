package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.DepthExceededException;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;

import java.util.function.Supplier;

/**
 * Mutable state of one session, handed by reference to every recursive helper.
 * Owned by a single {@link BreakdownSession}; never shared between threads.
 */
public final class BreakdownContext {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final BreakdownVocabulary vocabulary;
    private final int maxDepth;
    private final String sourcePath;

    private int depth;
    private int unclassifiedShapes;
    private String currentClass = "<file>";

    public BreakdownContext(BreakdownVocabulary vocabulary, int maxDepth, String sourcePath) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.vocabulary = vocabulary;
        this.maxDepth = maxDepth;
        this.sourcePath = sourcePath;
    }

    public BreakdownVocabulary vocabulary() {
        return vocabulary;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public String sourcePath() {
        return sourcePath;
    }

    /**
     * Run {@code step} one nesting level deeper.
     * @throws DepthExceededException past the ceiling
     */
    public <T> T descend(Supplier<T> step) {
        if (depth >= maxDepth) {
            throw new DepthExceededException(maxDepth, sourcePath + " (" + currentClass + ")");
        }
        depth++;
        try {
            return step.get();
        } finally {
            depth--;
        }
    }

    public int depth() {
        return depth;
    }

    void enterClass(String className) {
        this.currentClass = className;
    }

    public String currentClass() {
        return currentClass;
    }

    void recordUnclassified() {
        unclassifiedShapes++;
    }

    public int unclassifiedShapes() {
        return unclassifiedShapes;
    }
}
