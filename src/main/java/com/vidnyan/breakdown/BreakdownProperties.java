package com.vidnyan.breakdown;

import com.vidnyan.breakdown.domain.breakdown.BreakdownContext;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the breakdown engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "breakdown")
public class BreakdownProperties {

    /**
     * Recursion ceiling for nested expressions.
     */
    private int maxDepth = BreakdownContext.DEFAULT_MAX_DEPTH;

    /**
     * Files analysed in parallel by a batch.
     */
    private int workerThreads = 4;

    /**
     * Suffix of pre-parsed JSON trees written by external front-ends.
     */
    private String treeSuffix = ".ast.json";

    private Vocabulary vocabulary = new Vocabulary();

    private Run run = new Run();

    /**
     * Name lists; an empty list keeps the built-in TornadoFX/JavaFX defaults.
     */
    @Data
    public static class Vocabulary {
        private List<String> widgets = new ArrayList<>();
        private List<String> reactiveWrappers = new ArrayList<>();
        private List<String> collectionBuilders = new ArrayList<>();
        private List<String> injectionDelegates = new ArrayList<>();
        private List<String> injectionAnnotations = new ArrayList<>();
    }

    /**
     * Batch run on startup; skipped while {@code path} is blank.
     */
    @Data
    public static class Run {
        private String path;
        private String output = "breakdown-ir.json";
        private List<String> exclude = new ArrayList<>();
    }

    @PostConstruct
    public void init() {
        // Fall back to the defaults for lists left unconfigured
        if (vocabulary.widgets.isEmpty()) {
            vocabulary.widgets.addAll(BreakdownVocabulary.DEFAULT_WIDGETS);
        }
        if (vocabulary.reactiveWrappers.isEmpty()) {
            vocabulary.reactiveWrappers.addAll(BreakdownVocabulary.DEFAULT_REACTIVE_WRAPPERS);
        }
        if (vocabulary.collectionBuilders.isEmpty()) {
            vocabulary.collectionBuilders.addAll(BreakdownVocabulary.DEFAULT_COLLECTION_BUILDERS);
        }
        if (vocabulary.injectionDelegates.isEmpty()) {
            vocabulary.injectionDelegates.addAll(BreakdownVocabulary.DEFAULT_INJECTION_DELEGATES);
        }
        if (vocabulary.injectionAnnotations.isEmpty()) {
            vocabulary.injectionAnnotations.addAll(BreakdownVocabulary.DEFAULT_INJECTION_ANNOTATIONS);
        }
    }

    /**
     * Snapshot of the configured lists as an immutable table.
     */
    public BreakdownVocabulary toVocabulary() {
        return BreakdownVocabulary.of(
                vocabulary.widgets,
                vocabulary.reactiveWrappers,
                vocabulary.collectionBuilders,
                vocabulary.injectionDelegates,
                vocabulary.injectionAnnotations);
    }
}
