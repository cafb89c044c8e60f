package com.vidnyan.breakdown.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.application.port.out.SyntaxTreeSource;
import com.vidnyan.breakdown.domain.breakdown.BreakdownEngine;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the breakdown engine.
 * Wires the domain engine with the configured vocabulary.
 */
@Slf4j
@Configuration
public class BreakdownConfiguration {

    /**
     * ObjectMapper for JSON trees and exports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public BreakdownVocabulary breakdownVocabulary(BreakdownProperties properties) {
        BreakdownVocabulary vocabulary = properties.toVocabulary();
        log.info("Vocabulary: {} widgets, {} reactive wrappers, {} collection builders, {} injection markers",
                vocabulary.widgets().size(),
                vocabulary.reactiveWrappers().size(),
                vocabulary.collectionBuilders().size(),
                vocabulary.injectionDelegates().size() + vocabulary.injectionAnnotations().size());
        return vocabulary;
    }

    @Bean
    public BreakdownEngine breakdownEngine(BreakdownVocabulary vocabulary, BreakdownProperties properties) {
        return new BreakdownEngine(vocabulary, properties.getMaxDepth());
    }

    /**
     * Log available front-ends on startup.
     */
    @Bean
    public String logTreeSources(List<SyntaxTreeSource> sources) {
        log.info("Registered {} syntax tree sources:", sources.size());
        sources.forEach(s -> log.info("  - {}", s.getName()));
        return "tree-sources-logged";
    }
}
