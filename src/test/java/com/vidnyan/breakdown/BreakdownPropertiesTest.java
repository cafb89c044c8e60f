package com.vidnyan.breakdown;

import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BreakdownPropertiesTest {

    @Test
    void init_EmptyLists_ShouldFallBackToDefaults() {
        BreakdownProperties properties = new BreakdownProperties();

        properties.init();

        assertEquals(256, properties.getMaxDepth());
        assertEquals(4, properties.getWorkerThreads());
        assertEquals(".ast.json", properties.getTreeSuffix());
        assertNull(properties.getRun().getPath());
        assertEquals("breakdown-ir.json", properties.getRun().getOutput());
        assertEquals(BreakdownVocabulary.DEFAULT_WIDGETS, properties.getVocabulary().getWidgets());
        assertEquals(BreakdownVocabulary.DEFAULT_INJECTION_ANNOTATIONS,
                properties.getVocabulary().getInjectionAnnotations());
    }

    @Test
    void init_ConfiguredList_ShouldBeKept() {
        BreakdownProperties properties = new BreakdownProperties();
        properties.getVocabulary().getWidgets().add("Panel");

        properties.init();
        BreakdownVocabulary vocabulary = properties.toVocabulary();

        assertTrue(vocabulary.isWidget("panel"));
        assertFalse(vocabulary.isWidget("vbox"));
        assertTrue(vocabulary.isReactiveWrapper("SimpleStringProperty"));
    }
}
