package com.vidnyan.breakdown;

import com.vidnyan.breakdown.application.port.in.BreakdownUseCase;
import com.vidnyan.breakdown.application.port.out.SyntaxTreeSource;
import com.vidnyan.breakdown.domain.breakdown.BreakdownEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "breakdown.worker-threads=2",
        "breakdown.max-depth=64",
        "breakdown.vocabulary.widgets=Panel,Button"
})
class BreakdownApplicationTest {

    @Autowired
    private BreakdownUseCase useCase;

    @Autowired
    private BreakdownEngine engine;

    @Autowired
    private BreakdownProperties properties;

    @Autowired
    private List<SyntaxTreeSource> treeSources;

    @Test
    void contextLoads_WithBoundProperties() {
        assertNotNull(useCase);
        assertEquals(2, properties.getWorkerThreads());
        assertEquals(64, engine.maxDepth());
        assertTrue(engine.vocabulary().isWidget("panel"));
        assertFalse(engine.vocabulary().isWidget("vbox"));
        assertTrue(engine.vocabulary().isCollectionBuilder("listOf"));
        assertEquals(2, treeSources.size());
    }
}
