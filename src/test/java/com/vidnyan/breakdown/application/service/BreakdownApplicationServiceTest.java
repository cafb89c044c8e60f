package com.vidnyan.breakdown.application.service;

import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.adapter.out.parser.JavaParserSyntaxTreeSource;
import com.vidnyan.breakdown.adapter.out.parser.JsonSyntaxTreeSource;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchRequest;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchResult;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.FileOutcome;
import com.vidnyan.breakdown.config.BreakdownConfiguration;
import com.vidnyan.breakdown.domain.breakdown.BreakdownEngine;
import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.node.Node;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import com.vidnyan.breakdown.scanner.SourceFileScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BreakdownApplicationServiceTest {

    @TempDir
    Path tempDir;

    private BreakdownProperties properties;
    private Path sources;

    @BeforeEach
    void setUp() throws IOException {
        properties = new BreakdownProperties();
        properties.setWorkerThreads(2);
        properties.init();

        sources = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(sources);
        Files.writeString(sources.resolve("Good.java"), """
                package com.example;

                public class Good extends Base {
                    private final List<String> items = new ArrayList<>();

                    void add(String item) {
                        items.add(item);
                    }
                }
                """);
        Files.writeString(sources.resolve("Broken.java"), "public class {");
        Files.writeString(sources.resolve("notes.txt"), "not a source");
        Path generated = tempDir.resolve("target/generated");
        Files.createDirectories(generated);
        Files.writeString(generated.resolve("Generated.java"), "class Generated {}");
    }

    private BreakdownApplicationService service(BreakdownEngine engine) {
        return new BreakdownApplicationService(
                engine,
                List.of(new JavaParserSyntaxTreeSource(),
                        new JsonSyntaxTreeSource(new BreakdownConfiguration().objectMapper(), properties)),
                new SourceFileScanner(),
                properties);
    }

    @Test
    void breakdownSources_FailingFile_ShouldNotStopBatch() {
        // Act
        BatchResult result = service(BreakdownEngine.withDefaults()).breakdownSources(BatchRequest.forPath(tempDir));

        // Assert
        assertEquals(2, result.stats().filesScanned());
        assertEquals(1, result.stats().filesSucceeded());
        assertEquals(1, result.stats().filesFailed());
        assertEquals(1, result.stats().classesFound());

        // scan order is sorted by path
        List<FileOutcome> outcomes = result.outcomes();
        assertTrue(outcomes.get(0).file().endsWith("Broken.java"));
        assertEquals(FileOutcome.Status.FAILED, outcomes.get(0).status());
        assertTrue(outcomes.get(0).errorMessage().contains("Parse failed"));
        assertTrue(outcomes.get(1).isSuccess());

        BreakdownResult good = result.results().get(0);
        assertEquals("com.example.Good", good.viewImports().get("Good"));
        assertEquals(List.of("Base"), good.getClassBreakdown("Good").orElseThrow().superClasses());
    }

    @Test
    void breakdownSources_ExcludePattern_ShouldSkipFiles() {
        BatchResult result = service(BreakdownEngine.withDefaults())
                .breakdownSources(new BatchRequest(tempDir, List.of("Broken")));

        assertEquals(1, result.stats().filesScanned());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void breakdownSources_DepthCeiling_ShouldFailOnlyThatFile() throws IOException {
        Files.writeString(sources.resolve("Deep.java"), """
                class Deep {
                    int sum = 1 + 2 + 3 + 4 + 5 + 6 + 7 + 8 + 9 + 10 + 11 + 12;
                }
                """);
        BreakdownEngine shallow = new BreakdownEngine(BreakdownVocabulary.defaults(), 6);

        BatchResult result = service(shallow).breakdownSources(new BatchRequest(tempDir, List.of("Broken")));

        assertEquals(2, result.stats().filesScanned());
        assertEquals(1, result.failures().size());
        FileOutcome failed = result.failures().get(0);
        assertTrue(failed.file().endsWith("Deep.java"));
        assertTrue(failed.errorMessage().startsWith("Nesting deeper than 6 levels"));
    }

    @Test
    void breakdownSources_MissingRoot_ShouldReturnEmptyBatch() {
        BatchResult result = service(BreakdownEngine.withDefaults())
                .breakdownSources(BatchRequest.forPath(tempDir.resolve("missing")));

        assertEquals(0, result.stats().filesScanned());
        assertTrue(result.outcomes().isEmpty());
    }

    @Test
    void breakdown_SingleTree_ShouldDelegateToEngine() {
        Node.SourceFile file = new Node.SourceFile("src/main/kotlin/app/Tool.kt", null, List.of(
                new Node.FuncDecl("tool", List.of(), null, null, "fun tool() = Unit")));

        BreakdownResult result = service(BreakdownEngine.withDefaults()).breakdown(file);

        assertEquals(List.of("fun tool() = Unit"), result.independentFunctions());
    }
}
