package com.vidnyan.breakdown.adapter.out.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchResult;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchStats;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.FileOutcome;
import com.vidnyan.breakdown.application.port.out.BreakdownExporter;
import com.vidnyan.breakdown.domain.graph.UINodeDigraph;
import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.model.ClassBreakdown;
import com.vidnyan.breakdown.domain.model.UINode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a batch result as one JSON document for the test generator.
 * Graphs are flattened to vertices, root indices and index edges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonBreakdownExporter implements BreakdownExporter {

    private final ObjectMapper objectMapper;

    @Override
    public void export(BatchResult result, Path target) throws IOException {
        ExportDocument document = toDocument(result);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), document);
        log.info("Exported {} files ({} failed) to {}",
                document.files().size(), document.failures().size(), target);
    }

    ExportDocument toDocument(BatchResult result) {
        List<FileExport> files = result.outcomes().stream()
                .filter(FileOutcome::isSuccess)
                .map(o -> toFileExport(o.result()))
                .toList();
        List<FailureExport> failures = result.failures().stream()
                .map(o -> new FailureExport(o.file().toString(), o.errorMessage()))
                .toList();
        return new ExportDocument(files, failures, result.stats());
    }

    private static FileExport toFileExport(BreakdownResult result) {
        Map<String, GraphExport> graphs = new LinkedHashMap<>();
        result.viewNodeGraphs().forEach((name, graph) -> graphs.put(name, toGraphExport(graph)));
        return new FileExport(
                result.path(),
                result.classBreakdowns(),
                result.detectedUIControls(),
                graphs,
                result.viewImports(),
                result.independentFunctions());
    }

    private static GraphExport toGraphExport(UINodeDigraph graph) {
        return new GraphExport(
                graph.getVertices(),
                graph.getRoots().stream().map(UINode::index).toList(),
                graph.getEdges().stream()
                        .map(e -> new EdgeExport(e.parent().index(), e.child().index()))
                        .toList());
    }

    record ExportDocument(
        List<FileExport> files,
        List<FailureExport> failures,
        BatchStats stats
    ) {}

    record FileExport(
        String path,
        Map<String, ClassBreakdown> classBreakdowns,
        Map<String, List<UINode>> detectedUIControls,
        Map<String, GraphExport> viewNodeGraphs,
        Map<String, String> viewImports,
        List<String> independentFunctions
    ) {}

    record GraphExport(List<UINode> nodes, List<Integer> roots, List<EdgeExport> edges) {}

    record EdgeExport(int parent, int child) {}

    record FailureExport(String file, String error) {}
}
