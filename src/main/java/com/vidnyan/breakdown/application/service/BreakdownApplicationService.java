package com.vidnyan.breakdown.application.service;

import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase;
import com.vidnyan.breakdown.application.port.out.SyntaxTreeSource;
import com.vidnyan.breakdown.domain.breakdown.BreakdownEngine;
import com.vidnyan.breakdown.domain.exception.BreakdownException;
import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.node.Node;
import com.vidnyan.breakdown.scanner.SourceFileScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Application service that runs breakdown sessions over a whole source tree.
 * Sessions share nothing but the read-only vocabulary, so files are analysed
 * on a fixed worker pool; every file succeeds or fails on its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreakdownApplicationService implements BreakdownUseCase {

    private final BreakdownEngine engine;
    private final List<SyntaxTreeSource> treeSources;
    private final SourceFileScanner scanner;
    private final BreakdownProperties properties;

    @Override
    public BreakdownResult breakdown(Node.SourceFile file) {
        BreakdownResult result = engine.breakdown(file);
        log.info("{}: {} classes, {} with UI controls, {} independent functions",
                result.path(),
                result.classBreakdowns().size(),
                result.viewNodeGraphs().size(),
                result.independentFunctions().size());
        return result;
    }

    @Override
    public BatchResult breakdownSources(BatchRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting breakdown of: {}", request.sourceRoot());

        // Step 1: Scan source tree
        List<Path> files;
        try {
            files = scanner.scanSourceFiles(request.sourceRoot(),
                    p -> findSource(p).isPresent() && !isExcluded(p, request.excludePatterns()));
        } catch (IOException e) {
            log.error("Failed to walk directory: {}", request.sourceRoot(), e);
            files = List.of();
        }
        log.info("Found {} source files", files.size());

        // Step 2: Parse and break down each file
        List<FileOutcome> outcomes = runAll(files);

        // Build result
        int succeeded = (int) outcomes.stream().filter(FileOutcome::isSuccess).count();
        int classes = outcomes.stream()
                .filter(FileOutcome::isSuccess)
                .mapToInt(o -> o.result().classBreakdowns().size())
                .sum();
        int controls = outcomes.stream()
                .filter(FileOutcome::isSuccess)
                .mapToInt(o -> o.result().stats().controlCount())
                .sum();
        BatchStats stats = new BatchStats(
                files.size(),
                succeeded,
                outcomes.size() - succeeded,
                classes,
                controls,
                Duration.between(startTime, Instant.now()).toMillis());

        log.info("Breakdown complete: {}/{} files, {} classes, {} controls in {}ms",
                stats.filesSucceeded(), stats.filesScanned(), stats.classesFound(),
                stats.controlsFound(), stats.durationMs());
        return new BatchResult(List.copyOf(outcomes), stats);
    }

    private List<FileOutcome> runAll(List<Path> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(properties.getWorkerThreads(), files.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> process(file)));
            }
            List<FileOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(files.get(i), futures.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome await(Path file, Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileOutcome.failed(file, "Interrupted");
        } catch (ExecutionException e) {
            log.error("Unexpected failure for {}", file, e.getCause());
            return FileOutcome.failed(file, String.valueOf(e.getCause()));
        }
    }

    private FileOutcome process(Path file) {
        SyntaxTreeSource source = findSource(file).orElseThrow();
        try {
            Node.SourceFile tree = source.read(file);
            BreakdownResult result = engine.breakdown(tree);
            log.debug("{} via {}: {} classes", file, source.getName(), result.classBreakdowns().size());
            return FileOutcome.success(file, result);
        } catch (BreakdownException e) {
            log.warn("Failed to break down {}: {}", file, e.getMessage());
            return FileOutcome.failed(file, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error breaking down {}", file, e);
            return FileOutcome.failed(file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Optional<SyntaxTreeSource> findSource(Path file) {
        return treeSources.stream()
                .filter(s -> s.supports(file))
                .findFirst();
    }

    private boolean isExcluded(Path path, List<String> patterns) {
        String pathStr = path.toString();
        return patterns.stream().anyMatch(pathStr::contains);
    }
}
