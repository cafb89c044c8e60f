package com.vidnyan.breakdown.application.port.in;

import com.vidnyan.breakdown.domain.model.BreakdownResult;
import com.vidnyan.breakdown.domain.node.Node;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: break source files down into IR for test generation.
 */
public interface BreakdownUseCase {

    /**
     * Break down one already-parsed file.
     */
    BreakdownResult breakdown(Node.SourceFile file);

    /**
     * Scan a source tree, parse every supported file and break each one down.
     * A failing file is reported in its outcome and never stops the batch.
     */
    BatchResult breakdownSources(BatchRequest request);

    /**
     * Batch request parameters.
     */
    record BatchRequest(
        Path sourceRoot,
        List<String> excludePatterns
    ) {
        public static BatchRequest forPath(Path path) {
            return new BatchRequest(path, List.of());
        }
    }

    /**
     * Result for one file.
     */
    record FileOutcome(
        Path file,
        Status status,
        BreakdownResult result,
        String errorMessage
    ) {

        public enum Status {
            SUCCESS,
            FAILED
        }

        public static FileOutcome success(Path file, BreakdownResult result) {
            return new FileOutcome(file, Status.SUCCESS, result, null);
        }

        public static FileOutcome failed(Path file, String message) {
            return new FileOutcome(file, Status.FAILED, null, message);
        }

        public boolean isSuccess() {
            return status == Status.SUCCESS;
        }
    }

    /**
     * Outcomes in scan order.
     */
    record BatchResult(
        List<FileOutcome> outcomes,
        BatchStats stats
    ) {
        public List<BreakdownResult> results() {
            return outcomes.stream()
                    .filter(FileOutcome::isSuccess)
                    .map(FileOutcome::result)
                    .toList();
        }

        public List<FileOutcome> failures() {
            return outcomes.stream()
                    .filter(o -> !o.isSuccess())
                    .toList();
        }
    }

    record BatchStats(
        int filesScanned,
        int filesSucceeded,
        int filesFailed,
        int classesFound,
        int controlsFound,
        long durationMs
    ) {}
}
