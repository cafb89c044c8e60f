package com.vidnyan.breakdown.adapter.in.cli;

import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchRequest;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchResult;
import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.FileOutcome;
import com.vidnyan.breakdown.application.port.out.BreakdownExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs a batch breakdown on startup and exports the IR.
 * Only active when breakdown.run.path is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BreakdownCliRunner implements CommandLineRunner {

    private final BreakdownUseCase breakdownUseCase;
    private final BreakdownExporter exporter;
    private final BreakdownProperties properties;

    @Override
    public void run(String... args) throws IOException {
        BreakdownProperties.Run run = properties.getRun();
        if (run.getPath() == null || run.getPath().isBlank()) {
            log.info("No source path specified. Set breakdown.run.path property.");
            return;
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Breaking down: {}", run.getPath());
        log.info("═══════════════════════════════════════════════════════════════");

        BatchResult result = breakdownUseCase.breakdownSources(
                new BatchRequest(Path.of(run.getPath()), run.getExclude()));
        printResults(result);

        Path output = Path.of(run.getOutput());
        exporter.export(result, output);
        log.info("IR written to {}", output.toAbsolutePath());
    }

    private void printResults(BatchResult result) {
        log.info(" Files scanned:   {}", result.stats().filesScanned());
        log.info(" Files succeeded: {}", result.stats().filesSucceeded());
        log.info(" Files failed:    {}", result.stats().filesFailed());
        log.info(" Classes:         {}", result.stats().classesFound());
        log.info(" UI controls:     {}", result.stats().controlsFound());
        log.info(" Duration:        {}ms", result.stats().durationMs());

        for (FileOutcome failure : result.failures()) {
            log.warn(" Failed {}: {}", failure.file(), failure.errorMessage());
        }
    }
}
