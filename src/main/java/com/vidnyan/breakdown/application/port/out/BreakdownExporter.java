package com.vidnyan.breakdown.application.port.out;

import com.vidnyan.breakdown.application.port.in.BreakdownUseCase.BatchResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for handing breakdown results to the downstream test generator.
 */
public interface BreakdownExporter {

    /**
     * Write a batch result to {@code target}.
     */
    void export(BatchResult result, Path target) throws IOException;
}
