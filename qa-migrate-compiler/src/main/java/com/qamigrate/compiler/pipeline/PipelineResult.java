package com.qamigrate.compiler.pipeline;

import com.qamigrate.compiler.extraction.ExtractionResult;
import com.qamigrate.compiler.ir.IrModel.IrDocument;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one compiler run: the assembled IR plus the per-file extraction results,
 * in processing order.
 */
public record PipelineResult(
    IrDocument document,
    List<ExtractionResult> extractions,
    List<Path> sourceFiles
) {
    public PipelineResult {
        extractions = List.copyOf(extractions);
        sourceFiles = List.copyOf(sourceFiles);
    }
}
