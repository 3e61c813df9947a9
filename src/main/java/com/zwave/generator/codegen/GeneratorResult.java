package com.zwave.generator.codegen;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

import com.zwave.generator.codegen.model.core.context.IngestionStats;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private IngestionStats ingestionStats;
    private int commandClassCount;
    private int commandCount;

    /** Artifact paths relative to the output directory, in write order. */
    private List<Path> artifacts;
    private boolean dryRun;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .artifacts(List.of())
                .build();
    }
}
