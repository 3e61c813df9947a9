package com.zwave.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.codegen.catalog.CatalogBuilder;
import com.zwave.generator.codegen.catalog.CommandClassDocumentReader;
import com.zwave.generator.codegen.emit.CatalogEmitter;
import com.zwave.generator.codegen.exception.GenerationException;
import com.zwave.generator.codegen.model.catalog.Catalog;
import com.zwave.generator.codegen.model.core.context.GeneratorConfig;
import com.zwave.generator.codegen.model.core.context.IngestionStats;
import com.zwave.generator.codegen.model.output.GeneratedFile;
import com.zwave.generator.codegen.util.FileWriteUtil;

/**
 * Runs the whole pipeline: read the command class document, resolve the
 * catalog, render every artifact, then replace the output directory contents.
 *
 * Rendering completes before the output directory is touched, so a failure
 * while reading or rendering leaves the previous output in place.
 */
public class CatalogGenerator {
    private static final Logger log = LoggerFactory.getLogger(CatalogGenerator.class);

    private final GeneratorConfig config;
    private final CommandClassDocumentReader documentReader;
    private final CatalogEmitter emitter;

    public CatalogGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.documentReader = new CommandClassDocumentReader();
        this.emitter = new CatalogEmitter(config.getJavaPackage());
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting catalog generation...");

            // Step 1: Read and resolve command classes
            log.info("Step 1: Reading command classes from {}...", config.getInputPath());
            CatalogBuilder builder = new CatalogBuilder(config.getEffectiveIdentifierStyle());
            documentReader.read(config.getInputPath(), builder::accept);
            Catalog catalog = builder.build();
            IngestionStats stats = builder.getStats();
            log.info("Resolved {} command classes from {} nodes ({} skipped, {} superseded, {} stale)",
                    catalog.size(), stats.getNodesRead(), stats.getNodesSkipped(),
                    stats.getEntriesSuperseded(), stats.getNodesDiscardedAsStale());

            // Step 2: Render artifacts
            log.info("Step 2: Rendering {} artifacts...", config.getProfile());
            List<GeneratedFile> files = emitter.emit(catalog, config.getProfile());

            // Step 3: Write output
            if (config.isDryRun()) {
                log.info("Step 3: Dry run, skipping write of {} artifacts", files.size());
            } else {
                log.info("Step 3: Writing {} artifacts to {}...", files.size(), config.getOutputDir());
                writeArtifacts(config.getOutputDir(), files);
            }

            List<Path> artifactPaths = new ArrayList<>();
            for (GeneratedFile file : files) {
                artifactPaths.add(file.getPath());
            }

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .ingestionStats(stats)
                    .commandClassCount(catalog.size())
                    .commandCount(catalog.commandCount())
                    .artifacts(artifactPaths)
                    .dryRun(config.isDryRun())
                    .build();

        } catch (IOException e) {
            log.debug("I/O failure", e);
            return GeneratorResult.failure("I/O error: " + e.getMessage());
        } catch (GenerationException e) {
            log.debug("Generation failure", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private void writeArtifacts(Path outputDir, List<GeneratedFile> files) throws IOException {
        FileWriteUtil.clearDirectory(outputDir);
        for (GeneratedFile file : files) {
            Path target = outputDir.resolve(file.getPath());
            FileWriteUtil.safeWriteString(target, file.getContents());
            log.debug("Wrote {}", target);
        }
    }
}
