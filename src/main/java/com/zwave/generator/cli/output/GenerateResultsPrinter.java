package com.zwave.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.cli.model.GenerateOptions;
import com.zwave.generator.cli.model.ValidatedGenerateOptions;
import com.zwave.generator.codegen.GeneratorResult;
import com.zwave.generator.codegen.emit.OutputProfile;
import com.zwave.generator.codegen.model.core.context.IngestionStats;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Z-Wave Command Class Generator");
        log.info("=================================================");
        log.info("Input Document: {}", v.getNormalizedInputPath());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Profile: {}", o.getProfile());
        log.info("Identifier Style: {}", v.getIdentifierStyle());
        if (o.getProfile() == OutputProfile.JAVA_ENUM) {
            log.info("Java Package: {}", o.getJavaPackage());
        }
        if (o.isDryRun()) {
            log.info("Dry Run: nothing will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        Path outputDir = v.getNormalizedOutputDir();
        IngestionStats stats = result.getIngestionStats();

        log.info("");
        log.info("=================================================");
        log.info(result.isDryRun() ? "DRY RUN SUCCESSFUL" : "GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", outputDir);
        log.info("Command Classes: {}", result.getCommandClassCount());
        log.info("Commands: {}", result.getCommandCount());

        if (stats != null) {
            log.info("");
            log.info("Ingestion Summary:");
            log.info("  Nodes Read: {}", stats.getNodesRead());
            log.info("  Invalid Nodes Skipped: {}", stats.getNodesSkipped());
            log.info("  Older Versions Superseded: {}", stats.getEntriesSuperseded());
            log.info("  Stale Versions Discarded: {}", stats.getNodesDiscardedAsStale());
            if (stats.getNodesDiscardedForNameCollision() > 0) {
                log.info("  Name Collisions Discarded: {}", stats.getNodesDiscardedForNameCollision());
            }
        }

        log.info("");
        log.info("Artifacts ({}):", result.getArtifacts().size());
        for (Path artifact : result.getArtifacts()) {
            log.info("  {}", artifact);
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
