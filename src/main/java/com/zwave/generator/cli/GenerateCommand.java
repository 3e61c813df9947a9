package com.zwave.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.cli.exception.OptionsValidationException;
import com.zwave.generator.cli.model.GenerateOptions;
import com.zwave.generator.cli.model.ValidatedGenerateOptions;
import com.zwave.generator.cli.output.GenerateResultsPrinter;
import com.zwave.generator.cli.validation.GenerateOptionsValidator;
import com.zwave.generator.codegen.CatalogGenerator;
import com.zwave.generator.codegen.GeneratorResult;
import com.zwave.generator.codegen.model.core.context.GeneratorConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating command class enumerations from the Z-Wave XML catalog.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "zwave-command-class-gen 1.0.0",
        description = "Generates command class and command enumerations from a Z-Wave command class XML document."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    private static final String LOGGER_ROOT_PACKAGE = "com.zwave.generator";

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return EXIT_INVALID_OPTIONS;
        }

        try {
            printer.printBanner(options, validated);

            GeneratorConfig config = GeneratorConfig.builder()
                    .inputPath(validated.getNormalizedInputPath())
                    .outputDir(validated.getNormalizedOutputDir())
                    .profile(options.getProfile())
                    .identifierStyle(validated.getIdentifierStyle())
                    .javaPackage(options.getJavaPackage())
                    .dryRun(options.isDryRun())
                    .build();

            GeneratorResult result = new CatalogGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILURE;
            }

            printer.printSuccess(validated, result);
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_ROOT_PACKAGE);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }
}
