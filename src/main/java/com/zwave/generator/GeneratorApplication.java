package com.zwave.generator;

import com.zwave.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Z-Wave Command Class Generator.
 * This CLI tool reads the Z-Wave command class XML catalog, keeps the newest
 * version of every command class and emits Java or JavaScript enumerations.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
