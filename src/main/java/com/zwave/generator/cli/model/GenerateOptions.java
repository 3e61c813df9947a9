package com.zwave.generator.cli.model;

import java.nio.file.Path;

import com.zwave.generator.codegen.emit.OutputProfile;
import com.zwave.generator.codegen.model.core.context.GeneratorConfig;
import com.zwave.generator.codegen.naming.IdentifierStyle;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input", "-i" }, defaultValue = "./input/ZWave_custom_cmd_classes.xml",
			description = "XML command class document (default: ${DEFAULT-VALUE})")
	private Path inputPath;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "./output",
			description = "Output directory; its contents are replaced (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--profile", "-p" }, defaultValue = "JAVA_ENUM",
			description = "Output profile: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private OutputProfile profile;

	@Option(names = { "--identifier-style", "-s" },
			description = "Identifier style: ${COMPLETION-CANDIDATES} (default: depends on profile)")
	private IdentifierStyle identifierStyle;

	@Option(names = { "--package" }, defaultValue = GeneratorConfig.DEFAULT_JAVA_PACKAGE,
			description = "Java package for the JAVA_ENUM profile (default: ${DEFAULT-VALUE})")
	private String javaPackage;

	@Option(names = { "--force", "-f" }, description = "Clear a non-empty output directory")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Resolve and render without writing any file")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
