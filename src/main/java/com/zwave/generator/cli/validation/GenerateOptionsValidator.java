package com.zwave.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.zwave.generator.cli.exception.OptionsValidationException;
import com.zwave.generator.cli.model.GenerateOptions;
import com.zwave.generator.cli.model.ValidatedGenerateOptions;
import com.zwave.generator.codegen.emit.OutputProfile;
import com.zwave.generator.codegen.naming.IdentifierStyle;
import com.zwave.generator.codegen.util.FileWriteUtil;
import com.zwave.generator.codegen.util.NamingUtil;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = null;
		if (o.getInputPath() == null) {
			errors.add("Input document is required (--input / -i).");
		} else {
			input = o.getInputPath().toAbsolutePath().normalize();
			if (!Files.exists(input)) {
				errors.add("Input document does not exist: " + input);
			} else if (!Files.isRegularFile(input)) {
				errors.add("Input document is not a regular file: " + input);
			}
		}

		Path output = null;
		if (o.getOutputDir() == null) {
			errors.add("Output directory is required (--output-dir / -o).");
		} else {
			output = o.getOutputDir().toAbsolutePath().normalize();
			validateOutputDir(o, input, output, errors);
		}

		if (o.getProfile() == null) {
			errors.add("Output profile is required (--profile / -p).");
		} else if (o.getProfile() == OutputProfile.JAVA_ENUM && !NamingUtil.isValidPackageName(o.getJavaPackage())) {
			errors.add("Invalid Java package name: " + o.getJavaPackage());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		IdentifierStyle style = o.getIdentifierStyle() != null
				? o.getIdentifierStyle()
				: o.getProfile().getDefaultIdentifierStyle();

		return new ValidatedGenerateOptions(input, output, style);
	}

	private static void validateOutputDir(GenerateOptions o, Path input, Path output, List<String> errors) {
		if (Files.exists(output) && !Files.isDirectory(output)) {
			errors.add("Output path exists and is not a directory: " + output);
			return;
		}
		if (output.getParent() == null) {
			errors.add("Refusing to clear a file system root: " + output);
			return;
		}
		// The output directory is wiped before writing
		if (input != null && input.startsWith(output)) {
			errors.add("Output directory must not contain the input document: " + output);
		}
		if (!o.isForce() && !o.isDryRun()) {
			try {
				if (FileWriteUtil.isNonEmptyDirectory(output)) {
					errors.add("Output directory is not empty: " + output + ". Use --force to clear it.");
				}
			} catch (IOException e) {
				errors.add("Cannot inspect output directory " + output + ": " + e.getMessage());
			}
		}
	}
}
