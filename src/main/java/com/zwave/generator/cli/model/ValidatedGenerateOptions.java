package com.zwave.generator.cli.model;

import java.nio.file.Path;

import com.zwave.generator.codegen.naming.IdentifierStyle;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedInputPath;
    Path normalizedOutputDir;
    IdentifierStyle identifierStyle;
}
