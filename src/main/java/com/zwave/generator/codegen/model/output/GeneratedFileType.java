package com.zwave.generator.codegen.model.output;

/**
 * Categories of generated artifacts.
 */
public enum GeneratedFileType {
    COMMAND_CLASS_INDEX,
    COMMAND_ENUMERATION,
    BUNDLE
}
