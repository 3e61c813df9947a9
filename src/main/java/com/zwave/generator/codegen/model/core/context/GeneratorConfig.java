package com.zwave.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

import com.zwave.generator.codegen.emit.OutputProfile;
import com.zwave.generator.codegen.naming.IdentifierStyle;

/**
 * Configuration for a generation run.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final String DEFAULT_JAVA_PACKAGE = "com.zwave.commandclass";

    /**
     * XML command class document.
     */
    private Path inputPath;

    /**
     * Destination directory. Its previous contents are deleted.
     */
    private Path outputDir;

    /**
     * Target language profile.
     */
    @Builder.Default
    private OutputProfile profile = OutputProfile.JAVA_ENUM;

    /**
     * Casing policy; {@code null} means the profile default.
     */
    private IdentifierStyle identifierStyle;

    /**
     * Package of generated Java enums.
     */
    @Builder.Default
    private String javaPackage = DEFAULT_JAVA_PACKAGE;

    /**
     * Whether this is a dry run (nothing written).
     */
    private boolean dryRun;

    /**
     * Returns the configured identifier style, falling back to the profile default.
     *
     * @return the effective identifier style
     */
    public IdentifierStyle getEffectiveIdentifierStyle() {
        return identifierStyle != null ? identifierStyle : profile.getDefaultIdentifierStyle();
    }
}
