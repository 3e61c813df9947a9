package com.zwave.generator.codegen.emit;

import java.nio.file.Path;

import com.zwave.generator.codegen.naming.IdentifierStyle;
import com.zwave.generator.codegen.util.NamingUtil;

/**
 * Target language profiles. Selected once per run; each profile owns its
 * templates, file layout and default identifier style.
 */
public enum OutputProfile {

    /** Closed Java enums with {@code getCode()}, {@code fromCode(int)} and {@code findByCode(int)}. */
    JAVA_ENUM(IdentifierStyle.VERBATIM, "java", false) {
        @Override
        public Path artifactDirectory(String javaPackage) {
            return Path.of(javaPackage.replace('.', '/'));
        }

        @Override
        public String indexFileName() {
            return INDEX_TYPE_NAME + ".java";
        }

        @Override
        public String commandFileName(String shortName) {
            return commandTypeName(shortName) + ".java";
        }

        @Override
        public boolean requiresUniqueConstantNames() {
            return true;
        }
    },

    /** Frozen object literals with a reverse lookup map, one CommonJS module per artifact. */
    JAVASCRIPT(IdentifierStyle.UPPER_CAMEL, "javascript", false) {
        @Override
        public String indexFileName() {
            return "command_class.js";
        }

        @Override
        public String commandFileName(String shortName) {
            return NamingUtil.toLowerSnakeCase(shortName) + "_command.js";
        }
    },

    /** Same syntax as {@link #JAVASCRIPT}, all sections in a single module. */
    JAVASCRIPT_BUNDLE(IdentifierStyle.UPPER_CAMEL, "javascript", true) {
        @Override
        public String indexFileName() {
            return "zwave_command_classes.js";
        }

        @Override
        public String commandFileName(String shortName) {
            throw new UnsupportedOperationException("Bundled profile writes a single file");
        }
    };

    public static final String INDEX_TYPE_NAME = "CommandClass";

    private final IdentifierStyle defaultIdentifierStyle;
    private final String templateDirectory;
    private final boolean bundled;

    OutputProfile(IdentifierStyle defaultIdentifierStyle, String templateDirectory, boolean bundled) {
        this.defaultIdentifierStyle = defaultIdentifierStyle;
        this.templateDirectory = templateDirectory;
        this.bundled = bundled;
    }

    public IdentifierStyle getDefaultIdentifierStyle() {
        return defaultIdentifierStyle;
    }

    public boolean isBundled() {
        return bundled;
    }

    /** True if a repeated constant name would not compile in the target language. */
    public boolean requiresUniqueConstantNames() {
        return false;
    }

    public String indexTemplate() {
        return templateDirectory + "/command-class.ftl";
    }

    public String commandsTemplate() {
        return templateDirectory + "/commands.ftl";
    }

    /** Directory of every artifact, relative to the output directory. */
    public Path artifactDirectory(String javaPackage) {
        return Path.of("");
    }

    public abstract String indexFileName();

    public abstract String commandFileName(String shortName);

    /** e.g. {@code SWITCH_BINARY} to {@code SwitchBinaryCommand}, whatever the identifier style. */
    public static String commandTypeName(String shortName) {
        return NamingUtil.toUpperCamelCase(shortName) + "Command";
    }
}
