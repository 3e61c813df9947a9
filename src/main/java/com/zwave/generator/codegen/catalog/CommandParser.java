package com.zwave.generator.codegen.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.codegen.model.catalog.CommandCode;
import com.zwave.generator.codegen.model.catalog.CommandEntry;
import com.zwave.generator.codegen.model.input.MarkupNode;
import com.zwave.generator.codegen.naming.IdentifierStyle;
import com.zwave.generator.codegen.util.NamingUtil;

/**
 * Extracts the commands of one command class.
 *
 * Only {@code cmd} elements that are direct children of the command class
 * node are considered. Invalid commands are skipped; duplicates are kept.
 */
public class CommandParser {
    private static final Logger log = LoggerFactory.getLogger(CommandParser.class);

    public static final String COMMAND_ELEMENT = "cmd";

    private final IdentifierStyle style;

    public CommandParser(IdentifierStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    /**
     * @param commandClassShortName class name without {@code COMMAND_CLASS_}, e.g. {@code SWITCH_BINARY}
     * @param commandClassNode      the {@code cmd_class} node
     * @return commands in document order
     */
    public List<CommandEntry> parseCommands(String commandClassShortName, MarkupNode commandClassNode) {
        List<CommandEntry> commands = new ArrayList<>();

        for (MarkupNode node : commandClassNode.getChildren(COMMAND_ELEMENT)) {
            parseCommand(commandClassShortName, node).ifPresent(commands::add);
        }
        return commands;
    }

    private Optional<CommandEntry> parseCommand(String commandClassShortName, MarkupNode node) {
        String name = node.getAttribute("name").orElse(null);
        if (name == null) {
            log.debug("Skipping command of {}: missing name", commandClassShortName);
            return Optional.empty();
        }

        Optional<CommandCode> code = CommandCode.parseHex(node.getAttribute("key").orElse(null));
        if (code.isEmpty()) {
            log.debug("Skipping command {}: missing or invalid key '{}'", name, node.getAttribute("key").orElse(null));
            return Optional.empty();
        }

        // Commands whose name lacks the class prefix keep their full name
        String shortName = stripPrefix(commandClassShortName + "_", name).orElse(name);

        String displayName = style.normalize(shortName);
        if (!NamingUtil.isValidIdentifier(displayName)) {
            log.debug("Skipping command {}: '{}' is not a valid identifier", name, displayName);
            return Optional.empty();
        }

        return Optional.of(CommandEntry.builder()
                .rawName(name)
                .code(code.get())
                .displayName(displayName)
                .build());
    }

    static Optional<String> stripPrefix(String prefix, String name) {
        if (!name.startsWith(prefix)) {
            return Optional.empty();
        }
        return Optional.of(name.substring(prefix.length()));
    }
}
