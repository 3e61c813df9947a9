package com.zwave.generator.codegen.catalog;

import com.zwave.generator.codegen.model.catalog.CommandCode;
import com.zwave.generator.codegen.model.catalog.CommandEntry;
import com.zwave.generator.codegen.model.input.MarkupNode;
import com.zwave.generator.codegen.naming.IdentifierStyle;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CommandParser.
 */
class CommandParserTest {

    private final CommandParser camelParser = new CommandParser(IdentifierStyle.UPPER_CAMEL);
    private final CommandParser verbatimParser = new CommandParser(IdentifierStyle.VERBATIM);

    @Test
    void testStripsCommandClassPrefix() {
        MarkupNode node = commandClass(
                cmd("SWITCH_BINARY_SET", "0x01"),
                cmd("SWITCH_BINARY_GET", "0x02"),
                cmd("SWITCH_BINARY_REPORT", "0x03"));

        List<CommandEntry> commands = camelParser.parseCommands("SWITCH_BINARY", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("Set", "Get", "Report");
        assertThat(commands).extracting(CommandEntry::getCode)
                .containsExactly(CommandCode.of(1), CommandCode.of(2), CommandCode.of(3));
        assertThat(commands.get(0).getRawName()).isEqualTo("SWITCH_BINARY_SET");
    }

    @Test
    void testVerbatimKeepsShortName() {
        MarkupNode node = commandClass(cmd("SWITCH_BINARY_SET", "0x01"));

        List<CommandEntry> commands = verbatimParser.parseCommands("SWITCH_BINARY", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("SET");
    }

    @Test
    void testFallsBackToFullNameWhenPrefixDoesNotMatch() {
        MarkupNode node = commandClass(cmd("MULTI_INSTANCE_GET", "0x04"));

        List<CommandEntry> commands = verbatimParser.parseCommands("MULTI_CHANNEL", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("MULTI_INSTANCE_GET");
    }

    @Test
    void testPrefixWithoutSeparatorIsNotStripped() {
        MarkupNode node = commandClass(cmd("BASICSET", "0x01"));

        List<CommandEntry> commands = camelParser.parseCommands("BASIC", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("Basicset");
    }

    @Test
    void testSkipsInvalidCommands() {
        MarkupNode node = commandClass(
                MarkupNode.builder().elementName("cmd").attribute("key", "0x01").build(),
                MarkupNode.builder().elementName("cmd").attribute("name", "BASIC_GET").build(),
                cmd("BASIC_REPORT", "0xZZ"),
                cmd("BASIC_SET", "01"),
                cmd("BASIC_BIG", "0x100"),
                cmd("BASIC_", "0x05"),
                cmd("BASIC_6X", "0x06"),
                cmd("BASIC_OK", "0x07"));

        List<CommandEntry> commands = verbatimParser.parseCommands("BASIC", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("OK");
    }

    @Test
    void testSkipsCommandNamedUnderscore() {
        MarkupNode node = commandClass(
                cmd("BASIC__", "0x01"),
                cmd("BASIC_SET", "0x02"));

        List<CommandEntry> commands = verbatimParser.parseCommands("BASIC", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("SET");
    }

    @Test
    void testKeepsDuplicatesInDocumentOrder() {
        MarkupNode node = commandClass(
                cmd("BASIC_SET", "0x01"),
                cmd("BASIC_SET", "0x01"),
                cmd("BASIC_GET", "0x01"));

        List<CommandEntry> commands = camelParser.parseCommands("BASIC", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("Set", "Set", "Get");
    }

    @Test
    void testIgnoresNestedCommandElements() {
        MarkupNode param = MarkupNode.builder()
                .elementName("param")
                .child(cmd("BASIC_NESTED", "0x09"))
                .build();
        MarkupNode node = commandClass(
                MarkupNode.builder()
                        .elementName("cmd")
                        .attribute("name", "BASIC_SET")
                        .attribute("key", "0x01")
                        .child(param)
                        .child(cmd("BASIC_INNER", "0x0A"))
                        .build());

        List<CommandEntry> commands = verbatimParser.parseCommands("BASIC", node);

        assertThat(commands).extracting(CommandEntry::getDisplayName).containsExactly("SET");
    }

    @Test
    void testNoCommands() {
        assertThat(camelParser.parseCommands("BASIC", commandClass())).isEmpty();
    }

    private static MarkupNode commandClass(MarkupNode... commands) {
        return MarkupNode.builder()
                .elementName("cmd_class")
                .children(List.of(commands))
                .build();
    }

    private static MarkupNode cmd(String name, String key) {
        return MarkupNode.builder()
                .elementName("cmd")
                .attribute("name", name)
                .attribute("key", key)
                .build();
    }
}
