package com.zwave.generator.codegen.model.catalog;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One resolved version of a command class together with its commands.
 */
@Value
@Builder(toBuilder = true)
public class CommandClassEntry {

    /** e.g. {@code COMMAND_CLASS_SWITCH_BINARY} */
    @NonNull
    String rawName;

    /** Raw name without the {@code COMMAND_CLASS_} prefix, e.g. {@code SWITCH_BINARY}. */
    @NonNull
    String shortName;

    @NonNull
    CommandCode code;

    int version;

    /** Catalog key. */
    @NonNull
    String displayName;

    /** Document order, duplicates preserved. */
    @Singular
    List<CommandEntry> commands;

    public boolean hasCommands() {
        return !commands.isEmpty();
    }
}
