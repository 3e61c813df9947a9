package com.zwave.generator.codegen.model.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single command of a command class.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class CommandEntry {

    /** Name as declared in the source document, e.g. {@code SWITCH_BINARY_SET}. */
    @NonNull
    String rawName;

    /** Code scoped to the owning command class. */
    @NonNull
    CommandCode code;

    /** Resolved identifier, e.g. {@code SET} or {@code Set}. */
    @NonNull
    String displayName;
}
