package com.zwave.generator.codegen.model.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Resolved, immutable command class catalog.
 *
 * Entries are ordered lexicographically by display name. The version tracker
 * holds the surviving version of every code in the catalog.
 */
public final class Catalog {

    private final SortedMap<String, CommandClassEntry> entriesByName;
    private final Map<CommandCode, String> namesByCode;
    private final Map<CommandCode, Integer> versionsByCode;

    public Catalog(Map<String, CommandClassEntry> entriesByName, Map<CommandCode, Integer> versionsByCode) {
        SortedMap<String, CommandClassEntry> sorted = new TreeMap<>(entriesByName);
        Map<CommandCode, String> byCode = new HashMap<>();
        for (CommandClassEntry entry : sorted.values()) {
            byCode.put(entry.getCode(), entry.getDisplayName());
        }
        this.entriesByName = Collections.unmodifiableSortedMap(sorted);
        this.namesByCode = Collections.unmodifiableMap(byCode);
        this.versionsByCode = Collections.unmodifiableMap(new HashMap<>(versionsByCode));
    }

    public static Catalog empty() {
        return new Catalog(Map.of(), Map.of());
    }

    /** Command classes in display-name order. */
    public List<CommandClassEntry> getCommandClasses() {
        return List.copyOf(entriesByName.values());
    }

    /** Command classes that declare at least one command, in display-name order. */
    public List<CommandClassEntry> getCommandClassesWithCommands() {
        List<CommandClassEntry> result = new ArrayList<>();
        for (CommandClassEntry entry : entriesByName.values()) {
            if (entry.hasCommands()) {
                result.add(entry);
            }
        }
        return result;
    }

    public Optional<CommandClassEntry> find(String displayName) {
        if (displayName == null) return Optional.empty();
        return Optional.ofNullable(entriesByName.get(displayName));
    }

    public Optional<CommandClassEntry> findByCode(CommandCode code) {
        String name = namesByCode.get(code);
        return name == null ? Optional.empty() : find(name);
    }

    public OptionalInt versionOf(CommandCode code) {
        Integer version = versionsByCode.get(code);
        return version == null ? OptionalInt.empty() : OptionalInt.of(version);
    }

    public int size() {
        return entriesByName.size();
    }

    public boolean isEmpty() {
        return entriesByName.isEmpty();
    }

    /** Total number of commands across all command classes. */
    public int commandCount() {
        int count = 0;
        for (CommandClassEntry entry : entriesByName.values()) {
            count += entry.getCommands().size();
        }
        return count;
    }
}
