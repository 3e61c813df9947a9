package com.zwave.generator.codegen.catalog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.codegen.model.catalog.Catalog;
import com.zwave.generator.codegen.model.catalog.CommandClassEntry;
import com.zwave.generator.codegen.model.catalog.CommandCode;
import com.zwave.generator.codegen.model.catalog.CommandEntry;
import com.zwave.generator.codegen.model.core.context.IngestionStats;
import com.zwave.generator.codegen.model.input.MarkupNode;
import com.zwave.generator.codegen.naming.IdentifierStyle;
import com.zwave.generator.codegen.util.NamingUtil;

/**
 * Accumulates command class nodes in document order and resolves versions.
 *
 * Versions are tracked per numeric code, not per name, because a command
 * class may be renamed between revisions while its code stays the same:
 * <ul>
 *   <li>a node with a higher version than the one recorded for its code evicts
 *       the current entry (whatever its display name) and takes its place;</li>
 *   <li>a node with an equal or lower version is discarded with its commands;</li>
 *   <li>a node whose display name is already held by a different code is
 *       discarded, so display names stay unique.</li>
 * </ul>
 * Invalid nodes are skipped without failing the run.
 */
public class CatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    public static final String COMMAND_CLASS_PREFIX = "COMMAND_CLASS_";

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+");

    private final IdentifierStyle style;
    private final CommandParser commandParser;

    private final Map<String, CommandClassEntry> entriesByName = new TreeMap<>();
    private final Map<CommandCode, String> namesByCode = new HashMap<>();
    private final Map<CommandCode, Integer> versionsByCode = new HashMap<>();

    private int nodesRead;
    private int nodesSkipped;
    private int entriesSuperseded;
    private int nodesDiscardedAsStale;
    private int nodesDiscardedForNameCollision;

    public CatalogBuilder(IdentifierStyle style) {
        this.style = Objects.requireNonNull(style, "style");
        this.commandParser = new CommandParser(style);
    }

    /** Builds a catalog from nodes already in memory. */
    public static Catalog ingest(Iterable<MarkupNode> commandClassNodes, IdentifierStyle style) {
        CatalogBuilder builder = new CatalogBuilder(style);
        for (MarkupNode node : commandClassNodes) {
            builder.accept(node);
        }
        return builder.build();
    }

    /**
     * Processes the next command class node.
     */
    public CatalogBuilder accept(MarkupNode node) {
        nodesRead++;

        Optional<CandidateClass> candidate = validate(node);
        if (candidate.isEmpty()) {
            nodesSkipped++;
            return this;
        }
        CandidateClass c = candidate.get();

        Integer priorVersion = versionsByCode.get(c.code);
        if (priorVersion != null && c.version <= priorVersion) {
            nodesDiscardedAsStale++;
            log.debug("Discarding {} version {}: version {} already recorded for {}",
                    c.rawName, c.version, priorVersion, c.code);
            return this;
        }

        CommandClassEntry holder = entriesByName.get(c.displayName);
        if (holder != null && !holder.getCode().equals(c.code)) {
            nodesDiscardedForNameCollision++;
            log.warn("Discarding {} ({}): name '{}' is already used by {} ({})",
                    c.rawName, c.code, c.displayName, holder.getRawName(), holder.getCode());
            return this;
        }

        if (priorVersion != null) {
            evict(c.code);
        }

        List<CommandEntry> commands = commandParser.parseCommands(c.shortName, node);
        CommandClassEntry entry = CommandClassEntry.builder()
                .rawName(c.rawName)
                .shortName(c.shortName)
                .code(c.code)
                .version(c.version)
                .displayName(c.displayName)
                .commands(commands)
                .build();

        entriesByName.put(c.displayName, entry);
        namesByCode.put(c.code, c.displayName);
        versionsByCode.put(c.code, c.version);
        log.debug("Recorded {} as '{}' version {} with {} commands",
                c.code, c.displayName, c.version, commands.size());
        return this;
    }

    /** Snapshot of the catalog accumulated so far. */
    public Catalog build() {
        return new Catalog(entriesByName, versionsByCode);
    }

    public IngestionStats getStats() {
        return IngestionStats.builder()
                .nodesRead(nodesRead)
                .nodesSkipped(nodesSkipped)
                .entriesSuperseded(entriesSuperseded)
                .nodesDiscardedAsStale(nodesDiscardedAsStale)
                .nodesDiscardedForNameCollision(nodesDiscardedForNameCollision)
                .build();
    }

    private void evict(CommandCode code) {
        String previousName = namesByCode.remove(code);
        CommandClassEntry previous = previousName == null ? null : entriesByName.remove(previousName);
        Integer previousVersion = versionsByCode.remove(code);
        entriesSuperseded++;
        if (previous != null) {
            log.debug("Superseded '{}' version {} ({})", previousName, previousVersion, code);
        }
    }

    private Optional<CandidateClass> validate(MarkupNode node) {
        String name = node.getAttribute("name").orElse(null);
        if (name == null) {
            log.debug("Skipping command class: missing name");
            return Optional.empty();
        }

        String key = node.getAttribute("key").orElse(null);
        Optional<CommandCode> code = CommandCode.parseHex(key);
        if (code.isEmpty()) {
            log.debug("Skipping command class {}: missing or invalid key '{}'", name, key);
            return Optional.empty();
        }

        String rawVersion = node.getAttribute("version").orElse(null);
        Optional<Integer> version = parseVersion(rawVersion);
        if (version.isEmpty()) {
            log.debug("Skipping command class {}: missing or invalid version '{}'", name, rawVersion);
            return Optional.empty();
        }

        Optional<String> shortName = CommandParser.stripPrefix(COMMAND_CLASS_PREFIX, name);
        if (shortName.isEmpty()) {
            log.debug("Skipping command class {}: name does not start with {}", name, COMMAND_CLASS_PREFIX);
            return Optional.empty();
        }

        String displayName = style.normalize(shortName.get());
        if (!NamingUtil.isValidIdentifier(displayName)) {
            log.debug("Skipping command class {}: '{}' is not a valid identifier", name, displayName);
            return Optional.empty();
        }

        return Optional.of(new CandidateClass(name, shortName.get(), code.get(), version.get(), displayName));
    }

    static Optional<Integer> parseVersion(String raw) {
        if (raw == null || !VERSION_PATTERN.matcher(raw).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return Optional.empty();
        }
    }

    private static final class CandidateClass {
        final String rawName;
        final String shortName;
        final CommandCode code;
        final int version;
        final String displayName;

        CandidateClass(String rawName, String shortName, CommandCode code, int version, String displayName) {
            this.rawName = rawName;
            this.shortName = shortName;
            this.code = code;
            this.version = version;
            this.displayName = displayName;
        }
    }
}
