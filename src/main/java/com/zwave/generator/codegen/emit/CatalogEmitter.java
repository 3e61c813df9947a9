package com.zwave.generator.codegen.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.codegen.exception.GenerationException;
import com.zwave.generator.codegen.model.catalog.Catalog;
import com.zwave.generator.codegen.model.catalog.CommandClassEntry;
import com.zwave.generator.codegen.model.catalog.CommandEntry;
import com.zwave.generator.codegen.model.output.GeneratedFile;
import com.zwave.generator.codegen.model.output.GeneratedFileType;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a resolved catalog into source artifacts for one output profile.
 *
 * Produces the command class index first, then one command enumeration per
 * command class that has commands, in catalog (display name) order. Bundled
 * profiles concatenate the same sections into a single artifact.
 *
 * Two command classes whose names map to the same type name or file name
 * cannot both be emitted; the first in catalog order wins and the other is
 * skipped with a warning.
 *
 * Nothing is written here; callers decide where the artifacts go.
 */
public class CatalogEmitter {
    private static final Logger log = LoggerFactory.getLogger(CatalogEmitter.class);

    private final Configuration freemarkerConfig;
    private final String javaPackage;

    public CatalogEmitter(String javaPackage) {
        this.javaPackage = Objects.requireNonNull(javaPackage, "javaPackage");
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public List<GeneratedFile> emit(Catalog catalog, OutputProfile profile) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(profile, "profile");

        Path directory = profile.artifactDirectory(javaPackage);
        String index = render(profile.indexTemplate(), indexModel(catalog));

        List<CommandClassEntry> withCommands = distinctTypeNames(catalog.getCommandClassesWithCommands(), profile);
        List<GeneratedFile> files = new ArrayList<>();

        if (profile.isBundled()) {
            StringBuilder bundle = new StringBuilder(index);
            for (CommandClassEntry entry : withCommands) {
                bundle.append('\n').append(render(profile.commandsTemplate(), commandsModel(entry, profile)));
            }
            files.add(file(directory.resolve(profile.indexFileName()), bundle.toString(), GeneratedFileType.BUNDLE));
        } else {
            Path indexPath = directory.resolve(profile.indexFileName());
            Set<Path> paths = new HashSet<>();
            paths.add(indexPath);
            files.add(file(indexPath, index, GeneratedFileType.COMMAND_CLASS_INDEX));
            for (CommandClassEntry entry : withCommands) {
                Path path = directory.resolve(profile.commandFileName(entry.getShortName()));
                if (!paths.add(path)) {
                    log.warn("Skipping commands of {} ({}): {} is already emitted",
                            entry.getDisplayName(), entry.getCode(), path);
                    continue;
                }
                files.add(file(path,
                        render(profile.commandsTemplate(), commandsModel(entry, profile)),
                        GeneratedFileType.COMMAND_ENUMERATION));
            }
        }

        log.debug("Rendered {} artifacts for {} command classes ({} with commands) using {}",
                files.size(), catalog.size(), withCommands.size(), profile);
        return files;
    }

    private static List<CommandClassEntry> distinctTypeNames(List<CommandClassEntry> entries, OutputProfile profile) {
        Set<String> typeNames = new HashSet<>();
        List<CommandClassEntry> result = new ArrayList<>();
        for (CommandClassEntry entry : entries) {
            String typeName = OutputProfile.commandTypeName(entry.getShortName());
            if (typeNames.add(typeName)) {
                result.add(entry);
            } else {
                log.warn("Skipping commands of {} ({}): type {} is already emitted for {}",
                        entry.getDisplayName(), entry.getCode(), typeName, profile);
            }
        }
        return result;
    }

    private Map<String, Object> indexModel(Catalog catalog) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (CommandClassEntry entry : catalog.getCommandClasses()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("name", entry.getDisplayName());
            e.put("hex", entry.getCode().toHex());
            e.put("version", entry.getVersion());
            entries.add(e);
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("packageName", javaPackage);
        model.put("typeName", OutputProfile.INDEX_TYPE_NAME);
        model.put("entries", entries);
        model.put("reverseEntries", firstPerCode(entries));
        return model;
    }

    private Map<String, Object> commandsModel(CommandClassEntry entry, OutputProfile profile) {
        Set<String> names = new HashSet<>();
        List<Map<String, Object>> commands = new ArrayList<>();
        for (CommandEntry command : entry.getCommands()) {
            if (profile.requiresUniqueConstantNames() && !names.add(command.getDisplayName())) {
                log.warn("Dropping duplicate constant {} ({}) from {} commands",
                        command.getDisplayName(), command.getCode(), entry.getDisplayName());
                continue;
            }
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("name", command.getDisplayName());
            c.put("hex", command.getCode().toHex());
            commands.add(c);
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("packageName", javaPackage);
        model.put("typeName", OutputProfile.commandTypeName(entry.getShortName()));
        model.put("commandClassName", entry.getDisplayName());
        model.put("commandClassHex", entry.getCode().toHex());
        model.put("version", entry.getVersion());
        model.put("entries", commands);
        model.put("reverseEntries", firstPerCode(commands));
        return model;
    }

    /** First entry for each code, in order; the reverse lookup of every profile keeps the first. */
    private static List<Map<String, Object>> firstPerCode(List<Map<String, Object>> entries) {
        Set<Object> codes = new HashSet<>();
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> e : entries) {
            if (codes.add(e.get("hex"))) {
                result.add(e);
            }
        }
        return result;
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
    }

    private static GeneratedFile file(Path path, String contents, GeneratedFileType type) {
        return GeneratedFile.builder()
                .path(path)
                .contents(contents)
                .type(type)
                .build();
    }
}
