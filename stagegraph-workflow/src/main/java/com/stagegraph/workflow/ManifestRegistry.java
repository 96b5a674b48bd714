package com.stagegraph.workflow;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.ManifestHeader;
import com.stagegraph.definition.parser.DefinitionException;
import com.stagegraph.definition.parser.DefinitionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Workflow manifests and scripts found in one directory. A manifest {@code <id>.manifest.yaml}
 * defines workflow {@code <id>}; a script {@code <name>.script.yaml} overlays the manifest its
 * {@code manifest} field names (by id, or by file name). The directory is rescanned on every call.
 */
public final class ManifestRegistry {

    private static final Logger log = LoggerFactory.getLogger(ManifestRegistry.class);

    static final String MANIFEST_SUFFIX = ".manifest.yaml";
    static final String SCRIPT_SUFFIX = ".script.yaml";

    private final Path manifestDir;
    private final DefinitionParser parser;

    public ManifestRegistry(Path manifestDir, DefinitionParser parser) {
        this.manifestDir = Objects.requireNonNull(manifestDir, "manifestDir");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public Path getManifestDir() {
        return manifestDir;
    }

    /** Workflow ids, sorted. Empty when the directory does not exist. */
    public List<String> listWorkflowIds() {
        return listBySuffix(MANIFEST_SUFFIX);
    }

    /** Script names, sorted. */
    public List<String> listScriptNames() {
        return listBySuffix(SCRIPT_SUFFIX);
    }

    /**
     * Parses the manifest of {@code workflowId}.
     *
     * @throws IllegalArgumentException if there is no such workflow
     * @throws DefinitionException      if the manifest is invalid
     */
    public GraphDefinition load(String workflowId) {
        Path file = manifestDir.resolve(workflowId + MANIFEST_SUFFIX);
        if (!listWorkflowIds().contains(workflowId)) {
            throw new IllegalArgumentException("Workflow '" + workflowId + "' not found. Available: "
                    + String.join(", ", listWorkflowIds()));
        }
        GraphDefinition definition = parser.parseManifest(read(file));
        log.info("Loaded workflow id={} stages={} from {}", workflowId, definition.size(), file);
        return definition;
    }

    /**
     * Parses script {@code scriptName} over the manifest it references.
     *
     * @throws IllegalArgumentException if the script or its manifest does not exist
     * @throws DefinitionException      if either document is invalid or the script names an unknown stage
     */
    public GraphDefinition loadScript(String scriptName) {
        if (!listScriptNames().contains(scriptName)) {
            throw new IllegalArgumentException("Script '" + scriptName + "' not found. Available: "
                    + String.join(", ", listScriptNames()));
        }
        String text = read(manifestDir.resolve(scriptName + SCRIPT_SUFFIX));
        String workflowId = manifestIdOf(parser.scriptManifestReference(text));
        GraphDefinition script = parser.parseScript(text, load(workflowId));
        log.info("Loaded script name={} over workflow id={}", scriptName, workflowId);
        return script;
    }

    /** One summary per manifest that parses; broken manifests are logged and left out. */
    public List<WorkflowSummary> summarize() {
        List<WorkflowSummary> summaries = new ArrayList<>();
        for (String id : listWorkflowIds()) {
            try {
                GraphDefinition definition = load(id);
                ManifestHeader header = (ManifestHeader) definition.getHeader();
                summaries.add(new WorkflowSummary(id, header.getName(), header.getPersona(),
                        firstLine(header.getDescription()), definition.size()));
            } catch (DefinitionException | UncheckedIOException e) {
                log.warn("Skipping workflow id={} in summary: {}", id, e.getMessage());
            }
        }
        return summaries;
    }

    /** {@code fedml}, {@code fedml.manifest.yaml} and {@code path/to/fedml.manifest.yaml} all name {@code fedml}. */
    static String manifestIdOf(String reference) {
        String name = reference.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);
        if (name.endsWith(MANIFEST_SUFFIX)) return name.substring(0, name.length() - MANIFEST_SUFFIX.length());
        if (name.endsWith(".yaml")) return name.substring(0, name.length() - ".yaml".length());
        return name;
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    private List<String> listBySuffix(String suffix) {
        if (!Files.isDirectory(manifestDir)) {
            log.warn("Manifest directory {} does not exist", manifestDir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(manifestDir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(suffix))
                    .map(name -> name.substring(0, name.length() - suffix.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + manifestDir, e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
