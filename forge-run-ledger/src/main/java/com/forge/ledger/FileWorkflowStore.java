package com.forge.ledger;

import com.forge.graph.WorkflowGraphConfig;
import com.forge.graph.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads workflows from {@code <dir>/<workflowId>.json}. The file's {@code id} may be omitted; the
 * file name is then used. Ids containing path separators are treated as not found.
 */
public final class FileWorkflowStore implements WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(FileWorkflowStore.class);

    private final Path directory;

    public FileWorkflowStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        if (workflowId == null || workflowId.isBlank() || workflowId.contains("/") || workflowId.contains("\\")
                || workflowId.contains("..")) {
            return Optional.empty();
        }
        Path file = directory.resolve(workflowId + ".json");
        if (!Files.isRegularFile(file)) {
            log.debug("Workflow file not found | workflowId={} | path={}", workflowId, file);
            return Optional.empty();
        }
        try {
            Workflow parsed = WorkflowGraphConfig.fromJson(Files.readString(file, StandardCharsets.UTF_8));
            if (parsed.getId() == null || parsed.getId().isBlank()) {
                parsed = new Workflow(workflowId, parsed.getName(), parsed.getDefinition());
            }
            log.info("Loaded workflow from file | workflowId={} | path={} | nodes={} | edges={}", workflowId, file,
                    parsed.getDefinition().getNodes().size(), parsed.getDefinition().getEdges().size());
            return Optional.of(parsed);
        } catch (IOException | UncheckedIOException e) {
            throw new PersistenceException("findWorkflow", "cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
