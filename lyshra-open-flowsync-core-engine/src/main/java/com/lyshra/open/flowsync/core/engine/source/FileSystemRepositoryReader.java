package com.lyshra.open.flowsync.core.engine.source;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.integration.contract.source.IRepositoryReader;
import com.lyshra.open.flowsync.integration.exception.WorkflowSourceReadException;
import com.lyshra.open.flowsync.integration.models.source.RepositoryWorkflowFile;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Repository reader over a local checkout.
 *
 * <p>Directory Structure:</p>
 * <pre>
 * {root}/
 *   └── {environmentId}/
 *       ├── aaaa-1111.json
 *       ├── aaaa-1111.meta.json   (optional companion metadata)
 *       └── nested/
 *           └── bbbb-2222.yaml
 * </pre>
 *
 * <p>Reported paths are relative to {@code root} and use {@code /} separators. A missing
 * environment directory lists nothing.</p>
 */
@Slf4j
public class FileSystemRepositoryReader implements IRepositoryReader {

    private final Path root;
    private final FlowSyncConfig config;
    private final ICommitReferenceResolver commitReferenceResolver;

    public FileSystemRepositoryReader(Path root, FlowSyncConfig config, ICommitReferenceResolver commitReferenceResolver) {
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.commitReferenceResolver = commitReferenceResolver;
    }

    @Override
    public Flux<RepositoryWorkflowFile> listWorkflowFiles(String tenantId, String environmentId) {
        return Flux.defer(() -> Flux.fromIterable(read(environmentId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<RepositoryWorkflowFile> read(String environmentId) {
        Path environmentDir = root.resolve(environmentId).normalize();
        if (!environmentDir.startsWith(root)) {
            throw new IllegalArgumentException("Environment id escapes the repository root: " + environmentId);
        }
        if (!Files.isDirectory(environmentDir)) {
            log.warn("No workflow directory for environment {} under {}", environmentId, root);
            return List.of();
        }
        String commitReference = commitReferenceResolver.resolve(root, environmentId);
        try (Stream<Path> files = Files.walk(environmentDir)) {
            List<Path> definitions = files
                    .filter(Files::isRegularFile)
                    .filter(this::isWorkflowDefinition)
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("Found {} workflow files for environment {} at {}", definitions.size(), environmentId, commitReference);
            return definitions.stream()
                    .map(file -> toWorkflowFile(file, commitReference))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new WorkflowSourceReadException(environmentDir.toString(), "Failed to list " + environmentDir, e);
        }
    }

    private boolean isWorkflowDefinition(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(config.getSidecarSuffix().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return config.getWorkflowFileExtensions().stream()
                .anyMatch(extension -> name.endsWith(extension.toLowerCase(Locale.ROOT)));
    }

    private RepositoryWorkflowFile toWorkflowFile(Path file, String commitReference) {
        Path sidecar = file.resolveSibling(stem(file) + config.getSidecarSuffix());
        boolean hasSidecar = Files.isRegularFile(sidecar);
        return RepositoryWorkflowFile.builder()
                .path(relative(file))
                .content(readString(file))
                .commitReference(commitReference)
                .sidecarPath(hasSidecar ? relative(sidecar) : null)
                .sidecarContent(hasSidecar ? readString(sidecar) : null)
                .build();
    }

    private String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkflowSourceReadException(relative(file), "Failed to read " + relative(file), e);
        }
    }

    private String relative(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int extension = name.lastIndexOf('.');
        return extension > 0 ? name.substring(0, extension) : name;
    }
}
