package com.lyshra.open.flowsync.core.engine.support;

import com.lyshra.open.flowsync.integration.contract.source.IRepositoryReader;
import com.lyshra.open.flowsync.integration.models.source.RepositoryWorkflowFile;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Repository reader serving in-memory files per environment.
 */
public class FakeRepositoryReader implements IRepositoryReader {

    private final Map<String, List<RepositoryWorkflowFile>> files = new ConcurrentHashMap<>();

    public FakeRepositoryReader put(String environmentId, RepositoryWorkflowFile file) {
        List<RepositoryWorkflowFile> list = files.computeIfAbsent(environmentId, key -> new ArrayList<>());
        list.removeIf(existing -> existing.getPath().equals(file.getPath()));
        list.add(file);
        return this;
    }

    public FakeRepositoryReader put(String environmentId, String path, String content) {
        return put(environmentId, RepositoryWorkflowFile.builder()
                .path(path)
                .content(content)
                .commitReference("c0ffee")
                .build());
    }

    @Override
    public Flux<RepositoryWorkflowFile> listWorkflowFiles(String tenantId, String environmentId) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(files.getOrDefault(environmentId, List.of()))));
    }
}
