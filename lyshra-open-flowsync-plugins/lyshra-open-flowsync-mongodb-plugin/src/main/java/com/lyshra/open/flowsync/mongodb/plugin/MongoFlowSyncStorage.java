package com.lyshra.open.flowsync.mongodb.plugin;

import com.lyshra.open.flowsync.mongodb.plugin.config.MongoConnectionConfig;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.store.MongoCanonicalWorkflowStore;
import com.lyshra.open.flowsync.mongodb.plugin.store.MongoContentHashRegistryStore;
import com.lyshra.open.flowsync.mongodb.plugin.store.MongoEnvironmentMapStore;
import com.lyshra.open.flowsync.mongodb.plugin.store.MongoGitStateStore;
import com.lyshra.open.flowsync.mongodb.plugin.store.MongoIndexInitializer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point of the MongoDB persistence plugin.
 * <p>
 * Bundles the four stores over one shared client. Call {@link #initialize()} once before
 * the first sync so the unique indexes exist, then hand the stores to the engine:
 * <pre>{@code
 * MongoFlowSyncStorage storage = new MongoFlowSyncStorage(MongoConnectionConfig.localDefaults("flowsync"));
 * storage.initialize().block();
 * FlowSyncFacade facade = FlowSyncFacade.builder()
 *         .canonicalWorkflowStore(storage.getCanonicalWorkflowStore())
 *         .gitStateStore(storage.getGitStateStore())
 *         .environmentMapStore(storage.getEnvironmentMapStore())
 *         .contentHashRegistryStore(storage.getContentHashRegistryStore())
 *         ...
 * }</pre>
 */
@Slf4j
@Getter
public class MongoFlowSyncStorage implements AutoCloseable {

    private final MongoClientManager clientManager;
    private final MongoCanonicalWorkflowStore canonicalWorkflowStore;
    private final MongoGitStateStore gitStateStore;
    private final MongoEnvironmentMapStore environmentMapStore;
    private final MongoContentHashRegistryStore contentHashRegistryStore;

    public MongoFlowSyncStorage(MongoConnectionConfig config) {
        this(new MongoClientManager(config));
    }

    public MongoFlowSyncStorage(MongoClientManager clientManager) {
        this.clientManager = clientManager;
        this.canonicalWorkflowStore = new MongoCanonicalWorkflowStore(clientManager);
        this.gitStateStore = new MongoGitStateStore(clientManager);
        this.environmentMapStore = new MongoEnvironmentMapStore(clientManager);
        this.contentHashRegistryStore = new MongoContentHashRegistryStore(clientManager);
    }

    public Mono<Void> initialize() {
        return new MongoIndexInitializer(clientManager).createIndexes()
                .doOnSuccess(ignored -> log.info("MongoDB flow sync storage ready on database {}",
                        clientManager.getConfig().getDatabase()));
    }

    @Override
    public void close() {
        clientManager.close();
    }
}
