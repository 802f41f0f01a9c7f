package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.contract.store.IContentHashRegistryStore;
import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.converter.FlowSyncDocumentConverter;
import com.lyshra.open.flowsync.mongodb.plugin.error.MongoErrorTranslator;
import com.mongodb.client.model.Sorts;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * First-seen normalized payload per content hash, keyed by the hash itself.
 */
@Slf4j
public class MongoContentHashRegistryStore extends AbstractMongoStore implements IContentHashRegistryStore {

    public static final String COLLECTION = "content_hash_registry";

    public MongoContentHashRegistryStore(MongoClientManager clientManager) {
        super(clientManager, COLLECTION);
    }

    @Override
    public Mono<Boolean> putIfAbsent(ContentHashRegistryEntry entry) {
        return write("insert", () -> collection().insertOne(FlowSyncDocumentConverter.toDocument(entry)))
                .map(result -> true)
                .onErrorResume(MongoErrorTranslator::isDuplicateKey, duplicate -> Mono.just(false));
    }

    @Override
    public Flux<ContentHashRegistryEntry> findAll() {
        return findMany("findAll", new Document(), Sorts.ascending(FlowSyncDocumentConverter.ID),
                FlowSyncDocumentConverter::toContentHashRegistryEntry);
    }

    @Override
    public Mono<Void> deleteAll() {
        return write("deleteAll", () -> collection().deleteMany(new Document()))
                .doOnNext(result -> log.info("Cleared {} content hash registry entries", result.getDeletedCount()))
                .then();
    }
}
