package com.lyshra.open.flowsync.mongodb.plugin.store;

import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.mongodb.plugin.connection.MongoClientManager;
import com.lyshra.open.flowsync.mongodb.plugin.error.FlowSyncMongoErrorCodes;
import com.lyshra.open.flowsync.mongodb.plugin.error.MongoErrorTranslator;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.reactivestreams.client.MongoCollection;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared plumbing of the MongoDB stores: collection lookup, error translation and the
 * {@code Optional} wrapping used by every find.
 */
abstract class AbstractMongoStore {

    protected static final ReplaceOptions UPSERT = new ReplaceOptions().upsert(true);

    private final MongoClientManager clientManager;
    private final String collectionName;

    protected AbstractMongoStore(MongoClientManager clientManager, String baseCollectionName) {
        this.clientManager = clientManager;
        this.collectionName = clientManager.getConfig().collectionName(baseCollectionName);
    }

    public String getCollectionName() {
        return collectionName;
    }

    protected MongoCollection<Document> collection() {
        return clientManager.getDatabase().getCollection(collectionName);
    }

    protected <T> Mono<Optional<T>> findOne(String operation, Bson filter, Function<Document, T> mapper) {
        return Mono.defer(() -> Mono.from(collection().find(filter).first()))
                .map(document -> Optional.of(convert(document, mapper)))
                .defaultIfEmpty(Optional.empty())
                .onErrorMap(error -> MongoErrorTranslator.translate(error, operation, collectionName, false));
    }

    protected <T> Flux<T> findMany(String operation, Bson filter, Bson sort, Function<Document, T> mapper) {
        return Flux.defer(() -> Flux.from(collection().find(filter).sort(sort)))
                .map(document -> convert(document, mapper))
                .onErrorMap(error -> MongoErrorTranslator.translate(error, operation, collectionName, false));
    }

    private <T> T convert(Document document, Function<Document, T> mapper) {
        try {
            return mapper.apply(document);
        } catch (RuntimeException e) {
            throw new FlowSyncStorageException(FlowSyncMongoErrorCodes.DOCUMENT_CONVERSION_FAILED,
                    Map.of("collection", collectionName, "message", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Runs a write. Duplicate-key failures are left untranslated for the caller to map.
     */
    protected <T> Mono<T> write(String operation, Supplier<Publisher<T>> publisher) {
        return Mono.defer(() -> Mono.from(publisher.get()))
                .onErrorMap(error -> !MongoErrorTranslator.isDuplicateKey(error),
                        error -> MongoErrorTranslator.translate(error, operation, collectionName, true));
    }
}
